package com.empires.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MoveUnitRequest {

    @NotBlank(message = "Participant id is required")
    private String participantId;

    @NotBlank(message = "Unit id is required")
    private String unitId;

    @NotNull(message = "Destination row is required")
    private Integer toRow;

    @NotNull(message = "Destination column is required")
    private Integer toCol;

    private String idempotencyKey;
}
