package com.empires.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EndTurnRequest {

    @NotBlank(message = "Participant id is required")
    private String participantId;

    private String idempotencyKey;
}
