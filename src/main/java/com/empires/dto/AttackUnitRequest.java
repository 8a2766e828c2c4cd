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
public class AttackUnitRequest {

    @NotBlank(message = "Participant id is required")
    private String participantId;

    @NotBlank(message = "Attacker unit id is required")
    private String attackerUnitId;

    @NotBlank(message = "Target unit id is required")
    private String targetUnitId;

    private String idempotencyKey;
}
