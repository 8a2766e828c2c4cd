package com.empires.dto;

import com.empires.engine.ActionEffects;
import com.empires.engine.ActionResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for the outcome of a game action.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ActionResultDTO {

    private String action;
    private boolean success;
    private String errorCode;
    private String message;
    private boolean retryable;
    private ActionEffects effects;
    private GameStateDTO state;

    public static ActionResultDTO fromResult(ActionResult result) {
        return ActionResultDTO.builder()
                .action(result.kind().keyPrefix())
                .success(result.success())
                .errorCode(result.error() != null ? result.error().name() : null)
                .message(result.message())
                .retryable(result.error() != null && result.error().isRetryable())
                .effects(result.effects())
                .state(result.state())
                .build();
    }
}
