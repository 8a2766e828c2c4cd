package com.empires.engine;

import com.empires.dto.GameStateDTO;

/**
 * Outcome of {@link TurnEngine#execute}. A successful result carries the post-commit state;
 * a failed one carries the error kind and never has side effects.
 */
public record ActionResult(
        ActionKind kind,
        boolean success,
        ErrorKind error,
        String message,
        ActionEffects effects,
        GameStateDTO state
) {

    public static ActionResult ok(ActionKind kind, ActionEffects effects, GameStateDTO state) {
        return new ActionResult(kind, true, null, null, effects, state);
    }

    public static ActionResult failure(ActionKind kind, ErrorKind error, String message) {
        return new ActionResult(kind, false, error, message, null, null);
    }
}
