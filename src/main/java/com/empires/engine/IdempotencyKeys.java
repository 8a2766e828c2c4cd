package com.empires.engine;

/**
 * Builds idempotency keys of the form {@code {action}:{gameId}:{token}}.
 */
public final class IdempotencyKeys {

    private IdempotencyKeys() {
    }

    public static String of(ActionKind kind, String gameId, String token) {
        return kind.keyPrefix() + ":" + gameId + ":" + token;
    }
}
