package com.empires.engine;

/**
 * The mutating actions a participant can take. The key prefix scopes idempotency keys per action.
 */
public enum ActionKind {
    MOVE_UNIT("move-unit"),
    ATTACK_UNIT("attack-unit"),
    ATTACK_CITY("attack-city"),
    END_TURN("end-turn");

    private final String keyPrefix;

    ActionKind(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public String keyPrefix() {
        return keyPrefix;
    }
}
