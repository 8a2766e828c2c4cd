package com.empires.ai;

import com.empires.grid.GridPosition;

/**
 * What an AI participant wants one of its units to do.
 */
public record AiDecision(Type type, String unitId, String targetId, GridPosition destination) {

    public enum Type {
        ATTACK_UNIT,
        ATTACK_CITY,
        MOVE,
        HOLD
    }

    public static AiDecision attackUnit(String unitId, String targetUnitId) {
        return new AiDecision(Type.ATTACK_UNIT, unitId, targetUnitId, null);
    }

    public static AiDecision attackCity(String unitId, String targetCityId) {
        return new AiDecision(Type.ATTACK_CITY, unitId, targetCityId, null);
    }

    public static AiDecision move(String unitId, GridPosition destination) {
        return new AiDecision(Type.MOVE, unitId, null, destination);
    }

    public static AiDecision hold(String unitId) {
        return new AiDecision(Type.HOLD, unitId, null, null);
    }
}
