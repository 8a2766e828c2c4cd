package com.empires.engine;

import com.empires.grid.GridPosition;

/**
 * A participant's request to mutate a game. Only the fields relevant to {@link #kind()} are set.
 *
 * @param idempotencyToken client-chosen token; blank means the request is not deduplicated
 */
public record ActionRequest(
        ActionKind kind,
        String participantId,
        String unitId,
        GridPosition destination,
        String targetUnitId,
        String targetCityId,
        String idempotencyToken
) {

    public static ActionRequest move(String participantId, String unitId, GridPosition destination, String token) {
        return new ActionRequest(ActionKind.MOVE_UNIT, participantId, unitId, destination, null, null, token);
    }

    public static ActionRequest attackUnit(String participantId, String attackerId, String targetUnitId, String token) {
        return new ActionRequest(ActionKind.ATTACK_UNIT, participantId, attackerId, null, targetUnitId, null, token);
    }

    public static ActionRequest attackCity(String participantId, String attackerId, String targetCityId, String token) {
        return new ActionRequest(ActionKind.ATTACK_CITY, participantId, attackerId, null, null, targetCityId, token);
    }

    public static ActionRequest endTurn(String participantId, String token) {
        return new ActionRequest(ActionKind.END_TURN, participantId, null, null, null, null, token);
    }

    public boolean hasIdempotencyToken() {
        return idempotencyToken != null && !idempotencyToken.isBlank();
    }
}
