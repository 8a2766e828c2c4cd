package com.empires.engine;

import com.empires.exception.GameNotFoundException;
import com.empires.model.Game;
import com.empires.service.GameStateProjector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Serializes and executes mutating actions for a game.
 * <p>
 * An action runs as: idempotency lookup, turn check, acquisition of the per-game
 * {@code turnInProgress} guard, then rules, save and projection in a single transaction.
 * Committed results are remembered for replay before the guard is released, which happens in every outcome.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TurnEngine {

    private final GameStore gameStore;
    private final IdempotencyStore idempotencyStore;
    private final BoardActions boardActions;
    private final GameStateProjector projector;

    /**
     * @throws GameNotFoundException if the game does not exist
     */
    public ActionResult execute(String gameId, ActionRequest request) {
        ActionKind kind = request.kind();
        String key = request.hasIdempotencyToken()
                ? IdempotencyKeys.of(kind, gameId, request.idempotencyToken())
                : null;

        if (key != null) {
            Optional<ActionResult> cached = idempotencyStore.tryGet(key);
            if (cached.isPresent()) {
                log.debug("Replaying stored result for {}", key);
                return cached.get();
            }
        }

        Game game = gameStore.findGame(gameId).orElseThrow(() -> new GameNotFoundException(gameId));
        if (!isActorsTurn(game, request.participantId())) {
            log.debug("Rejected {} in game {}: not {}'s turn", kind, gameId, request.participantId());
            return ActionResult.failure(kind, ErrorKind.NOT_PLAYER_TURN, "It is not this participant's turn");
        }

        if (!gameStore.tryBeginAction(gameId)) {
            log.debug("Rejected {} in game {}: another action is in progress", kind, gameId);
            return ActionResult.failure(kind, ErrorKind.TURN_BUSY, "Another action is in progress, retry shortly");
        }

        try {
            ActionResult result = gameStore.inTransaction(gameId, board -> {
                Game current = board.getGame();
                if (!isActorsTurn(current, request.participantId())) {
                    throw new ActionRejectedException(ErrorKind.NOT_PLAYER_TURN, "It is not this participant's turn");
                }
                ActionEffects effects = apply(board, request);
                current.setTurnInProgress(false);
                current.setTurnInProgressSince(null);
                return ActionResult.ok(kind, effects, projector.project(board));
            });
            log.info("Committed {} in game {} by {}", kind, gameId, request.participantId());
            // stored while the guard is still held so a retry never re-runs a committed action
            return key != null ? idempotencyStore.putIfAbsent(key, result) : result;
        } catch (ActionRejectedException e) {
            log.debug("Rejected {} in game {}: {} {}", kind, gameId, e.getErrorKind(), e.getMessage());
            return ActionResult.failure(kind, e.getErrorKind(), e.getMessage());
        } finally {
            gameStore.endAction(gameId);
        }
    }

    private ActionEffects apply(GameBoard board, ActionRequest request) {
        String actor = request.participantId();
        return switch (request.kind()) {
            case MOVE_UNIT -> boardActions.move(board, actor, request.unitId(), request.destination());
            case ATTACK_UNIT -> boardActions.attackUnit(board, actor, request.unitId(), request.targetUnitId());
            case ATTACK_CITY -> boardActions.attackCity(board, actor, request.unitId(), request.targetCityId());
            case END_TURN -> boardActions.endTurn(board, actor);
        };
    }

    private static boolean isActorsTurn(Game game, String participantId) {
        return game.isActive()
                && participantId != null
                && participantId.equals(game.getActiveParticipantId());
    }
}
