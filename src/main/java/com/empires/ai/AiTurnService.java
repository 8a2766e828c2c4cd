package com.empires.ai;

import com.empires.dto.ActionResultDTO;
import com.empires.engine.ActionRequest;
import com.empires.engine.ActionResult;
import com.empires.engine.ErrorKind;
import com.empires.engine.GameBoard;
import com.empires.engine.TurnEngine;
import com.empires.model.Game;
import com.empires.model.Participant;
import com.empires.model.Unit;
import com.empires.service.GameQueryService;
import com.empires.websocket.GameWebSocketHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Plays the turns of AI participants. Every decision goes through {@link TurnEngine},
 * so AI and human actions are subject to the same guard and rules.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AiTurnService {

    private static final int MAX_BUSY_RETRIES = 5;

    private final TurnEngine turnEngine;
    private final GameQueryService gameQueryService;
    private final AiStrategy strategy;
    private final GameWebSocketHandler webSocketHandler;

    private final ConcurrentHashMap<String, ReentrantLock> gameLocks = new ConcurrentHashMap<>();

    @Value("${game.ai.think-delay-ms:500}")
    private long thinkDelayMs;

    /**
     * Plays every consecutive AI turn starting from the current one. Returns immediately when
     * the active participant is human or another run for the same game is in progress.
     */
    @Async
    public void checkAndTriggerAiTurn(String gameId) {
        ReentrantLock lock = gameLocks.computeIfAbsent(gameId, id -> new ReentrantLock());
        if (!lock.tryLock()) {
            log.info("AI turn already running for game {}", gameId);
            return;
        }
        try {
            Optional<Participant> aiParticipant = activeAiParticipant(gameId);
            while (aiParticipant.isPresent()) {
                if (!playTurn(gameId, aiParticipant.get())) {
                    break;
                }
                aiParticipant = activeAiParticipant(gameId);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("AI turn interrupted for game {}", gameId);
        } catch (RuntimeException e) {
            log.error("Error executing AI turn for game {}", gameId, e);
        } finally {
            lock.unlock();
            if (!lock.hasQueuedThreads()) {
                gameLocks.remove(gameId, lock);
            }
        }
    }

    /**
     * @return whether the turn was handed on and the game is still running
     */
    boolean playTurn(String gameId, Participant participant) throws InterruptedException {
        log.info("{} starting turn in game {}", participant.getDisplayName(), gameId);
        List<String> unitIds = gameQueryService.getBoard(gameId).unitsOf(participant.getId()).stream()
                .map(Unit::getId)
                .toList();

        for (String unitId : unitIds) {
            pause();
            GameBoard board = gameQueryService.getBoard(gameId);
            Optional<Unit> unit = board.unit(unitId).filter(u -> !u.isActed());
            if (unit.isEmpty()) {
                continue;
            }
            AiDecision decision = strategy.decide(board, unit.get());
            Optional<ActionRequest> request = toRequest(participant.getId(), decision);
            if (request.isEmpty()) {
                continue;
            }
            ActionResult result = executeWithRetry(gameId, request.get());
            if (!result.success()) {
                log.debug("AI decision {} rejected in game {}: {}", decision.type(), gameId, result.error());
                continue;
            }
            webSocketHandler.broadcastActionResult(gameId, ActionResultDTO.fromResult(result));
            if (result.effects() != null && result.effects().gameFinished()) {
                webSocketHandler.broadcastGameOver(gameId, result.state().getWinnerParticipantId());
                log.info("Game {} ended during {}'s turn", gameId, participant.getDisplayName());
                return false;
            }
        }

        pause();
        ActionResult ended = executeWithRetry(gameId, ActionRequest.endTurn(participant.getId(), null));
        if (!ended.success()) {
            log.warn("{} could not end its turn in game {}: {}", participant.getDisplayName(), gameId, ended.error());
            return false;
        }
        webSocketHandler.broadcastActionResult(gameId, ActionResultDTO.fromResult(ended));
        webSocketHandler.broadcastAiTurnEnd(gameId, participant.getDisplayName());
        log.info("{} completed turn in game {}", participant.getDisplayName(), gameId);
        return true;
    }

    private ActionResult executeWithRetry(String gameId, ActionRequest request) throws InterruptedException {
        ActionResult result = turnEngine.execute(gameId, request);
        for (int attempt = 1; attempt < MAX_BUSY_RETRIES && result.error() == ErrorKind.TURN_BUSY; attempt++) {
            Thread.sleep(Math.max(thinkDelayMs, 50));
            result = turnEngine.execute(gameId, request);
        }
        return result;
    }

    private Optional<Participant> activeAiParticipant(String gameId) {
        Game game = gameQueryService.getGame(gameId);
        if (!game.isActive() || game.getActiveParticipantId() == null) {
            return Optional.empty();
        }
        return gameQueryService.getBoard(gameId).participant(game.getActiveParticipantId())
                .filter(Participant::isAi);
    }

    private static Optional<ActionRequest> toRequest(String participantId, AiDecision decision) {
        return switch (decision.type()) {
            case ATTACK_UNIT -> Optional.of(ActionRequest.attackUnit(participantId, decision.unitId(), decision.targetId(), null));
            case ATTACK_CITY -> Optional.of(ActionRequest.attackCity(participantId, decision.unitId(), decision.targetId(), null));
            case MOVE -> Optional.of(ActionRequest.move(participantId, decision.unitId(), decision.destination(), null));
            case HOLD -> Optional.empty();
        };
    }

    private void pause() throws InterruptedException {
        if (thinkDelayMs > 0) {
            Thread.sleep(thinkDelayMs);
        }
    }
}
