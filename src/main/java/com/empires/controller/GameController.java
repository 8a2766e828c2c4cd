package com.empires.controller;

import com.empires.ai.AiTurnService;
import com.empires.dto.ActionResultDTO;
import com.empires.dto.AttackCityRequest;
import com.empires.dto.AttackUnitRequest;
import com.empires.dto.CreateGameRequest;
import com.empires.dto.EndTurnRequest;
import com.empires.dto.GameStateDTO;
import com.empires.dto.MoveUnitRequest;
import com.empires.dto.TurnRecordDTO;
import com.empires.engine.ActionRequest;
import com.empires.engine.ActionResult;
import com.empires.engine.ErrorKind;
import com.empires.engine.TurnEngine;
import com.empires.grid.GridPosition;
import com.empires.model.Game;
import com.empires.service.GameQueryService;
import com.empires.service.GameSetupService;
import com.empires.websocket.GameWebSocketHandler;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API controller for games and game actions.
 */
@RestController
@RequestMapping("/api/games")
@RequiredArgsConstructor
@Slf4j
@CrossOrigin(origins = "*")
public class GameController {

    static final String IDEMPOTENCY_HEADER = "X-Idempotency-Key";

    private final GameSetupService gameSetupService;
    private final GameQueryService gameQueryService;
    private final TurnEngine turnEngine;
    private final AiTurnService aiTurnService;
    private final GameWebSocketHandler webSocketHandler;

    /**
     * Create a new game against AI opponents.
     */
    @PostMapping
    public ResponseEntity<GameStateDTO> createGame(@Valid @RequestBody CreateGameRequest request) {
        log.info("Creating new game on map {}", request.getMapCode());
        Game game = gameSetupService.createGame(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(gameQueryService.getGameState(game.getId()));
    }

    @GetMapping("/{gameId}")
    public ResponseEntity<GameStateDTO> getGame(@PathVariable String gameId) {
        return ResponseEntity.ok(gameQueryService.getGameState(gameId));
    }

    @GetMapping("/{gameId}/turns")
    public ResponseEntity<List<TurnRecordDTO>> getTurns(@PathVariable String gameId) {
        return ResponseEntity.ok(gameQueryService.getTurnHistory(gameId));
    }

    @PostMapping("/{gameId}/actions/move")
    public ResponseEntity<ActionResultDTO> moveUnit(@PathVariable String gameId,
                                                    @Valid @RequestBody MoveUnitRequest request,
                                                    @RequestHeader(value = IDEMPOTENCY_HEADER, required = false) String idempotencyKey) {
        ActionRequest action = ActionRequest.move(request.getParticipantId(), request.getUnitId(),
                GridPosition.of(request.getToRow(), request.getToCol()),
                tokenOf(request.getIdempotencyKey(), idempotencyKey));
        return execute(gameId, action);
    }

    @PostMapping("/{gameId}/actions/attack-unit")
    public ResponseEntity<ActionResultDTO> attackUnit(@PathVariable String gameId,
                                                      @Valid @RequestBody AttackUnitRequest request,
                                                      @RequestHeader(value = IDEMPOTENCY_HEADER, required = false) String idempotencyKey) {
        ActionRequest action = ActionRequest.attackUnit(request.getParticipantId(), request.getAttackerUnitId(),
                request.getTargetUnitId(), tokenOf(request.getIdempotencyKey(), idempotencyKey));
        return execute(gameId, action);
    }

    @PostMapping("/{gameId}/actions/attack-city")
    public ResponseEntity<ActionResultDTO> attackCity(@PathVariable String gameId,
                                                      @Valid @RequestBody AttackCityRequest request,
                                                      @RequestHeader(value = IDEMPOTENCY_HEADER, required = false) String idempotencyKey) {
        ActionRequest action = ActionRequest.attackCity(request.getParticipantId(), request.getAttackerUnitId(),
                request.getTargetCityId(), tokenOf(request.getIdempotencyKey(), idempotencyKey));
        return execute(gameId, action);
    }

    /**
     * End the caller's turn. If the next participant is an AI, its turn starts in the background.
     */
    @PostMapping("/{gameId}/actions/end-turn")
    public ResponseEntity<ActionResultDTO> endTurn(@PathVariable String gameId,
                                                   @Valid @RequestBody EndTurnRequest request,
                                                   @RequestHeader(value = IDEMPOTENCY_HEADER, required = false) String idempotencyKey) {
        ResponseEntity<ActionResultDTO> response = execute(gameId,
                ActionRequest.endTurn(request.getParticipantId(), tokenOf(request.getIdempotencyKey(), idempotencyKey)));
        if (response.getStatusCode().is2xxSuccessful()) {
            aiTurnService.checkAndTriggerAiTurn(gameId);
        }
        return response;
    }

    private ResponseEntity<ActionResultDTO> execute(String gameId, ActionRequest action) {
        ActionResult result = turnEngine.execute(gameId, action);
        ActionResultDTO body = ActionResultDTO.fromResult(result);
        if (result.success()) {
            webSocketHandler.broadcastActionResult(gameId, body);
            if (result.effects() != null && result.effects().gameFinished()) {
                webSocketHandler.broadcastGameOver(gameId, result.state().getWinnerParticipantId());
            }
            return ResponseEntity.ok(body);
        }
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(statusOf(result.error()));
        if (result.error() == ErrorKind.TURN_BUSY) {
            builder.header("Retry-After", "1");
        }
        return builder.body(body);
    }

    static int statusOf(ErrorKind error) {
        return switch (error) {
            case NOT_PLAYER_TURN, TURN_BUSY, NO_ACTIONS_LEFT -> HttpStatus.CONFLICT.value();
            case OUT_OF_RANGE, INVALID_TARGET, SCHEMA_MISMATCH -> 422;
        };
    }

    private static String tokenOf(String fromBody, String fromHeader) {
        return fromBody != null && !fromBody.isBlank() ? fromBody : fromHeader;
    }
}
