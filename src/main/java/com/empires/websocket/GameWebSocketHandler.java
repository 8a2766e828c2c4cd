package com.empires.websocket;

import com.empires.dto.ActionResultDTO;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Pushes game events to subscribers of {@code /topic/game/{gameId}}.
 * Broadcast failures are logged and never fail the action that triggered them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GameWebSocketHandler {

    static final String TOPIC_PREFIX = "/topic/game/";

    private final SimpMessagingTemplate messagingTemplate;

    /**
     * Broadcast the result of a committed action, including its post-action state.
     */
    public void broadcastActionResult(String gameId, ActionResultDTO result) {
        send(gameId, GameMessage.of("ACTION_RESULT", result));
    }

    public void broadcastAiTurnEnd(String gameId, String participantName) {
        send(gameId, GameMessage.of("AI_TURN_END", participantName));
    }

    public void broadcastGameOver(String gameId, String winnerParticipantId) {
        send(gameId, GameMessage.of("GAME_OVER", winnerParticipantId));
    }

    private void send(String gameId, GameMessage message) {
        try {
            messagingTemplate.convertAndSend(TOPIC_PREFIX + gameId, message);
            log.debug("Broadcast {} for game {}", message.getType(), gameId);
        } catch (RuntimeException e) {
            log.error("Error broadcasting {} for game {}", message.getType(), gameId, e);
        }
    }

    /**
     * Generic game message wrapper.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class GameMessage {
        private String type;
        private Object payload;
        private long timestamp;

        public static GameMessage of(String type, Object payload) {
            return GameMessage.builder()
                    .type(type)
                    .payload(payload)
                    .timestamp(System.currentTimeMillis())
                    .build();
        }
    }
}
