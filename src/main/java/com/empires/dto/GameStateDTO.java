package com.empires.dto;

import com.empires.model.GameStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Snapshot of a game as sent to clients after every committed action.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GameStateDTO {

    private String gameId;
    private String mapCode;
    private int mapSchemaVersion;
    private GameStatus status;
    private int turnNo;
    private String activeParticipantId;
    private boolean turnInProgress;
    private List<ParticipantDTO> participants;
    private List<UnitDTO> units;
    private List<CityDTO> cities;
    private String winnerParticipantId;
    private LocalDateTime startedAt;
    private LocalDateTime lastTurnAt;
    private LocalDateTime finishedAt;
}
