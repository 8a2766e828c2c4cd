package com.empires.service;

import com.empires.config.UnitCatalog;
import com.empires.dto.CityDTO;
import com.empires.dto.GameStateDTO;
import com.empires.dto.ParticipantDTO;
import com.empires.dto.UnitDTO;
import com.empires.engine.GameBoard;
import com.empires.grid.GridPosition;
import com.empires.model.City;
import com.empires.model.Game;
import com.empires.model.GameStatus;
import com.empires.model.Unit;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds the client-facing snapshot of a game board.
 */
@Component
@RequiredArgsConstructor
public class GameStateProjector {

    private final UnitCatalog unitCatalog;

    public GameStateDTO project(GameBoard board) {
        Game game = board.getGame();
        return GameStateDTO.builder()
                .gameId(game.getId())
                .mapCode(game.getMapCode())
                .mapSchemaVersion(game.getMapSchemaVersion())
                .status(game.getStatus())
                .turnNo(game.getTurnNo())
                .activeParticipantId(game.getActiveParticipantId())
                .turnInProgress(game.isTurnInProgress())
                .participants(board.getParticipants().stream().map(ParticipantDTO::fromParticipant).toList())
                .units(board.getUnits().stream().map(u -> toDto(board, u)).toList())
                .cities(board.getCities().stream().map(c -> toDto(board, c)).toList())
                .winnerParticipantId(winnerOf(board))
                .startedAt(game.getStartedAt())
                .lastTurnAt(game.getLastTurnAt())
                .finishedAt(game.getFinishedAt())
                .build();
    }

    private UnitDTO toDto(GameBoard board, Unit unit) {
        GridPosition position = board.positionOf(unit);
        return UnitDTO.builder()
                .id(unit.getId())
                .participantId(unit.getParticipantId())
                .typeCode(unit.getTypeCode())
                .tileId(unit.getTileId())
                .row(position.row())
                .col(position.col())
                .hp(unit.getHp())
                .maxHp(unitCatalog.get(unit.getTypeCode()).health())
                .hasActed(unit.isActed())
                .build();
    }

    private static CityDTO toDto(GameBoard board, City city) {
        GridPosition position = board.positionOf(city);
        return CityDTO.builder()
                .id(city.getId())
                .participantId(city.getParticipantId())
                .tileId(city.getTileId())
                .row(position.row())
                .col(position.col())
                .hp(city.getHp())
                .maxHp(city.getMaxHp())
                .resources(board.stocksOf(city.getId()))
                .build();
    }

    private static String winnerOf(GameBoard board) {
        if (board.getGame().getStatus() != GameStatus.FINISHED) {
            return null;
        }
        return board.getCities().stream().map(City::getParticipantId).findFirst().orElse(null);
    }
}
