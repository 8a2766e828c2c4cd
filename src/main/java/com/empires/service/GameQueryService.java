package com.empires.service;

import com.empires.config.MapLoader;
import com.empires.dto.GameStateDTO;
import com.empires.dto.TurnRecordDTO;
import com.empires.engine.GameBoard;
import com.empires.exception.GameNotFoundException;
import com.empires.model.Game;
import com.empires.repository.CityRepository;
import com.empires.repository.CityResourceRepository;
import com.empires.repository.GameRepository;
import com.empires.repository.ParticipantRepository;
import com.empires.repository.TileResourceRepository;
import com.empires.repository.TurnRecordRepository;
import com.empires.repository.UnitRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Service responsible for game state queries and read-only operations.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class GameQueryService {

    private final GameRepository gameRepository;
    private final ParticipantRepository participantRepository;
    private final UnitRepository unitRepository;
    private final CityRepository cityRepository;
    private final CityResourceRepository cityResourceRepository;
    private final TileResourceRepository tileResourceRepository;
    private final TurnRecordRepository turnRecordRepository;
    private final MapLoader mapLoader;
    private final GameStateProjector projector;

    public Game getGame(String gameId) {
        return gameRepository.findById(gameId).orElseThrow(() -> new GameNotFoundException(gameId));
    }

    /**
     * Loads a read-only board. Changes made to it are never saved.
     */
    public GameBoard getBoard(String gameId) {
        Game game = getGame(gameId);
        return new GameBoard(game,
                mapLoader.getMap(game.getMapCode()),
                participantRepository.findByGameIdOrderByTurnOrder(gameId),
                unitRepository.findByGameId(gameId),
                cityRepository.findByGameId(gameId),
                cityResourceRepository.findByGameId(gameId),
                tileResourceRepository.findByGameId(gameId));
    }

    public GameStateDTO getGameState(String gameId) {
        return projector.project(getBoard(gameId));
    }

    public List<TurnRecordDTO> getTurnHistory(String gameId) {
        getGame(gameId);
        return turnRecordRepository.findByGameIdOrderByCommittedAtAsc(gameId).stream()
                .map(TurnRecordDTO::fromRecord)
                .toList();
    }
}
