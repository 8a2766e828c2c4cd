package com.empires.service;

import com.empires.config.MapLoader;
import com.empires.engine.GameBoard;
import com.empires.engine.GameStore;
import com.empires.exception.GameNotFoundException;
import com.empires.model.Game;
import com.empires.repository.CityRepository;
import com.empires.repository.CityResourceRepository;
import com.empires.repository.GameRepository;
import com.empires.repository.ParticipantRepository;
import com.empires.repository.TileResourceRepository;
import com.empires.repository.TurnRecordRepository;
import com.empires.repository.UnitRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.function.Function;

/**
 * {@link GameStore} backed by the JPA repositories. Each call runs in its own transaction.
 */
@Component
@Slf4j
public class JpaGameStore implements GameStore {

    private final GameRepository gameRepository;
    private final ParticipantRepository participantRepository;
    private final UnitRepository unitRepository;
    private final CityRepository cityRepository;
    private final CityResourceRepository cityResourceRepository;
    private final TileResourceRepository tileResourceRepository;
    private final TurnRecordRepository turnRecordRepository;
    private final MapLoader mapLoader;
    private final TransactionTemplate transactionTemplate;

    public JpaGameStore(GameRepository gameRepository,
                        ParticipantRepository participantRepository,
                        UnitRepository unitRepository,
                        CityRepository cityRepository,
                        CityResourceRepository cityResourceRepository,
                        TileResourceRepository tileResourceRepository,
                        TurnRecordRepository turnRecordRepository,
                        MapLoader mapLoader,
                        PlatformTransactionManager transactionManager) {
        this.gameRepository = gameRepository;
        this.participantRepository = participantRepository;
        this.unitRepository = unitRepository;
        this.cityRepository = cityRepository;
        this.cityResourceRepository = cityResourceRepository;
        this.tileResourceRepository = tileResourceRepository;
        this.turnRecordRepository = turnRecordRepository;
        this.mapLoader = mapLoader;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public Optional<Game> findGame(String gameId) {
        return transactionTemplate.execute(status -> gameRepository.findById(gameId));
    }

    @Override
    public boolean tryBeginAction(String gameId) {
        Integer updated = transactionTemplate.execute(status ->
                gameRepository.tryBeginAction(gameId, LocalDateTime.now()));
        return updated != null && updated == 1;
    }

    @Override
    public void endAction(String gameId) {
        transactionTemplate.executeWithoutResult(status -> gameRepository.endAction(gameId));
    }

    @Override
    public <T> T inTransaction(String gameId, Function<GameBoard, T> work) {
        return transactionTemplate.execute(status -> {
            GameBoard board = load(gameId);
            T result = work.apply(board);
            save(board);
            return result;
        });
    }

    private GameBoard load(String gameId) {
        Game game = gameRepository.findById(gameId).orElseThrow(() -> new GameNotFoundException(gameId));
        return new GameBoard(game,
                mapLoader.getMap(game.getMapCode()),
                participantRepository.findByGameIdOrderByTurnOrder(gameId),
                unitRepository.findByGameId(gameId),
                cityRepository.findByGameId(gameId),
                cityResourceRepository.findByGameId(gameId),
                tileResourceRepository.findByGameId(gameId));
    }

    private void save(GameBoard board) {
        gameRepository.save(board.getGame());
        participantRepository.saveAll(board.getParticipants());
        if (!board.getRemovedUnitIds().isEmpty()) {
            unitRepository.deleteAllById(board.getRemovedUnitIds());
        }
        unitRepository.saveAll(board.getUnits());
        cityRepository.saveAll(board.getCities());
        cityResourceRepository.saveAll(board.getCityResources());
        tileResourceRepository.saveAll(board.getTileResources());
        turnRecordRepository.saveAll(board.getNewTurnRecords());
        log.debug("Saved board of game {} ({} unit(s) removed)", board.getGame().getId(),
                board.getRemovedUnitIds().size());
    }
}
