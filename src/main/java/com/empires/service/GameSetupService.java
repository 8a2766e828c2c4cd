package com.empires.service;

import com.empires.config.MapLoader;
import com.empires.config.UnitCatalog;
import com.empires.dto.CreateGameRequest;
import com.empires.exception.MapSchemaMismatchException;
import com.empires.grid.GridPosition;
import com.empires.grid.HexGrid;
import com.empires.model.City;
import com.empires.model.CityResource;
import com.empires.model.Game;
import com.empires.model.GameMap;
import com.empires.model.GameStatus;
import com.empires.model.Participant;
import com.empires.model.ParticipantKind;
import com.empires.model.Tile;
import com.empires.model.Unit;
import com.empires.repository.CityRepository;
import com.empires.repository.CityResourceRepository;
import com.empires.repository.GameRepository;
import com.empires.repository.ParticipantRepository;
import com.empires.repository.UnitRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Creates new games: one human and a number of AI participants, each starting with a city
 * on its seat's start position, a small resource stock and a warrior next to it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class GameSetupService {

    static final int INITIAL_CITY_HP = 100;
    static final String STARTING_UNIT = "warrior";
    static final Map<String, Integer> STARTING_STOCK = Map.of("wood", 5, "stone", 5, "wheat", 5, "iron", 0);

    private final GameRepository gameRepository;
    private final ParticipantRepository participantRepository;
    private final UnitRepository unitRepository;
    private final CityRepository cityRepository;
    private final CityResourceRepository cityResourceRepository;
    private final MapLoader mapLoader;
    private final UnitCatalog unitCatalog;

    @Value("${game.maps.accepted-schema-version:1}")
    private int acceptedSchemaVersion = 1;

    /**
     * @throws IllegalArgumentException   if the map is unknown or has too few start positions
     * @throws MapSchemaMismatchException if the map's schema version is not the accepted one
     */
    public Game createGame(CreateGameRequest request) {
        GameMap map = mapLoader.getMap(request.getMapCode());
        if (map.getSchemaVersion() != acceptedSchemaVersion) {
            throw new MapSchemaMismatchException(map.getCode(), map.getSchemaVersion(), acceptedSchemaVersion);
        }
        int seats = request.getAiCount() + 1;
        if (map.getStartPositions().size() < seats) {
            throw new IllegalArgumentException("Map " + map.getCode() + " supports at most "
                    + (map.getStartPositions().size() - 1) + " AI opponent(s)");
        }

        long seed = request.getSeed() != null ? request.getSeed() : ThreadLocalRandom.current().nextLong();
        Random random = new Random(seed);

        Game game = gameRepository.save(Game.builder()
                .mapCode(map.getCode())
                .mapSchemaVersion(map.getSchemaVersion())
                .turnNo(1)
                .status(GameStatus.ACTIVE)
                .turnInProgress(false)
                .rngSeed(seed)
                .startedAt(LocalDateTime.now())
                .build());

        Set<Integer> reserved = new HashSet<>();
        map.getStartPositions().stream().limit(seats).forEach(p -> reserved.add(map.tileAt(p).orElseThrow().id()));

        Participant human = null;
        for (int seat = 0; seat < seats; seat++) {
            boolean isHuman = seat == 0;
            Participant participant = participantRepository.save(Participant.builder()
                    .gameId(game.getId())
                    .kind(isHuman ? ParticipantKind.HUMAN : ParticipantKind.AI)
                    .displayName(isHuman ? request.getPlayerName() : "AI " + seat)
                    .turnOrder(seat)
                    .build());
            if (isHuman) {
                human = participant;
            }
            placeStartingAssets(game, participant, map, map.getStartPositions().get(seat), reserved, random);
        }

        game.setActiveParticipantId(human.getId());
        game = gameRepository.save(game);
        log.info("Created game {} on map {} with {} AI opponent(s), seed {}",
                game.getId(), map.getCode(), request.getAiCount(), seed);
        return game;
    }

    private void placeStartingAssets(Game game, Participant participant, GameMap map, GridPosition start,
                                     Set<Integer> reserved, Random random) {
        Tile cityTile = map.tileAt(start).orElseThrow();
        City city = cityRepository.save(City.builder()
                .gameId(game.getId())
                .participantId(participant.getId())
                .tileId(cityTile.id())
                .hp(INITIAL_CITY_HP)
                .maxHp(INITIAL_CITY_HP)
                .build());
        cityResourceRepository.saveAll(STARTING_STOCK.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> CityResource.builder()
                        .gameId(game.getId())
                        .cityId(city.getId())
                        .resourceType(e.getKey())
                        .amount(e.getValue())
                        .build())
                .toList());

        List<Tile> candidates = HexGrid.adjacentPositions(start, map.getWidth(), map.getHeight()).stream()
                .map(p -> map.tileAt(p).orElseThrow())
                .filter(t -> !t.terrain().isWater())
                .filter(t -> !reserved.contains(t.id()))
                .toList();
        // With no free land around the city, the warrior starts on the city tile itself.
        Tile unitTile = candidates.isEmpty() ? cityTile : candidates.get(random.nextInt(candidates.size()));
        reserved.add(unitTile.id());

        unitRepository.save(Unit.builder()
                .gameId(game.getId())
                .participantId(participant.getId())
                .typeCode(STARTING_UNIT)
                .tileId(unitTile.id())
                .hp(unitCatalog.get(STARTING_UNIT).health())
                .acted(false)
                .build());
    }
}
