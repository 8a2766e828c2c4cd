package com.empires.service;

import com.empires.config.MapLoader;
import com.empires.config.UnitCatalog;
import com.empires.dto.CreateGameRequest;
import com.empires.exception.MapSchemaMismatchException;
import com.empires.grid.HexGrid;
import com.empires.model.City;
import com.empires.model.CityResource;
import com.empires.model.Game;
import com.empires.model.GameMap;
import com.empires.model.GameStatus;
import com.empires.model.Participant;
import com.empires.model.ParticipantKind;
import com.empires.model.Unit;
import com.empires.repository.CityRepository;
import com.empires.repository.CityResourceRepository;
import com.empires.repository.GameRepository;
import com.empires.repository.ParticipantRepository;
import com.empires.repository.UnitRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import tools.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GameSetupServiceTest {

    @Mock private GameRepository gameRepository;
    @Mock private ParticipantRepository participantRepository;
    @Mock private UnitRepository unitRepository;
    @Mock private CityRepository cityRepository;
    @Mock private CityResourceRepository cityResourceRepository;

    private GameSetupService service;
    private GameMap map;

    private final List<Participant> participants = new ArrayList<>();
    private final List<Unit> units = new ArrayList<>();
    private final List<City> cities = new ArrayList<>();
    private final List<CityResource> stocks = new ArrayList<>();

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        MapLoader mapLoader = new MapLoader(objectMapper);
        ReflectionTestUtils.setField(mapLoader, "externalDir", "target/no-external-maps");
        mapLoader.loadMaps();
        map = mapLoader.getMap("standard-15x20");
        UnitCatalog unitCatalog = new UnitCatalog(objectMapper);
        unitCatalog.loadDefinitions();

        service = new GameSetupService(gameRepository, participantRepository, unitRepository, cityRepository,
                cityResourceRepository, mapLoader, unitCatalog);

        lenient().when(gameRepository.save(any(Game.class))).thenAnswer(inv -> {
            Game game = inv.getArgument(0);
            if (game.getId() == null) {
                game.setId("game-1");
            }
            return game;
        });
        lenient().when(participantRepository.save(any(Participant.class))).thenAnswer(inv -> {
            Participant participant = inv.getArgument(0);
            participant.setId("p" + participants.size());
            participants.add(participant);
            return participant;
        });
        lenient().when(unitRepository.save(any(Unit.class))).thenAnswer(inv -> {
            units.add(inv.getArgument(0));
            return inv.getArgument(0);
        });
        lenient().when(cityRepository.save(any(City.class))).thenAnswer(inv -> {
            City city = inv.getArgument(0);
            city.setId("c" + cities.size());
            cities.add(city);
            return city;
        });
        lenient().when(cityResourceRepository.saveAll(anyList())).thenAnswer(inv -> {
            stocks.addAll(inv.getArgument(0));
            return inv.getArgument(0);
        });
    }

    private static CreateGameRequest request(int aiCount, Long seed) {
        return CreateGameRequest.builder().aiCount(aiCount).seed(seed).build();
    }

    @Nested
    @DisplayName("createGame()")
    class CreateGameTests {

        @Test
        @DisplayName("should seat the human first and make them the active participant")
        void humanFirst() {
            Game game = service.createGame(request(1, 7L));

            assertEquals("game-1", game.getId());
            assertEquals(GameStatus.ACTIVE, game.getStatus());
            assertEquals(1, game.getTurnNo());
            assertEquals(7L, game.getRngSeed());
            assertEquals("standard-15x20", game.getMapCode());
            assertFalse(game.isTurnInProgress());

            assertEquals(2, participants.size());
            assertEquals(ParticipantKind.HUMAN, participants.get(0).getKind());
            assertEquals("Player", participants.get(0).getDisplayName());
            assertEquals("AI 1", participants.get(1).getDisplayName());
            assertEquals(participants.get(0).getId(), game.getActiveParticipantId());
        }

        @Test
        @DisplayName("should found one full-health city per seat on its start position")
        void citiesOnStartPositions() {
            service.createGame(request(3, 7L));

            assertEquals(4, cities.size());
            for (int seat = 0; seat < 4; seat++) {
                City city = cities.get(seat);
                assertEquals(participants.get(seat).getId(), city.getParticipantId());
                assertEquals(map.tileAt(map.getStartPositions().get(seat)).orElseThrow().id(), city.getTileId());
                assertEquals(100, city.getHp());
                assertEquals(100, city.getMaxHp());
            }
        }

        @Test
        @DisplayName("should give every city its starting resource stock")
        void startingStock() {
            service.createGame(request(1, 7L));

            assertEquals(8, stocks.size());
            List<CityResource> firstCity = stocks.stream().filter(r -> r.getCityId().equals("c0")).toList();
            assertEquals(List.of("iron", "stone", "wheat", "wood"),
                    firstCity.stream().map(CityResource::getResourceType).toList());
            assertEquals(List.of(0, 5, 5, 5), firstCity.stream().map(CityResource::getAmount).toList());
            assertTrue(stocks.stream().allMatch(r -> "game-1".equals(r.getGameId())));
        }

        @Test
        @DisplayName("should place a warrior on a land tile next to each city")
        void warriorNextToCity() {
            service.createGame(request(3, 11L));

            assertEquals(4, units.size());
            for (int seat = 0; seat < 4; seat++) {
                Unit unit = units.get(seat);
                var cityPosition = map.tile(cities.get(seat).getTileId()).position();
                var unitTile = map.tile(unit.getTileId());
                assertEquals("warrior", unit.getTypeCode());
                assertEquals(100, unit.getHp());
                assertFalse(unit.isActed());
                assertEquals(1, HexGrid.distance(cityPosition, unitTile.position()));
                assertFalse(unitTile.terrain().isWater());
            }
            assertEquals(4, units.stream().map(Unit::getTileId).distinct().count());
        }

        @Test
        @DisplayName("should place units identically for the same seed")
        void deterministicForSeed() {
            service.createGame(request(2, 99L));
            List<Integer> first = units.stream().map(Unit::getTileId).toList();
            units.clear();
            participants.clear();
            cities.clear();

            service.createGame(request(2, 99L));

            assertEquals(first, units.stream().map(Unit::getTileId).toList());
        }

        @Test
        @DisplayName("should reject more AI opponents than the map has seats for")
        void tooManyOpponents() {
            assertThrows(IllegalArgumentException.class, () -> service.createGame(request(4, 1L)));
            verify(gameRepository, never()).save(any());
        }

        @Test
        @DisplayName("should reject an unknown map")
        void unknownMap() {
            CreateGameRequest request = CreateGameRequest.builder().mapCode("atlantis").build();

            assertThrows(IllegalArgumentException.class, () -> service.createGame(request));
        }

        @Test
        @DisplayName("should refuse a map whose schema version is not accepted")
        void schemaMismatch() {
            ReflectionTestUtils.setField(service, "acceptedSchemaVersion", 2);

            MapSchemaMismatchException ex = assertThrows(MapSchemaMismatchException.class,
                    () -> service.createGame(request(1, 1L)));

            assertTrue(ex.getMessage().contains("standard-15x20"));
            verify(gameRepository, never()).save(any());
        }
    }
}
