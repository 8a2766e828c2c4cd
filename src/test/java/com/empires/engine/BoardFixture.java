package com.empires.engine;

import com.empires.config.MapDefinition;
import com.empires.config.UnitCatalog;
import com.empires.config.UnitDefinition;
import com.empires.grid.GridPosition;
import com.empires.model.City;
import com.empires.model.CityResource;
import com.empires.model.Game;
import com.empires.model.GameMap;
import com.empires.model.GameStatus;
import com.empires.model.Participant;
import com.empires.model.ParticipantKind;
import com.empires.model.TileResource;
import com.empires.model.Unit;
import tools.jackson.databind.ObjectMapper;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Small all-grassland game used by engine, AI and service tests. Next to the first start
 * position lie a wheat deposit at (0,1) and a wood deposit at (1,2); stone at (4,4) is out of reach.
 * The same entity instances back every board built from a fixture.
 */
public class BoardFixture {

    public static final int WIDTH = 10;
    public static final int HEIGHT = 8;
    public static final String GAME_ID = "game-1";

    public static final UnitDefinition WARRIOR = new UnitDefinition("warrior", false, 20, 10, 100, 2, 0, 0);
    public static final UnitDefinition SLINGER = new UnitDefinition("slinger", true, 15, 8, 60, 2, 1, 2);
    public static final UnitDefinition AXEMAN = new UnitDefinition("axeman", false, 25, 10, 100, 2, 0, 0);

    private static final GameMap MAP = GameMap.fromDefinition(new MapDefinition(
            "test-10x8", "Test", "all grassland", 1, WIDTH, HEIGHT,
            Collections.nCopies(HEIGHT, "g".repeat(WIDTH)),
            List.of(new MapDefinition.ResourceDefinition(0, 1, "wheat", 3),
                    new MapDefinition.ResourceDefinition(1, 2, "wood", 10),
                    new MapDefinition.ResourceDefinition(4, 4, "stone", 5)),
            List.of(GridPosition.of(1, 1), GridPosition.of(6, 8), GridPosition.of(1, 8))));

    private final Game game;
    private final List<Participant> participants = new ArrayList<>();
    private final List<Unit> units = new ArrayList<>();
    private final List<City> cities = new ArrayList<>();
    private final List<CityResource> stocks = new ArrayList<>();
    private final List<TileResource> deposits = new ArrayList<>();

    private BoardFixture(Game game) {
        this.game = game;
    }

    /** Human "p1" (active) against AI "p2", turn 1. */
    public static BoardFixture twoPlayers() {
        BoardFixture fixture = new BoardFixture(Game.builder()
                .id(GAME_ID)
                .mapCode(MAP.getCode())
                .mapSchemaVersion(1)
                .turnNo(1)
                .activeParticipantId("p1")
                .status(GameStatus.ACTIVE)
                .rngSeed(42L)
                .startedAt(LocalDateTime.now().minusMinutes(5))
                .build());
        fixture.participant("p1", ParticipantKind.HUMAN, 0);
        fixture.participant("p2", ParticipantKind.AI, 1);
        return fixture;
    }

    public static UnitCatalog catalog() {
        UnitCatalog catalog = new UnitCatalog(new ObjectMapper());
        catalog.register(WARRIOR);
        catalog.register(SLINGER);
        catalog.register(AXEMAN);
        return catalog;
    }

    public static GameMap map() {
        return MAP;
    }

    public static int tile(int row, int col) {
        return row * WIDTH + col;
    }

    public Participant participant(String id, ParticipantKind kind, int turnOrder) {
        Participant participant = Participant.builder()
                .id(id).gameId(GAME_ID).kind(kind).displayName(id).turnOrder(turnOrder).build();
        participants.add(participant);
        return participant;
    }

    public Unit unit(String id, String owner, UnitDefinition type, int row, int col) {
        Unit unit = Unit.builder()
                .id(id).gameId(GAME_ID).participantId(owner).typeCode(type.code())
                .tileId(tile(row, col)).hp(type.health()).acted(false).build();
        units.add(unit);
        return unit;
    }

    public City city(String id, String owner, int row, int col, int hp) {
        City city = City.builder()
                .id(id).gameId(GAME_ID).participantId(owner).tileId(tile(row, col)).hp(hp).maxHp(100).build();
        cities.add(city);
        return city;
    }

    public CityResource stock(String cityId, String resourceType, int amount) {
        CityResource stock = CityResource.builder()
                .gameId(GAME_ID).cityId(cityId).resourceType(resourceType).amount(amount).build();
        stocks.add(stock);
        return stock;
    }

    /** What is left of the deposit at a position, overriding the map amount. */
    public TileResource deposit(int row, int col, int remaining) {
        TileResource deposit = TileResource.builder().gameId(GAME_ID).tileId(tile(row, col)).remaining(remaining).build();
        deposits.add(deposit);
        return deposit;
    }

    public GameBoard board() {
        return new GameBoard(game, MAP, participants, units, cities, stocks, deposits);
    }

    public Game game() {
        return game;
    }

    public List<Participant> participants() {
        return participants;
    }

    public List<Unit> units() {
        return units;
    }

    public List<City> cities() {
        return cities;
    }

    public List<CityResource> stocks() {
        return stocks;
    }

    public List<TileResource> deposits() {
        return deposits;
    }
}
