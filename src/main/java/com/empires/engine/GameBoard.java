package com.empires.engine;

import com.empires.exception.GameStateCorruptedException;
import com.empires.grid.GridPosition;
import com.empires.model.City;
import com.empires.model.CityResource;
import com.empires.model.Game;
import com.empires.model.GameMap;
import com.empires.model.Participant;
import com.empires.model.Tile;
import com.empires.model.TileResource;
import com.empires.model.TurnRecord;
import com.empires.model.Unit;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory working copy of one game, loaded at the start of an action and saved at its end.
 * <p>
 * Units, cities and participants are kept in id-keyed maps. A tile-to-unit index enforces
 * one unit per tile and answers occupancy queries without scanning.
 */
public class GameBoard {

    private final Game game;
    private final GameMap map;
    private final List<Participant> participants;
    private final Map<String, Unit> units = new LinkedHashMap<>();
    private final Map<String, City> cities = new LinkedHashMap<>();
    private final Map<Integer, String> unitByTile = new HashMap<>();
    private final Map<Integer, String> cityByTile = new HashMap<>();
    private final Map<String, Map<String, CityResource>> stocksByCity = new HashMap<>();
    private final Map<Integer, TileResource> depositsByTile = new HashMap<>();
    private final Set<String> removedUnitIds = new LinkedHashSet<>();
    private final List<TurnRecord> newTurnRecords = new ArrayList<>();

    /**
     * @throws GameStateCorruptedException if two units or two cities share a tile
     */
    public GameBoard(Game game, GameMap map, Collection<Participant> participants,
                     Collection<Unit> units, Collection<City> cities,
                     Collection<CityResource> cityResources, Collection<TileResource> tileResources) {
        this.game = game;
        this.map = map;
        List<Participant> ordered = new ArrayList<>(participants);
        ordered.sort(Comparator.comparingInt(Participant::getTurnOrder));
        this.participants = Collections.unmodifiableList(ordered);

        for (Unit unit : units) {
            String previous = unitByTile.putIfAbsent(unit.getTileId(), unit.getId());
            if (previous != null) {
                throw new GameStateCorruptedException("Tile " + unit.getTileId() + " holds both unit "
                        + previous + " and unit " + unit.getId());
            }
            this.units.put(unit.getId(), unit);
        }
        for (City city : cities) {
            String previous = cityByTile.putIfAbsent(city.getTileId(), city.getId());
            if (previous != null) {
                throw new GameStateCorruptedException("Tile " + city.getTileId() + " holds two cities");
            }
            this.cities.put(city.getId(), city);
        }
        for (CityResource stock : cityResources) {
            stocksByCity.computeIfAbsent(stock.getCityId(), id -> new LinkedHashMap<>())
                    .put(stock.getResourceType(), stock);
        }
        for (TileResource deposit : tileResources) {
            depositsByTile.put(deposit.getTileId(), deposit);
        }
    }

    public Game getGame() {
        return game;
    }

    public GameMap getMap() {
        return map;
    }

    /** Participants in turn order. */
    public List<Participant> getParticipants() {
        return participants;
    }

    public Optional<Participant> participant(String participantId) {
        return participants.stream().filter(p -> p.getId().equals(participantId)).findFirst();
    }

    public Collection<Unit> getUnits() {
        return Collections.unmodifiableCollection(units.values());
    }

    public Collection<City> getCities() {
        return Collections.unmodifiableCollection(cities.values());
    }

    public Optional<Unit> unit(String unitId) {
        return Optional.ofNullable(unitId).map(units::get);
    }

    public Optional<City> city(String cityId) {
        return Optional.ofNullable(cityId).map(cities::get);
    }

    public Optional<Unit> unitAt(int tileId) {
        return Optional.ofNullable(unitByTile.get(tileId)).map(units::get);
    }

    public Optional<City> cityAt(int tileId) {
        return Optional.ofNullable(cityByTile.get(tileId)).map(cities::get);
    }

    public boolean isOccupied(int tileId) {
        return unitByTile.containsKey(tileId);
    }

    public List<Unit> unitsOf(String participantId) {
        return units.values().stream().filter(u -> u.isOwnedBy(participantId)).toList();
    }

    public List<City> citiesOf(String participantId) {
        return cities.values().stream().filter(c -> c.isOwnedBy(participantId)).toList();
    }

    public GridPosition positionOf(Unit unit) {
        return map.tile(unit.getTileId()).position();
    }

    public GridPosition positionOf(City city) {
        return map.tile(city.getTileId()).position();
    }

    public int tileIdOf(GridPosition position) {
        return map.tileAt(position)
                .orElseThrow(() -> new IllegalArgumentException("Position " + position + " is off the map"))
                .id();
    }

    /**
     * Moves a unit to a free tile and updates the occupancy index.
     *
     * @throws GameStateCorruptedException if the destination already holds a unit
     */
    public void moveUnit(Unit unit, int tileId) {
        if (unitByTile.containsKey(tileId)) {
            throw new GameStateCorruptedException("Tile " + tileId + " is already occupied");
        }
        unitByTile.remove(unit.getTileId(), unit.getId());
        unit.setTileId(tileId);
        unitByTile.put(tileId, unit.getId());
    }

    public void removeUnit(Unit unit) {
        if (units.remove(unit.getId()) != null) {
            unitByTile.remove(unit.getTileId(), unit.getId());
            removedUnitIds.add(unit.getId());
        }
    }

    /** Amount of {@code resourceType} stored in a city, 0 when it has never held any. */
    public int stockOf(String cityId, String resourceType) {
        CityResource stock = stocksByCity.getOrDefault(cityId, Map.of()).get(resourceType);
        return stock != null ? stock.getAmount() : 0;
    }

    public void addStock(String cityId, String resourceType, int amount) {
        CityResource stock = stocksByCity.computeIfAbsent(cityId, id -> new LinkedHashMap<>())
                .computeIfAbsent(resourceType, type -> CityResource.builder()
                        .gameId(game.getId())
                        .cityId(cityId)
                        .resourceType(type)
                        .build());
        stock.setAmount(stock.getAmount() + amount);
    }

    /** Stock per resource type of one city, in the order the types were first stored. */
    public Map<String, Integer> stocksOf(String cityId) {
        Map<String, Integer> amounts = new LinkedHashMap<>();
        stocksByCity.getOrDefault(cityId, Map.of()).forEach((type, stock) -> amounts.put(type, stock.getAmount()));
        return amounts;
    }

    /** What is left of the deposit on a tile in this game. */
    public int remainingDeposit(Tile tile) {
        if (tile.resourceType() == null) {
            return 0;
        }
        TileResource deposit = depositsByTile.get(tile.id());
        return deposit != null ? deposit.getRemaining() : tile.resourceAmount();
    }

    public void drawFromDeposit(Tile tile, int amount) {
        int remaining = remainingDeposit(tile) - amount;
        if (remaining < 0) {
            throw new GameStateCorruptedException("Deposit on tile " + tile.id() + " would drop below zero");
        }
        depositsByTile.computeIfAbsent(tile.id(), id -> TileResource.builder()
                        .gameId(game.getId())
                        .tileId(id)
                        .build())
                .setRemaining(remaining);
    }

    public List<CityResource> getCityResources() {
        return stocksByCity.values().stream().flatMap(stocks -> stocks.values().stream()).toList();
    }

    public Collection<TileResource> getTileResources() {
        return Collections.unmodifiableCollection(depositsByTile.values());
    }

    public void addTurnRecord(TurnRecord record) {
        newTurnRecords.add(record);
    }

    public Set<String> getRemovedUnitIds() {
        return Collections.unmodifiableSet(removedUnitIds);
    }

    public List<TurnRecord> getNewTurnRecords() {
        return Collections.unmodifiableList(newTurnRecords);
    }
}
