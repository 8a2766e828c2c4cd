package com.empires.engine;

import com.empires.combat.AttackOutcome;
import com.empires.combat.CityAttackOutcome;
import com.empires.combat.CombatResolver;
import com.empires.config.UnitCatalog;
import com.empires.config.UnitDefinition;
import com.empires.exception.GameStateCorruptedException;
import com.empires.grid.GridPosition;
import com.empires.grid.HexGrid;
import com.empires.grid.Pathfinder;
import com.empires.model.City;
import com.empires.model.Game;
import com.empires.model.GameMap;
import com.empires.model.Participant;
import com.empires.model.Tile;
import com.empires.model.TurnRecord;
import com.empires.model.Unit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The rules of each action, applied to a loaded {@link GameBoard}.
 * <p>
 * Every check happens before the first mutation, so a rejected action leaves the board untouched.
 * Callers must have verified that the game is active and that {@code actorId} is the active participant.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BoardActions {

    private final UnitCatalog unitCatalog;

    @Value("${game.city.regen-normal:4}")
    private int cityRegenNormal = 4;

    @Value("${game.city.regen-under-siege:2}")
    private int cityRegenUnderSiege = 2;

    @Value("${game.city.storage-cap:100}")
    private int cityStorageCap = 100;

    public ActionEffects move(GameBoard board, String actorId, String unitId, GridPosition destination) {
        Unit unit = requireReadyUnit(board, actorId, unitId);
        UnitDefinition type = unitCatalog.get(unit.getTypeCode());
        GameMap map = board.getMap();

        if (destination == null || !map.contains(destination)) {
            throw new ActionRejectedException(ErrorKind.INVALID_TARGET, "Destination " + destination + " is off the map");
        }
        int destinationTile = board.tileIdOf(destination);
        if (destinationTile == unit.getTileId()) {
            throw new ActionRejectedException(ErrorKind.INVALID_TARGET, "Unit is already on " + destination);
        }
        if (board.isOccupied(destinationTile)) {
            throw new ActionRejectedException(ErrorKind.INVALID_TARGET, "Destination " + destination + " is occupied");
        }
        Optional<City> cityOnTile = board.cityAt(destinationTile);
        if (cityOnTile.isPresent() && !cityOnTile.get().isOwnedBy(actorId) && !cityOnTile.get().isDefeated()) {
            throw new ActionRejectedException(ErrorKind.INVALID_TARGET,
                    "Cannot enter enemy city at " + destination + " before it is defeated");
        }

        GridPosition start = board.positionOf(unit);
        Optional<List<GridPosition>> path = Pathfinder.findPath(start, destination, type.movePoints(),
                map.getWidth(), map.getHeight(), position -> board.isOccupied(board.tileIdOf(position)));
        if (path.isEmpty()) {
            throw new ActionRejectedException(ErrorKind.OUT_OF_RANGE,
                    "No path from " + start + " to " + destination + " within " + type.movePoints() + " moves");
        }

        board.moveUnit(unit, destinationTile);
        unit.setActed(true);
        log.debug("Unit {} moved {} -> {} in {} step(s)", unit.getId(), start, destination, path.get().size() - 1);

        if (cityOnTile.isPresent() && !cityOnTile.get().isOwnedBy(actorId) && !type.ranged()) {
            City city = cityOnTile.get();
            boolean finished = captureCity(board, city, actorId);
            return ActionEffects.moved(city.getId(), finished);
        }
        return ActionEffects.moved(null, false);
    }

    public ActionEffects attackUnit(GameBoard board, String actorId, String attackerId, String targetUnitId) {
        Unit attacker = requireReadyUnit(board, actorId, attackerId);
        Unit target = board.unit(targetUnitId)
                .filter(u -> !u.isOwnedBy(actorId))
                .orElseThrow(() -> new ActionRejectedException(ErrorKind.INVALID_TARGET,
                        "Target unit " + targetUnitId + " is not an enemy unit in this game"));
        UnitDefinition attackerType = unitCatalog.get(attacker.getTypeCode());
        UnitDefinition targetType = unitCatalog.get(target.getTypeCode());

        requireInRange(attackerType, HexGrid.distance(board.positionOf(attacker), board.positionOf(target)));

        AttackOutcome outcome = CombatResolver.resolveAttack(attacker.getHp(), attackerType, target.getHp(), targetType);
        target.setHp(outcome.defenderRemaining());
        attacker.setHp(outcome.attackerRemaining());
        attacker.setActed(true);

        if (outcome.defenderDestroyed()) {
            board.removeUnit(target);
        }
        if (outcome.attackerDestroyed()) {
            board.removeUnit(attacker);
        }
        log.debug("Unit {} hit unit {} for {} (counter {})", attacker.getId(), target.getId(),
                outcome.damage(), outcome.counterDamage());
        return ActionEffects.unitCombat(outcome.damage(), outcome.counterDamage(),
                outcome.defenderDestroyed(), outcome.attackerDestroyed());
    }

    public ActionEffects attackCity(GameBoard board, String actorId, String attackerId, String targetCityId) {
        Unit attacker = requireReadyUnit(board, actorId, attackerId);
        City city = board.city(targetCityId)
                .filter(c -> !c.isOwnedBy(actorId))
                .orElseThrow(() -> new ActionRejectedException(ErrorKind.INVALID_TARGET,
                        "Target city " + targetCityId + " is not an enemy city in this game"));
        UnitDefinition attackerType = unitCatalog.get(attacker.getTypeCode());

        requireInRange(attackerType, HexGrid.distance(board.positionOf(attacker), board.positionOf(city)));

        CityAttackOutcome outcome = CombatResolver.resolveAttackOnCity(attacker.getHp(), attackerType,
                city.getHp(), city.getMaxHp());
        city.setHp(outcome.remainingHp());
        attacker.setActed(true);
        log.debug("Unit {} hit city {} for {}, {} hp left", attacker.getId(), city.getId(),
                outcome.damage(), outcome.remainingHp());
        return ActionEffects.cityCombat(outcome.damage(), outcome.remainingHp());
    }

    /**
     * Regenerates the ending participant's cities, harvests their worked tiles, records the turn
     * and hands control to the next participant still in the game. The turn number advances when the rotation wraps.
     */
    public ActionEffects endTurn(GameBoard board, String actorId) {
        Game game = board.getGame();
        LocalDateTime now = LocalDateTime.now();

        int regenerated = regenerateCities(board, actorId);
        int harvested = harvestCities(board, actorId);
        int unitsActed = (int) board.unitsOf(actorId).stream().filter(Unit::isActed).count();
        LocalDateTime since = game.getLastTurnAt() != null ? game.getLastTurnAt() : game.getStartedAt();

        board.addTurnRecord(TurnRecord.builder()
                .gameId(game.getId())
                .turnNo(game.getTurnNo())
                .participantId(actorId)
                .committedAt(now)
                .durationMs(since != null ? Duration.between(since, now).toMillis() : null)
                .unitsActed(unitsActed)
                .cityHpRegenerated(regenerated)
                .resourcesHarvested(harvested)
                .build());

        List<Participant> order = board.getParticipants();
        int current = indexOf(order, actorId);
        Participant next = null;
        boolean wrapped = false;
        for (int step = 1; step <= order.size(); step++) {
            int index = (current + step) % order.size();
            if (!order.get(index).isEliminated()) {
                next = order.get(index);
                wrapped = index <= current;
                break;
            }
        }
        if (next == null) {
            throw new GameStateCorruptedException("Game " + game.getId() + " has no participant left to play");
        }

        if (wrapped) {
            game.setTurnNo(game.getTurnNo() + 1);
        }
        game.setActiveParticipantId(next.getId());
        game.setLastTurnAt(now);
        board.unitsOf(next.getId()).forEach(u -> u.setActed(false));

        log.debug("Turn passed from {} to {} (turn {})", actorId, next.getId(), game.getTurnNo());
        return ActionEffects.turnEnded(next.getId(), game.getTurnNo());
    }

    private int regenerateCities(GameBoard board, String actorId) {
        GameMap map = board.getMap();
        int total = 0;
        for (City city : board.citiesOf(actorId)) {
            boolean underSiege = HexGrid.adjacentPositions(board.positionOf(city), map.getWidth(), map.getHeight())
                    .stream()
                    .map(board::tileIdOf)
                    .map(board::unitAt)
                    .flatMap(Optional::stream)
                    .anyMatch(u -> !u.isOwnedBy(actorId));
            int amount = underSiege ? cityRegenUnderSiege : cityRegenNormal;
            int healed = Math.min(city.getMaxHp(), city.getHp() + amount) - city.getHp();
            if (healed > 0) {
                city.setHp(city.getHp() + healed);
                total += healed;
            }
        }
        return total;
    }

    /**
     * Each worked tile with a deposit left yields one unit of its resource into the city's stock,
     * unless an enemy unit stands on it or the city already holds {@code cityStorageCap} of that type.
     * A city works its own tile and the tiles adjacent to it.
     */
    private int harvestCities(GameBoard board, String actorId) {
        int total = 0;
        for (City city : board.citiesOf(actorId)) {
            for (Tile tile : workedTiles(board, city)) {
                if (board.remainingDeposit(tile) <= 0) {
                    continue;
                }
                boolean enemyOnTile = board.unitAt(tile.id()).filter(u -> !u.isOwnedBy(actorId)).isPresent();
                if (enemyOnTile) {
                    continue;
                }
                if (board.stockOf(city.getId(), tile.resourceType()) >= cityStorageCap) {
                    log.debug("City {} is full of {}, tile {} left untouched", city.getId(), tile.resourceType(), tile.id());
                    continue;
                }
                board.addStock(city.getId(), tile.resourceType(), 1);
                board.drawFromDeposit(tile, 1);
                total++;
            }
        }
        return total;
    }

    private static List<Tile> workedTiles(GameBoard board, City city) {
        GameMap map = board.getMap();
        List<Tile> tiles = new ArrayList<>();
        tiles.add(map.tile(city.getTileId()));
        HexGrid.adjacentPositions(board.positionOf(city), map.getWidth(), map.getHeight())
                .forEach(position -> map.tileAt(position).ifPresent(tiles::add));
        return tiles;
    }

    /**
     * Transfers a defeated city to {@code newOwnerId}.
     *
     * @return whether the capture ended the game
     */
    private boolean captureCity(GameBoard board, City city, String newOwnerId) {
        String previousOwner = city.getParticipantId();
        city.setParticipantId(newOwnerId);
        city.setHp(1);
        log.info("City {} captured by {} from {}", city.getId(), newOwnerId, previousOwner);

        if (board.citiesOf(previousOwner).isEmpty()) {
            board.participant(previousOwner).ifPresent(p -> {
                p.eliminate();
                log.info("Participant {} eliminated in game {}", p.getDisplayName(), board.getGame().getId());
            });
        }
        boolean enemyCityLeft = board.getCities().stream().anyMatch(c -> !c.isOwnedBy(newOwnerId));
        if (!enemyCityLeft) {
            board.getGame().finish();
            log.info("Game {} finished, {} holds every city", board.getGame().getId(), newOwnerId);
            return true;
        }
        return false;
    }

    private Unit requireReadyUnit(GameBoard board, String actorId, String unitId) {
        Unit unit = board.unit(unitId)
                .filter(u -> u.isOwnedBy(actorId))
                .orElseThrow(() -> new ActionRejectedException(ErrorKind.INVALID_TARGET,
                        "Unit " + unitId + " does not belong to the acting participant"));
        if (unit.isActed()) {
            throw new ActionRejectedException(ErrorKind.NO_ACTIONS_LEFT, "Unit " + unitId + " has already acted this turn");
        }
        return unit;
    }

    private static void requireInRange(UnitDefinition type, int distance) {
        boolean inRange = type.ranged()
                ? distance >= type.rangeMin() && distance <= type.rangeMax()
                : distance == 1;
        if (!inRange) {
            throw new ActionRejectedException(ErrorKind.OUT_OF_RANGE,
                    "Target at distance " + distance + " is out of range for " + type.code());
        }
    }

    private static int indexOf(List<Participant> order, String participantId) {
        for (int i = 0; i < order.size(); i++) {
            if (order.get(i).getId().equals(participantId)) {
                return i;
            }
        }
        throw new GameStateCorruptedException("Participant " + participantId + " is not part of this game");
    }
}
