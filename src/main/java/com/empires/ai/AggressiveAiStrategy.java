package com.empires.ai;

import com.empires.config.UnitCatalog;
import com.empires.config.UnitDefinition;
import com.empires.engine.GameBoard;
import com.empires.grid.GridPosition;
import com.empires.grid.HexGrid;
import com.empires.grid.Pathfinder;
import com.empires.model.City;
import com.empires.model.GameMap;
import com.empires.model.Tile;
import com.empires.model.Unit;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Attacks whatever is in reach, otherwise closes in on the nearest enemy city.
 * <p>
 * Priority: capture a defeated adjacent city, attack the weakest enemy unit in range,
 * attack an enemy city in range, step towards the nearest enemy city, hold.
 */
@Component
@RequiredArgsConstructor
public class AggressiveAiStrategy implements AiStrategy {

    private final UnitCatalog unitCatalog;

    @Override
    public AiDecision decide(GameBoard board, Unit unit) {
        UnitDefinition type = unitCatalog.get(unit.getTypeCode());
        String owner = unit.getParticipantId();
        GridPosition here = board.positionOf(unit);
        List<City> enemyCities = board.getCities().stream().filter(c -> !c.isOwnedBy(owner)).toList();

        if (!type.ranged()) {
            Optional<City> capturable = enemyCities.stream()
                    .filter(City::isDefeated)
                    .filter(c -> HexGrid.distance(here, board.positionOf(c)) == 1)
                    .filter(c -> !board.isOccupied(c.getTileId()))
                    .findFirst();
            if (capturable.isPresent()) {
                return AiDecision.move(unit.getId(), board.positionOf(capturable.get()));
            }
        }

        Optional<Unit> weakestTarget = board.getUnits().stream()
                .filter(u -> !u.isOwnedBy(owner))
                .filter(u -> inRange(type, HexGrid.distance(here, board.positionOf(u))))
                .min(Comparator.comparingInt(Unit::getHp).thenComparingInt(Unit::getTileId));
        if (weakestTarget.isPresent()) {
            return AiDecision.attackUnit(unit.getId(), weakestTarget.get().getId());
        }

        Optional<City> cityTarget = enemyCities.stream()
                .filter(c -> !c.isDefeated())
                .filter(c -> inRange(type, HexGrid.distance(here, board.positionOf(c))))
                .min(Comparator.comparingInt(City::getHp).thenComparingInt(City::getTileId));
        if (cityTarget.isPresent()) {
            return AiDecision.attackCity(unit.getId(), cityTarget.get().getId());
        }

        return stepTowardsNearestCity(board, unit, type, here, enemyCities)
                .map(destination -> AiDecision.move(unit.getId(), destination))
                .orElseGet(() -> AiDecision.hold(unit.getId()));
    }

    private Optional<GridPosition> stepTowardsNearestCity(GameBoard board, Unit unit, UnitDefinition type,
                                                          GridPosition here, List<City> enemyCities) {
        if (enemyCities.isEmpty()) {
            return Optional.empty();
        }
        GameMap map = board.getMap();
        int currentDistance = distanceToNearest(board, here, enemyCities);

        return map.getTiles().stream()
                .filter(t -> HexGrid.distance(here, t.position()) <= type.movePoints())
                .filter(t -> t.id() != unit.getTileId())
                .filter(t -> !t.terrain().isWater())
                .filter(t -> !board.isOccupied(t.id()))
                .filter(t -> board.cityAt(t.id()).map(c -> c.isOwnedBy(unit.getParticipantId()) || c.isDefeated()).orElse(true))
                .filter(t -> distanceToNearest(board, t.position(), enemyCities) < currentDistance)
                .filter(t -> Pathfinder.findPath(here, t.position(), type.movePoints(), map.getWidth(), map.getHeight(),
                        p -> board.isOccupied(board.tileIdOf(p))).isPresent())
                .min(Comparator.<Tile>comparingInt(t -> distanceToNearest(board, t.position(), enemyCities))
                        .thenComparingInt(Tile::id))
                .map(Tile::position);
    }

    private static int distanceToNearest(GameBoard board, GridPosition from, List<City> cities) {
        return cities.stream()
                .mapToInt(c -> HexGrid.distance(from, board.positionOf(c)))
                .min()
                .orElse(Integer.MAX_VALUE);
    }

    private static boolean inRange(UnitDefinition type, int distance) {
        return type.ranged()
                ? distance >= type.rangeMin() && distance <= type.rangeMax()
                : distance == 1;
    }
}
