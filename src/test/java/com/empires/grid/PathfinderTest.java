package com.empires.grid;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

class PathfinderTest {

    private static final int WIDTH = 10;
    private static final int HEIGHT = 8;
    private static final Predicate<GridPosition> NOTHING_BLOCKED = p -> false;

    private static Optional<List<GridPosition>> find(GridPosition start, GridPosition goal, int budget,
                                                     Predicate<GridPosition> blocked) {
        return Pathfinder.findPath(start, goal, budget, WIDTH, HEIGHT, blocked);
    }

    private static void assertContiguous(List<GridPosition> path) {
        for (int i = 1; i < path.size(); i++) {
            assertEquals(1, HexGrid.distance(path.get(i - 1), path.get(i)), "step " + i + " is not adjacent");
        }
    }

    @Nested
    @DisplayName("reachable goals")
    class Reachable {

        @Test
        @DisplayName("start equals goal yields a single-element path")
        void startEqualsGoal() {
            GridPosition start = GridPosition.of(3, 3);

            assertEquals(Optional.of(List.of(start)), find(start, start, 0, NOTHING_BLOCKED));
        }

        @Test
        @DisplayName("straight line uses exactly the hex distance")
        void straightLine() {
            List<GridPosition> path = find(GridPosition.of(3, 2), GridPosition.of(3, 4), 2, NOTHING_BLOCKED).orElseThrow();

            assertEquals(List.of(GridPosition.of(3, 2), GridPosition.of(3, 3), GridPosition.of(3, 4)), path);
        }

        @Test
        @DisplayName("detours around a blocker when the budget allows it")
        void detoursAroundBlocker() {
            Set<GridPosition> blocked = Set.of(GridPosition.of(3, 3));

            List<GridPosition> path = find(GridPosition.of(3, 2), GridPosition.of(3, 4), 3, blocked::contains).orElseThrow();

            assertEquals(4, path.size());
            assertEquals(GridPosition.of(3, 2), path.get(0));
            assertEquals(GridPosition.of(3, 4), path.get(3));
            assertFalse(path.contains(GridPosition.of(3, 3)));
            assertContiguous(path);
        }

        @Test
        @DisplayName("identical inputs produce the identical path")
        void deterministic() {
            Set<GridPosition> blocked = Set.of(GridPosition.of(4, 4), GridPosition.of(3, 5));

            Optional<List<GridPosition>> first = find(GridPosition.of(1, 1), GridPosition.of(6, 7), 12, blocked::contains);
            Optional<List<GridPosition>> second = find(GridPosition.of(1, 1), GridPosition.of(6, 7), 12, blocked::contains);

            assertTrue(first.isPresent());
            assertEquals(first, second);
            assertContiguous(first.get());
        }

        @Test
        @DisplayName("returned path is immutable")
        void pathIsImmutable() {
            List<GridPosition> path = find(GridPosition.of(0, 0), GridPosition.of(0, 2), 2, NOTHING_BLOCKED).orElseThrow();

            assertThrows(UnsupportedOperationException.class, () -> path.add(GridPosition.of(0, 3)));
        }
    }

    @Nested
    @DisplayName("unreachable goals")
    class Unreachable {

        @Test
        @DisplayName("goal beyond the budget is never returned truncated")
        void beyondBudget() {
            assertTrue(find(GridPosition.of(0, 0), GridPosition.of(0, 3), 2, NOTHING_BLOCKED).isEmpty());
        }

        @Test
        @DisplayName("detour longer than the budget means no path")
        void detourTooLong() {
            Set<GridPosition> blocked = Set.of(GridPosition.of(3, 3));

            assertTrue(find(GridPosition.of(3, 2), GridPosition.of(3, 4), 2, blocked::contains).isEmpty());
        }

        @Test
        @DisplayName("goal off the map")
        void goalOffMap() {
            assertTrue(find(GridPosition.of(0, 0), GridPosition.of(-1, 0), 5, NOTHING_BLOCKED).isEmpty());
            assertTrue(find(GridPosition.of(0, 9), GridPosition.of(0, 10), 5, NOTHING_BLOCKED).isEmpty());
        }

        @Test
        @DisplayName("goal enclosed by blockers")
        void enclosedGoal() {
            GridPosition goal = GridPosition.of(4, 4);
            Set<GridPosition> ring = Set.copyOf(HexGrid.adjacentPositions(goal, WIDTH, HEIGHT));

            assertTrue(find(GridPosition.of(0, 0), goal, 20, ring::contains).isEmpty());
        }

        @Test
        @DisplayName("start walled in by blockers")
        void walledInStart() {
            GridPosition start = GridPosition.of(4, 4);
            Set<GridPosition> ring = Set.copyOf(HexGrid.adjacentPositions(start, WIDTH, HEIGHT));

            assertTrue(find(start, GridPosition.of(0, 0), 100, ring::contains).isEmpty());
            assertTrue(find(start, GridPosition.of(7, 9), 100, ring::contains).isEmpty());
        }

        @Test
        @DisplayName("start in a corner walled in by blockers")
        void walledInCornerStart() {
            GridPosition start = GridPosition.of(0, 0);
            Set<GridPosition> ring = Set.copyOf(HexGrid.adjacentPositions(start, WIDTH, HEIGHT));

            assertTrue(find(start, GridPosition.of(7, 9), 100, ring::contains).isEmpty());
        }
    }

    @Nested
    @DisplayName("destination policy")
    class Policy {

        private final Set<GridPosition> occupiedGoal = Set.of(GridPosition.of(3, 4));

        @Test
        @DisplayName("occupied goal is unreachable by default")
        void blockedByDefault() {
            assertTrue(find(GridPosition.of(3, 2), GridPosition.of(3, 4), 2, occupiedGoal::contains).isEmpty());
        }

        @Test
        @DisplayName("occupied goal is reachable when the destination is always enterable")
        void alwaysEnterable() {
            Optional<List<GridPosition>> path = Pathfinder.findPath(GridPosition.of(3, 2), GridPosition.of(3, 4), 2,
                    WIDTH, HEIGHT, occupiedGoal::contains, DestinationPolicy.ALWAYS_ENTERABLE);

            assertEquals(3, path.orElseThrow().size());
        }
    }

    @Test
    @DisplayName("negative budget is a programming error")
    void negativeBudget() {
        assertThrows(IllegalArgumentException.class,
                () -> find(GridPosition.of(0, 0), GridPosition.of(0, 1), -1, NOTHING_BLOCKED));
    }

    @Test
    @DisplayName("start equals goal yields the start even with a negative budget")
    void startEqualsGoalIgnoresBudget() {
        GridPosition start = GridPosition.of(2, 5);

        assertEquals(Optional.of(List.of(start)), find(start, start, -1, NOTHING_BLOCKED));
    }
}
