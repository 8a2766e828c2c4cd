package com.empires.grid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.function.Predicate;

/**
 * A* search over the hex grid with a uniform step cost of one movement point.
 * <p>
 * The search runs in cube space and reports positions in offset space. Hex distance to the goal
 * is the heuristic, which is admissible and consistent on a uniform-cost grid, so the first time
 * the goal is dequeued its path is a shortest one. Ties are broken by heuristic and then by
 * discovery order, and neighbours are always expanded in {@link HexGrid#DIRECTIONS} order, so
 * identical inputs always produce the identical path.
 */
public final class Pathfinder {

    private static final Comparator<Node> NODE_ORDER = Comparator
            .comparingInt(Node::f)
            .thenComparingInt(Node::h)
            .thenComparingLong(Node::sequence);

    private Pathfinder() {
    }

    /**
     * Finds a shortest path using the {@link DestinationPolicy#BLOCK_IF_OCCUPIED} policy.
     */
    public static Optional<List<GridPosition>> findPath(GridPosition start, GridPosition goal, int budget,
                                                        int width, int height,
                                                        Predicate<GridPosition> isBlocked) {
        return findPath(start, goal, budget, width, height, isBlocked, DestinationPolicy.BLOCK_IF_OCCUPIED);
    }

    /**
     * Finds a shortest path from {@code start} to {@code goal}, both inclusive.
     *
     * @param budget    maximum number of steps; a longer path is never returned, not even truncated
     * @param isBlocked side-effect-free predicate telling which positions cannot be entered
     * @param policy    whether the goal itself is subject to {@code isBlocked}
     * @return the path, or empty when the goal is unreachable within the budget
     */
    public static Optional<List<GridPosition>> findPath(GridPosition start, GridPosition goal, int budget,
                                                        int width, int height,
                                                        Predicate<GridPosition> isBlocked,
                                                        DestinationPolicy policy) {
        if (start.equals(goal)) {
            return Optional.of(List.of(start));
        }
        if (budget < 0) {
            throw new IllegalArgumentException("Movement budget must not be negative: " + budget);
        }
        if (!HexGrid.isInBounds(goal, width, height)) {
            return Optional.empty();
        }
        if (policy == DestinationPolicy.BLOCK_IF_OCCUPIED && isBlocked.test(goal)) {
            return Optional.empty();
        }

        CubeCoord startCube = HexGrid.offsetToCube(start);
        CubeCoord goalCube = HexGrid.offsetToCube(goal);
        if (HexGrid.distance(startCube, goalCube) > budget) {
            return Optional.empty();
        }

        PriorityQueue<Node> open = new PriorityQueue<>(NODE_ORDER);
        Map<CubeCoord, Integer> gScore = new HashMap<>();
        Map<CubeCoord, CubeCoord> cameFrom = new HashMap<>();
        Set<CubeCoord> closed = new HashSet<>();
        long sequence = 0;

        gScore.put(startCube, 0);
        open.add(new Node(startCube, 0, HexGrid.distance(startCube, goalCube), sequence++));

        while (!open.isEmpty()) {
            Node current = open.poll();
            if (!closed.add(current.position())) {
                continue; // stale entry superseded by a cheaper one
            }
            if (current.position().equals(goalCube)) {
                return Optional.of(reconstruct(cameFrom, goalCube));
            }

            int tentative = current.g() + 1;
            if (tentative > budget) {
                continue;
            }

            for (CubeCoord neighbor : HexGrid.neighbors(current.position())) {
                if (closed.contains(neighbor)) {
                    continue;
                }
                GridPosition square = HexGrid.cubeToOffset(neighbor);
                if (!HexGrid.isInBounds(square, width, height)) {
                    continue;
                }
                if (!neighbor.equals(goalCube) && isBlocked.test(square)) {
                    continue;
                }
                Integer known = gScore.get(neighbor);
                if (known == null || tentative < known) {
                    gScore.put(neighbor, tentative);
                    cameFrom.put(neighbor, current.position());
                    open.add(new Node(neighbor, tentative, HexGrid.distance(neighbor, goalCube), sequence++));
                }
            }
        }
        return Optional.empty();
    }

    private static List<GridPosition> reconstruct(Map<CubeCoord, CubeCoord> cameFrom, CubeCoord goal) {
        List<GridPosition> path = new ArrayList<>();
        CubeCoord current = goal;
        path.add(HexGrid.cubeToOffset(current));
        while (cameFrom.containsKey(current)) {
            current = cameFrom.get(current);
            path.add(HexGrid.cubeToOffset(current));
        }
        Collections.reverse(path);
        return List.copyOf(path);
    }

    private record Node(CubeCoord position, int g, int h, long sequence) {
        int f() {
            return g + h;
        }
    }
}
