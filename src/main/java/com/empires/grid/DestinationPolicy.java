package com.empires.grid;

/**
 * How {@link Pathfinder} treats a goal tile that the blocking predicate reports as blocked.
 */
public enum DestinationPolicy {

    /** A blocked goal means there is no path. */
    BLOCK_IF_OCCUPIED,

    /** The goal is always enterable; the caller re-validates occupancy before committing. */
    ALWAYS_ENTERABLE
}
