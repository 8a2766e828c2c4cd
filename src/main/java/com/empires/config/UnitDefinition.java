package com.empires.config;

/**
 * Immutable stat template shared by every unit of a type.
 *
 * @param code       type code, e.g. "warrior"
 * @param ranged     whether the unit attacks from range (and therefore never receives a counterattack)
 * @param attack     attack stat
 * @param defence    defence stat
 * @param health     maximum hit points
 * @param movePoints hex steps per move action
 * @param rangeMin   minimum attack distance for ranged units
 * @param rangeMax   maximum attack distance for ranged units
 */
public record UnitDefinition(
        String code,
        boolean ranged,
        int attack,
        int defence,
        int health,
        int movePoints,
        int rangeMin,
        int rangeMax
) {}
