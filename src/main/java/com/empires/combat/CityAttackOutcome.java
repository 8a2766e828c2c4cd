package com.empires.combat;

/**
 * Result of a unit attacking a city.
 */
public record CityAttackOutcome(int damage, int remainingHp) {

    public boolean defeated() {
        return remainingHp <= 0;
    }
}
