package com.empires.combat;

/**
 * Result of a unit-versus-unit attack.
 *
 * @param damage            damage dealt to the defender
 * @param counterDamage     damage dealt back to the attacker, or {@code null} when no counterattack happened
 * @param defenderRemaining defender hit points after the attack, floored at zero
 * @param attackerRemaining attacker hit points after any counterattack, floored at zero
 */
public record AttackOutcome(int damage, Integer counterDamage, int defenderRemaining, int attackerRemaining) {

    public boolean defenderDestroyed() {
        return defenderRemaining <= 0;
    }

    public boolean attackerDestroyed() {
        return attackerRemaining <= 0;
    }

    public boolean countered() {
        return counterDamage != null;
    }
}
