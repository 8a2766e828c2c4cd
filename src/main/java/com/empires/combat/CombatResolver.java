package com.empires.combat;

import com.empires.config.UnitDefinition;

/**
 * Deterministic damage resolution. Both sides' strength scales with their remaining health,
 * every hit deals at least one point, and only melee-versus-melee exchanges trigger a counterattack.
 * <p>
 * All methods are pure: they read hit points and return outcomes, they never mutate units or cities.
 */
public final class CombatResolver {

    /** Defence value used for every city, regardless of its hit points. */
    public static final int CITY_DEFENCE = 15;

    private CombatResolver() {
    }

    /**
     * Computes the damage of one strike.
     * <pre>
     * atk = attack  * clamp01(attackerHp / attackerMaxHp)
     * def = defence * clamp01(defenderHp / defenderMaxHp), with def &lt;= 0 treated as 1
     * damage = max(1, round(atk * (1 + (atk - def) / def) * 0.5))
     * </pre>
     * Midpoints round away from zero.
     */
    public static int computeDamage(int attack, int defence,
                                    int attackerHp, int attackerMaxHp,
                                    int defenderHp, int defenderMaxHp) {
        double atk = attack * healthRatio(attackerHp, attackerMaxHp);
        double def = defence * healthRatio(defenderHp, defenderMaxHp);
        if (def <= 0) {
            def = 1;
        }
        double raw = atk * (1 + (atk - def) / def) * 0.5;
        long rounded = Math.round(Math.abs(raw)) * (raw < 0 ? -1 : 1);
        return (int) Math.max(1, rounded);
    }

    /**
     * Resolves an attack between two units using their current hit points.
     * The defender counterattacks with its post-damage health only when it survives
     * and neither side is ranged.
     */
    public static AttackOutcome resolveAttack(int attackerHp, UnitDefinition attackerType,
                                              int defenderHp, UnitDefinition defenderType) {
        int damage = computeDamage(attackerType.attack(), defenderType.defence(),
                attackerHp, attackerType.health(), defenderHp, defenderType.health());
        int defenderRemaining = Math.max(0, defenderHp - damage);

        if (defenderRemaining == 0 || attackerType.ranged() || defenderType.ranged()) {
            return new AttackOutcome(damage, null, defenderRemaining, attackerHp);
        }

        int counter = computeDamage(defenderType.attack(), attackerType.defence(),
                defenderRemaining, defenderType.health(), attackerHp, attackerType.health());
        return new AttackOutcome(damage, counter, defenderRemaining, Math.max(0, attackerHp - counter));
    }

    /**
     * Resolves an attack on a city. Cities never counterattack.
     */
    public static CityAttackOutcome resolveAttackOnCity(int attackerHp, UnitDefinition attackerType,
                                                        int cityHp, int cityMaxHp) {
        int damage = computeDamage(attackerType.attack(), CITY_DEFENCE,
                attackerHp, attackerType.health(), cityHp, cityMaxHp);
        return new CityAttackOutcome(damage, Math.max(0, cityHp - damage));
    }

    private static double healthRatio(int hp, int maxHp) {
        if (maxHp <= 0) {
            return 1.0;
        }
        return Math.min(1.0, Math.max(0.0, (double) hp / maxHp));
    }
}
