package com.empires.engine;

/**
 * What a committed action changed, beyond the resulting state snapshot.
 * Fields that do not apply to the action are {@code null} or {@code false}.
 */
public record ActionEffects(
        Integer damage,
        Integer counterDamage,
        boolean targetDestroyed,
        boolean attackerDestroyed,
        String capturedCityId,
        Integer cityRemainingHp,
        String nextParticipantId,
        Integer turnNo,
        boolean gameFinished
) {

    public static ActionEffects none() {
        return new ActionEffects(null, null, false, false, null, null, null, null, false);
    }

    public static ActionEffects moved(String capturedCityId, boolean gameFinished) {
        return new ActionEffects(null, null, false, false, capturedCityId, null, null, null, gameFinished);
    }

    public static ActionEffects unitCombat(int damage, Integer counterDamage,
                                           boolean targetDestroyed, boolean attackerDestroyed) {
        return new ActionEffects(damage, counterDamage, targetDestroyed, attackerDestroyed, null, null, null, null, false);
    }

    public static ActionEffects cityCombat(int damage, int remainingHp) {
        return new ActionEffects(damage, null, false, false, null, remainingHp, null, null, false);
    }

    public static ActionEffects turnEnded(String nextParticipantId, int turnNo) {
        return new ActionEffects(null, null, false, false, null, null, nextParticipantId, turnNo, false);
    }
}
