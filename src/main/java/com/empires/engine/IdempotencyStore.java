package com.empires.engine;

import java.util.Optional;

/**
 * Remembers successful action results by idempotency key.
 */
public interface IdempotencyStore {

    Optional<ActionResult> tryGet(String key);

    /**
     * Stores the result unless the key is already present.
     *
     * @return the result now associated with the key, which is the existing one if another writer won
     */
    ActionResult putIfAbsent(String key, ActionResult result);
}
