package com.empires.engine;

import lombok.Getter;

/**
 * Thrown by action rules when an action is illegal. The surrounding transaction is rolled back
 * and the engine turns the exception into a failed {@link ActionResult}.
 */
@Getter
public class ActionRejectedException extends RuntimeException {

    private final ErrorKind errorKind;

    public ActionRejectedException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = errorKind;
    }
}
