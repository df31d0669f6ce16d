package com.eainde.fitengine.exception;

/**
 * A pipeline invariant was broken. Always fatal to the session and never downgraded to a
 * default result; the fix belongs in code or configuration.
 */
public abstract class IntegrityException extends FitEngineException {

    protected IntegrityException(String message) {
        super("integrity_error", message);
    }
}
