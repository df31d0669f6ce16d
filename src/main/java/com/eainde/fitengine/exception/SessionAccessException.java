package com.eainde.fitengine.exception;

/**
 * Read of session-scoped data from outside the owning session, or of a sealed session.
 */
public class SessionAccessException extends FitEngineException {

    public SessionAccessException(String message) {
        super("session_unavailable", message);
    }
}
