package com.eainde.fitengine.exception;

/**
 * Base type for every failure the engine raises on purpose.
 */
public abstract class FitEngineException extends RuntimeException {

    private final String code;
    private String sessionId;

    protected FitEngineException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected FitEngineException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Session the failure happened in, null when raised outside a session.
     */
    public String getSessionId() {
        return sessionId;
    }

    public FitEngineException withSessionId(String sessionId) {
        if (this.sessionId == null) {
            this.sessionId = sessionId;
        }
        return this;
    }
}
