package com.eainde.fitengine.exception;

/**
 * Provider output did not match the narrative schema or broke a phrase rule. Retryable.
 */
public class MalformedNarrativeException extends FitEngineException {

    public MalformedNarrativeException(String message) {
        super("malformed_narrative", message);
    }

    public MalformedNarrativeException(String message, Throwable cause) {
        super("malformed_narrative", message, cause);
    }
}
