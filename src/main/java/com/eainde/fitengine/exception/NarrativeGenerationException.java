package com.eainde.fitengine.exception;

/**
 * The text provider could not produce a compliant narrative within the retry budget.
 */
public class NarrativeGenerationException extends FitEngineException {

    public NarrativeGenerationException(String message, Throwable cause) {
        super("generation_failed", message, cause);
    }
}
