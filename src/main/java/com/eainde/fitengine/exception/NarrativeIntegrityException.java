package com.eainde.fitengine.exception;

/**
 * Narrative generation was asked to run on inputs it must not paper over, e.g. no strengths.
 */
public class NarrativeIntegrityException extends IntegrityException {

    public NarrativeIntegrityException(String message) {
        super(message);
    }
}
