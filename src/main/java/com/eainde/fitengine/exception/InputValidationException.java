package com.eainde.fitengine.exception;

/**
 * Resume or job description text is empty or cannot be read. No output is produced.
 */
public class InputValidationException extends FitEngineException {

    public InputValidationException(String message) {
        super("invalid_input", message);
    }
}
