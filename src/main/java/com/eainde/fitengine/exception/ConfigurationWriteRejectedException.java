package com.eainde.fitengine.exception;

/**
 * Attempt to change global configuration from a session-tagged source.
 */
public class ConfigurationWriteRejectedException extends FitEngineException {

    public ConfigurationWriteRejectedException(String message) {
        super("configuration_write_rejected", message);
    }
}
