package com.eainde.fitengine.config;

/**
 * Who is asking to change global configuration. Anything carrying a session id is candidate
 * data and may never be written back.
 */
public record ConfigurationSource(String origin, String sessionId) {

    public static ConfigurationSource administrative(String origin) {
        return new ConfigurationSource(origin, null);
    }

    public static ConfigurationSource session(String sessionId) {
        return new ConfigurationSource("analysis-session", sessionId);
    }

    public boolean isSessionTagged() {
        return sessionId != null;
    }
}
