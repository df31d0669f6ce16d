package com.eainde.fitengine.coaching;

/**
 * A fully rendered provider request: hard instructions plus the session's evidence.
 */
public record NarrativePrompt(String systemMessage, String userMessage) {
}
