package com.eainde.fitengine.coaching;

/**
 * Capability seam in front of the external text provider. Implementations block until the
 * provider answers and return its raw structured output, unvalidated.
 */
public interface NarrativeProvider {

    String generate(NarrativePrompt prompt);
}
