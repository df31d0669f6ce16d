package com.eainde.fitengine.model;

/**
 * The two flags the signal extractor is allowed to raise on a session.
 */
public record SessionFlags(boolean titleInflationDetected, boolean keywordStuffingDetected) {

    public static SessionFlags none() {
        return new SessionFlags(false, false);
    }
}
