package com.eainde.fitengine.session;

/**
 * Keys of the records a pipeline run writes into its session scope.
 */
public final class SessionKeys {

    public static final String RESUME = "resume";
    public static final String JOB_DESCRIPTION = "job-description";
    public static final String SIGNALS = "signals";
    public static final String LEVEL_ASSESSMENT = "level-assessment";
    public static final String GAP_CLASSIFICATION = "gap-classification";
    public static final String TERMINAL_STATE = "terminal-state";
    public static final String STRENGTHS = "strengths";
    public static final String NARRATIVE = "narrative";

    private SessionKeys() {
    }
}
