package com.eainde.fitengine.model;

public enum CoachingMode {
    REDIRECTION,
    CREDIBILITY_REPAIR,
    SIGNAL_BUILDING,
    OPTIMIZATION
}
