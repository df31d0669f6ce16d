package com.eainde.fitengine.model;

public enum GapSeverity {
    NONE,
    MODERATE,
    HIGH,
    SEVERE
}
