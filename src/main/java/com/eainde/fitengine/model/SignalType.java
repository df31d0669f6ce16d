package com.eainde.fitengine.model;

public enum SignalType {
    SCOPE,
    LEADERSHIP,
    TECHNICAL_DEPTH,
    TITLE
}
