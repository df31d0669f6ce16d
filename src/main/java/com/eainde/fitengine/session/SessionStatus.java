package com.eainde.fitengine.session;

public enum SessionStatus {
    ACTIVE,
    SEALED
}
