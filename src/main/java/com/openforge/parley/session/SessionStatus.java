package com.openforge.parley.session;

public enum SessionStatus {
    ACTIVE,
    CLOSED,
    EXPIRED
}
