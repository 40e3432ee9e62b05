package com.dhcpleases.lease;

/** Bare statements whose only meaning is their presence. */
public enum LeaseFlag {
    ABANDONED("abandoned"),
    DELETED("deleted"),
    DYNAMIC_BOOTP("dynamic-bootp"),
    DYNAMIC("dynamic"),
    BOOTP("bootp"),
    RESERVED("reserved");

    private final String statement;

    LeaseFlag(String statement) {
        this.statement = statement;
    }

    public String statement() {
        return statement;
    }
}
