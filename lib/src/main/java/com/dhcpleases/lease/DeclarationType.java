package com.dhcpleases.lease;

public enum DeclarationType {
    LEASE("lease"),
    HOST("host"),
    GROUP("group"),
    SUBGROUP("subgroup"),
    FAILOVER_STATE("failover-state");

    private final String keyword;

    DeclarationType(String keyword) {
        this.keyword = keyword;
    }

    /** Header keyword, or {@code failover-state} for failover peer state declarations. */
    public String keyword() {
        return keyword;
    }

    public static DeclarationType fromKeyword(String keyword) {
        for (DeclarationType type : values()) {
            if (type.keyword.equals(keyword)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown declaration type: " + keyword);
    }
}
