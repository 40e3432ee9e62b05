package com.dhcpleases.loader;

import java.util.Locale;

/** How the declaration scanner treats broken block boundaries. */
public enum ScanMode {
    /** Raise {@link ScanException} for nested opening lines and blocks left open at end of input. */
    STRICT,
    /** Keep nested opening lines as body text and drop a block left open at end of input. */
    LENIENT;

    public static ScanMode parse(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ScanMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown scan mode: " + value);
    }
}
