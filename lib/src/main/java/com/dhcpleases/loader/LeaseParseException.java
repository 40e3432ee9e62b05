package com.dhcpleases.loader;

import com.dhcpleases.loader.ast.SourceLocation;

/**
 * Checked exception signalling that a leases file could not be scanned or that a declaration could not
 * be parsed. Always identifies the raw line that caused the failure.
 */
public class LeaseParseException extends Exception {
    private final String lineText;
    private final SourceLocation location;

    public LeaseParseException(String message, String lineText, SourceLocation location) {
        super(format(message, location));
        this.lineText = lineText;
        this.location = location;
    }

    public String getLineText() {
        return lineText;
    }

    /** May be null when the failing text was not read from a located source. */
    public SourceLocation getLocation() {
        return location;
    }

    private static String format(String message, SourceLocation location) {
        return location == null ? message : location + ": " + message;
    }
}
