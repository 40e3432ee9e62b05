package com.dhcpleases.loader;

import com.dhcpleases.loader.ast.SourceLocation;

/** Malformed block boundaries: a nested opening line or a block left open at end of input. */
public final class ScanException extends LeaseParseException {
    public ScanException(String message, String lineText, SourceLocation location) {
        super(message, lineText, location);
    }
}
