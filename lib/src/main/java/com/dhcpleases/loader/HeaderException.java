package com.dhcpleases.loader;

import com.dhcpleases.loader.ast.SourceLocation;

/** The declaration header names no known declaration type. */
public final class HeaderException extends LeaseParseException {
    public HeaderException(String header, SourceLocation location) {
        super("unrecognized declaration header: " + header, header, location);
    }
}
