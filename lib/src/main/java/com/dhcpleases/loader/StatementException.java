package com.dhcpleases.loader;

import com.dhcpleases.loader.ast.SourceLocation;

/** A body line matched none of the statement rules. */
public final class StatementException extends LeaseParseException {
    public StatementException(String line, SourceLocation location) {
        super("statement not recognized: " + line, line, location);
    }
}
