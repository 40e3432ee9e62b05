package com.dhcpleases.loader.ast;

import java.util.List;
import java.util.Objects;

/**
 * One top-level bracketed block of a leases file. {@link #getLines()} holds every line as scanned,
 * including the opening header line and the closing brace; {@link #getBodyLines()} holds only the
 * statements between them.
 */
public final class Declaration {
    private final String header;
    private final List<String> lines;
    private final SourceLocation location;

    public Declaration(String header, List<String> lines, SourceLocation location) {
        this.header = Objects.requireNonNull(header, "header");
        this.lines = List.copyOf(lines);
        this.location = Objects.requireNonNull(location, "location");
        if (this.lines.size() < 2) {
            throw new IllegalArgumentException("Declaration needs an opening and a closing line: " + header);
        }
    }

    public String getHeader() {
        return header;
    }

    public List<String> getLines() {
        return lines;
    }

    public List<String> getBodyLines() {
        return lines.subList(1, lines.size() - 1);
    }

    /** Location of the opening line. */
    public SourceLocation getLocation() {
        return location;
    }

    /** Location of the body line at {@code index} within {@link #getBodyLines()}. */
    public SourceLocation bodyLineLocation(int index) {
        return location.offset(index + 1);
    }

    @Override
    public String toString() {
        return header + " @ " + location;
    }
}
