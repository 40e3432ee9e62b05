package com.dhcpleases.loader;

import com.dhcpleases.loader.ast.SourceLocation;

/**
 * A non-fatal diagnostic produced while loading a leases file, such as a dropped unterminated block or a
 * statement that overwrote an earlier value.
 */
public final class LoaderMessage {

    public enum Level {
        INFO,
        WARNING,
        ERROR
    }

    private final Level level;
    private final String message;
    private final String sourceFilename;
    private final int sourceLineno;

    public LoaderMessage(Level level, String message, String sourceFilename, int sourceLineno) {
        this.level = level;
        this.message = message;
        this.sourceFilename = sourceFilename;
        this.sourceLineno = sourceLineno;
    }

    static LoaderMessage warning(String message, SourceLocation location) {
        return new LoaderMessage(Level.WARNING, message, location.getSourceName(), location.getLine());
    }

    public Level getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    public String getSourceFilename() {
        return sourceFilename;
    }

    public int getSourceLineno() {
        return sourceLineno;
    }

    @Override
    public String toString() {
        return level + " " + sourceFilename + ":" + sourceLineno + " " + message;
    }
}
