package com.dhcpleases.loader;

/**
 * Checked exception signalling that the loader failed to read or parse a leases file. Wraps IO failures
 * and the first {@link LeaseParseException} raised while scanning or parsing.
 */
public final class LoaderException extends Exception {
    public LoaderException(String message) {
        super(message);
    }

    public LoaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
