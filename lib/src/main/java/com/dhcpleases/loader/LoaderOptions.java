package com.dhcpleases.loader;

import java.util.Objects;

/**
 * Loader settings. {@link #fromEnvironment()} reads system properties first and falls back to environment
 * variables; {@link #defaults()} ignores both.
 */
public final class LoaderOptions {
    private static final String SCAN_MODE_PROPERTY = "dhcpleases.scanMode";
    private static final String DEBUG_PROPERTY = "dhcpleases.debugDeclarations";
    /** Environment fallback kept for convenience; prefer using system properties. */
    private static final String SCAN_MODE_ENV = "DHCPLEASES_SCAN_MODE";
    private static final String DEBUG_ENV = "DHCPLEASES_DEBUG_DECLARATIONS";
    private static final ScanMode DEFAULT_SCAN_MODE = ScanMode.STRICT;

    private final ScanMode scanMode;
    private final boolean debugDeclarations;

    private LoaderOptions(ScanMode scanMode, boolean debugDeclarations) {
        this.scanMode = Objects.requireNonNull(scanMode, "scanMode");
        this.debugDeclarations = debugDeclarations;
    }

    public static LoaderOptions defaults() {
        return new LoaderOptions(DEFAULT_SCAN_MODE, false);
    }

    public static LoaderOptions fromEnvironment() {
        String mode = lookup(SCAN_MODE_PROPERTY, SCAN_MODE_ENV);
        String debug = lookup(DEBUG_PROPERTY, DEBUG_ENV);
        return new LoaderOptions(
                mode == null || mode.isBlank() ? DEFAULT_SCAN_MODE : ScanMode.parse(mode),
                Boolean.parseBoolean(debug));
    }

    public LoaderOptions withScanMode(ScanMode mode) {
        return new LoaderOptions(mode, debugDeclarations);
    }

    public LoaderOptions withDebugDeclarations(boolean enabled) {
        return new LoaderOptions(scanMode, enabled);
    }

    public ScanMode getScanMode() {
        return scanMode;
    }

    public boolean isDebugDeclarations() {
        return debugDeclarations;
    }

    private static String lookup(String property, String env) {
        String value = System.getProperty(property);
        if (value != null) {
            return value;
        }
        return System.getenv(env);
    }

    @Override
    public String toString() {
        return "LoaderOptions{scanMode=" + scanMode + ", debugDeclarations=" + debugDeclarations + "}";
    }
}
