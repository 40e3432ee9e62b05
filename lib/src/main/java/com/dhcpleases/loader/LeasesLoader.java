package com.dhcpleases.loader;

import com.dhcpleases.lease.LeaseData;
import com.dhcpleases.lease.LeaseRecord;
import com.dhcpleases.loader.ast.Declaration;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/** Entry point for loading an ISC dhcpd leases file: scan into declarations, then parse each one. */
public final class LeasesLoader {
    private static final Logger LOGGER = Logger.getLogger(LeasesLoader.class.getName());

    private final LoaderOptions options;
    private final DeclarationScanner scanner;
    private final StatementParser parser = new StatementParser();

    public LeasesLoader() {
        this(LoaderOptions.fromEnvironment());
    }

    public LeasesLoader(LoaderOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.scanner = new DeclarationScanner(options.getScanMode());
    }

    public LoaderOptions getOptions() {
        return options;
    }

    public LoaderResult load(Path leasesPath) throws LoaderException {
        Objects.requireNonNull(leasesPath, "leasesPath");
        try (BufferedReader reader = Files.newBufferedReader(leasesPath, StandardCharsets.UTF_8)) {
            return load(leasesPath.toString(), reader);
        } catch (IOException ex) {
            throw new LoaderException("Failed to read leases file: " + leasesPath, ex);
        }
    }

    public LoaderResult load(String sourceName, String content) throws LoaderException {
        return load(sourceName, new StringReader(content));
    }

    public LoaderResult load(String sourceName, Reader reader) throws LoaderException {
        List<String> lines = new ArrayList<>();
        try {
            BufferedReader buffered =
                    reader instanceof BufferedReader existing ? existing : new BufferedReader(reader);
            String line;
            while ((line = buffered.readLine()) != null) {
                lines.add(line.strip());
            }
        } catch (IOException ex) {
            throw new LoaderException("Failed to read leases from " + sourceName, ex);
        }
        return load(sourceName, lines);
    }

    /**
     * Parses every declaration in {@code lines}. The first scan or parse failure aborts the load; there is
     * no partial result.
     */
    public LoaderResult load(String sourceName, List<String> lines) throws LoaderException {
        List<LoaderMessage> messages = new ArrayList<>();
        List<Declaration> declarations;
        try {
            declarations = scanner.scan(sourceName, lines, messages);
        } catch (ScanException ex) {
            throw new LoaderException("Failed to scan " + sourceName + ": " + ex.getMessage(), ex);
        }

        List<LeaseRecord> records = new ArrayList<>(declarations.size());
        for (Declaration declaration : declarations) {
            if (options.isDebugDeclarations()) {
                LOGGER.info("[dhcpleases] " + declaration.getLocation() + " " + declaration.getHeader());
            }
            try {
                records.add(parser.parse(declaration, messages));
            } catch (LeaseParseException ex) {
                throw new LoaderException("Failed to parse " + sourceName + ": " + ex.getMessage(), ex);
            }
        }
        LOGGER.info(() -> "Loaded " + records.size() + " declarations from " + sourceName);
        return new LoaderResult(new LeaseData(records), messages);
    }
}
