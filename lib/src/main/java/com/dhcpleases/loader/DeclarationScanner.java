package com.dhcpleases.loader;

import com.dhcpleases.loader.ast.Declaration;
import com.dhcpleases.loader.ast.SourceLocation;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits the lines of a leases file into top-level declarations. Braces nest exactly one level deep:
 * a header line ending in <code>" {"</code> opens a block and a line holding only a closing brace ends it.
 * Blank lines, comments and stray text outside a block are ignored.
 */
public final class DeclarationScanner {
    private static final Logger LOGGER = Logger.getLogger(DeclarationScanner.class.getName());
    private static final Pattern OPEN_LINE = Pattern.compile("(.*) \\{");
    private static final String CLOSE_LINE = "}";

    private final ScanMode mode;

    public DeclarationScanner() {
        this(ScanMode.STRICT);
    }

    public DeclarationScanner(ScanMode mode) {
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    public ScanMode getMode() {
        return mode;
    }

    public List<Declaration> scan(String sourceName, List<String> lines) throws ScanException {
        return scan(sourceName, lines, new ArrayList<>());
    }

    /**
     * Scans {@code lines} in order. Lenient-mode diagnostics are appended to {@code messages}.
     */
    public List<Declaration> scan(String sourceName, List<String> lines, List<LoaderMessage> messages)
            throws ScanException {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(lines, "lines");
        List<Declaration> declarations = new ArrayList<>();
        boolean open = false;
        String header = null;
        List<String> body = null;
        SourceLocation start = null;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i) == null ? "" : lines.get(i).strip();
            SourceLocation location = new SourceLocation(sourceName, i + 1);
            if (!open) {
                if (line.isEmpty() || line.startsWith("#")) {
                    continue;
                }
                Matcher matcher = OPEN_LINE.matcher(line);
                if (matcher.matches()) {
                    header = matcher.group(1).strip();
                    body = new ArrayList<>();
                    body.add(line);
                    start = location;
                    open = true;
                } else {
                    LOGGER.fine(() -> "Ignoring text outside a declaration at " + location + ": " + line);
                }
                continue;
            }
            if (CLOSE_LINE.equals(line)) {
                body.add(line);
                declarations.add(new Declaration(header, body, start));
                open = false;
                header = null;
                body = null;
                start = null;
                continue;
            }
            if (mode == ScanMode.STRICT && OPEN_LINE.matcher(line).matches()) {
                throw new ScanException(
                        "nested block inside declaration opened at line " + start.getLine(), line, location);
            }
            body.add(line);
        }

        if (open) {
            if (mode == ScanMode.STRICT) {
                throw new ScanException("unterminated declaration: " + header, body.get(0), start);
            }
            String message = "dropping unterminated declaration: " + header;
            LOGGER.warning(start + ": " + message);
            messages.add(LoaderMessage.warning(message, start));
        }
        return declarations;
    }
}
