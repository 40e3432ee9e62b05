package com.dhcpleases.loader;

import com.dhcpleases.lease.DeclarationType;
import com.dhcpleases.lease.HardwareAddress;
import com.dhcpleases.lease.LeaseFlag;
import com.dhcpleases.lease.LeaseRecord;
import com.dhcpleases.lease.OnStatement;
import com.dhcpleases.lease.PeerState;
import com.dhcpleases.loader.ast.Declaration;
import com.dhcpleases.loader.ast.SourceLocation;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one scanned {@link Declaration} into a {@link LeaseRecord}. The header selects the declaration
 * type; each body line is then matched against an ordered list of statement rules and the first rule that
 * matches the whole line wins. Statements may appear in any order. A repeated single-valued statement
 * overwrites the earlier value and is reported as a warning.
 */
public final class StatementParser {
    private static final Logger LOGGER = Logger.getLogger(StatementParser.class.getName());

    private static final String IPV4 = "\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}";
    // weekday year/month/day hour:minute:second
    private static final String TIMESTAMP = "\\d+ \\d{4}/\\d{2}/\\d{2} \\d{2}:\\d{2}:\\d{2}";

    private static final Pattern LEASE_HEADER = Pattern.compile("lease (" + IPV4 + ")");
    private static final Pattern NAMED_HEADER = Pattern.compile("(host|group|subgroup) (\\S.*)");
    private static final Pattern QUOTED_FAILOVER_HEADER = Pattern.compile("failover peer \"([^\"]*)\" state");
    private static final Pattern BARE_FAILOVER_HEADER = Pattern.compile("failover peer (\\S+) state");

    // Order matters where one keyword is a suffix of another: next binding state, atsfp, dynamic-bootp.
    private static final List<StatementRule> RULES =
            List.of(
                    timestamp("starts", LeaseRecord.Builder::starts),
                    timestamp("ends", LeaseRecord.Builder::ends),
                    timestamp("tstp", LeaseRecord.Builder::tstp),
                    timestamp("atsfp", LeaseRecord.Builder::atsfp),
                    timestamp("tsfp", LeaseRecord.Builder::tsfp),
                    timestamp("cltt", LeaseRecord.Builder::cltt),
                    single(
                            "next binding state",
                            "next binding state ([\\w-]+);",
                            (m, b) -> b.nextBindingState(m.group(1))),
                    single("binding state", "binding state ([\\w-]+);", (m, b) -> b.bindingState(m.group(1))),
                    single("uid", "uid (\".*\");", (m, b) -> b.uid(m.group(1))),
                    single("client-hostname", "client-hostname (\".*\");", (m, b) -> b.clientHostname(m.group(1))),
                    flag(LeaseFlag.ABANDONED),
                    flag(LeaseFlag.DELETED),
                    flag(LeaseFlag.DYNAMIC_BOOTP),
                    flag(LeaseFlag.DYNAMIC),
                    flag(LeaseFlag.BOOTP),
                    flag(LeaseFlag.RESERVED),
                    single(
                            "hardware",
                            "hardware (\\S+) (\\S+);",
                            (m, b) -> b.hardware(new HardwareAddress(m.group(1), m.group(2)))),
                    single("fixed-address", "fixed-address (.+);", (m, b) -> b.fixedAddress(m.group(1))),
                    single(
                            "option agent.circuit-id",
                            "option agent\\.circuit-id (.+);",
                            (m, b) -> b.optionAgentCircuitId(m.group(1))),
                    single(
                            "option agent.remote-id",
                            "option agent\\.remote-id (.+);",
                            (m, b) -> b.optionAgentRemoteId(m.group(1))),
                    new StatementRule(
                            "set ([\\w-]+) = (.*);",
                            m -> "set " + m.group(1),
                            (m, b) -> b.variable(m.group(1), m.group(2))),
                    single("on", "on (.+?) \\{(.*)\\};?", (m, b) -> b.on(onStatement(m.group(1), m.group(2)))),
                    single(
                            "my state",
                            "my state (\\S+) at (" + TIMESTAMP + ");",
                            (m, b) -> b.myState(new PeerState(m.group(1), m.group(2)))),
                    single(
                            "partner state",
                            "partner state (\\S+) at (" + TIMESTAMP + ");",
                            (m, b) -> b.partnerState(new PeerState(m.group(1), m.group(2)))),
                    single("mclt", "mclt (\\w+);", (m, b) -> b.mclt(m.group(1))));

    public LeaseRecord parse(Declaration declaration) throws HeaderException, StatementException {
        return parse(declaration, new ArrayList<>());
    }

    /**
     * Parses {@code declaration}, appending a warning to {@code messages} for every statement that
     * overwrote an earlier one.
     *
     * @throws HeaderException if the header names no known declaration type
     * @throws StatementException for the first body line no rule matches
     */
    public LeaseRecord parse(Declaration declaration, List<LoaderMessage> messages)
            throws HeaderException, StatementException {
        Objects.requireNonNull(declaration, "declaration");
        LeaseRecord.Builder builder = classifyHeader(declaration.getHeader(), declaration.getLocation());
        Set<String> seen = new HashSet<>();
        List<String> body = declaration.getBodyLines();
        for (int i = 0; i < body.size(); i++) {
            String line = body.get(i).strip();
            if (line.isEmpty() || line.startsWith("#") || line.equals("}")) {
                continue;
            }
            SourceLocation location = declaration.bodyLineLocation(i);
            String conflictKey = apply(line, builder, location);
            if (conflictKey != null && !seen.add(conflictKey)) {
                String message = conflictKey + " repeated in " + declaration.getHeader() + "; keeping the last value";
                LOGGER.fine(() -> location + ": " + message);
                messages.add(LoaderMessage.warning(message, location));
            }
        }
        return builder.build();
    }

    static LeaseRecord.Builder classifyHeader(String header, SourceLocation location) throws HeaderException {
        String trimmed = header.strip();
        Matcher matcher = LEASE_HEADER.matcher(trimmed);
        if (matcher.matches()) {
            return LeaseRecord.builder(DeclarationType.LEASE, matcher.group(1));
        }
        matcher = NAMED_HEADER.matcher(trimmed);
        if (matcher.matches()) {
            return LeaseRecord.builder(DeclarationType.fromKeyword(matcher.group(1)), matcher.group(2));
        }
        matcher = QUOTED_FAILOVER_HEADER.matcher(trimmed);
        if (matcher.matches()) {
            return LeaseRecord.builder(DeclarationType.FAILOVER_STATE, matcher.group(1)).quotedName(true);
        }
        matcher = BARE_FAILOVER_HEADER.matcher(trimmed);
        if (matcher.matches()) {
            return LeaseRecord.builder(DeclarationType.FAILOVER_STATE, matcher.group(1)).quotedName(false);
        }
        throw new HeaderException(header, location);
    }

    /** Applies the first matching rule and returns its conflict key, or null for repeatable statements. */
    private static String apply(String line, LeaseRecord.Builder builder, SourceLocation location)
            throws StatementException {
        for (StatementRule rule : RULES) {
            Matcher matcher = rule.pattern.matcher(line);
            if (matcher.matches()) {
                rule.action.accept(matcher, builder);
                return rule.conflictKey == null ? null : rule.conflictKey.apply(matcher);
            }
        }
        throw new StatementException(line, location);
    }

    private static OnStatement onStatement(String events, String statements) {
        return new OnStatement(split(events, "\\|"), split(statements, ";"));
    }

    private static List<String> split(String text, String separator) {
        List<String> parts = new ArrayList<>();
        for (String part : text.split(separator)) {
            String trimmed = part.strip();
            if (!trimmed.isEmpty()) {
                parts.add(trimmed);
            }
        }
        return parts;
    }

    private static StatementRule timestamp(String keyword, BiConsumer<LeaseRecord.Builder, String> setter) {
        return single(keyword, keyword + " (" + TIMESTAMP + ");", (m, b) -> setter.accept(b, m.group(1)));
    }

    private static StatementRule single(
            String name, String regex, BiConsumer<Matcher, LeaseRecord.Builder> action) {
        return new StatementRule(regex, m -> name, action);
    }

    private static StatementRule flag(LeaseFlag flag) {
        return new StatementRule(Pattern.quote(flag.statement()) + ";", null, (m, b) -> b.flag(flag));
    }

    private static final class StatementRule {
        private final Pattern pattern;
        private final Function<Matcher, String> conflictKey;
        private final BiConsumer<Matcher, LeaseRecord.Builder> action;

        StatementRule(
                String regex,
                Function<Matcher, String> conflictKey,
                BiConsumer<Matcher, LeaseRecord.Builder> action) {
            this.pattern = Pattern.compile(regex);
            this.conflictKey = conflictKey;
            this.action = action;
        }
    }
}
