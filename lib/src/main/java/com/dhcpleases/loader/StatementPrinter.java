package com.dhcpleases.loader;

import com.dhcpleases.lease.HardwareAddress;
import com.dhcpleases.lease.LeaseFlag;
import com.dhcpleases.lease.LeaseRecord;
import com.dhcpleases.lease.OnStatement;
import com.dhcpleases.lease.PeerState;
import java.util.Map;
import java.util.Objects;

/**
 * Writes a {@link LeaseRecord} back out in dhcpd's leases file syntax. Statements come out in a fixed
 * order regardless of the order they were parsed in; absent fields are skipped. Output produced here
 * parses back to an equal record and prints identically.
 */
public final class StatementPrinter {
    private static final String INDENT = "  ";

    public String print(LeaseRecord record) {
        Objects.requireNonNull(record, "record");
        StringBuilder out = new StringBuilder();
        switch (record.getType()) {
            case LEASE:
                String address = record.getIpAddress() != null ? record.getIpAddress() : record.getName();
                out.append("lease ").append(address).append(" {\n");
                break;
            case FAILOVER_STATE:
                // dhcpd 3.1.0 writes a blank line before each failover peer state block
                String peer = record.isQuotedName() ? "\"" + record.getName() + "\"" : record.getName();
                out.append("\nfailover peer ").append(peer).append(" state {\n");
                break;
            default:
                out.append(record.getType().keyword()).append(' ').append(record.getName()).append(" {\n");
                break;
        }
        statement(out, "starts", record.getStarts());
        statement(out, "ends", record.getEnds());
        statement(out, "tstp", record.getTstp());
        statement(out, "tsfp", record.getTsfp());
        statement(out, "atsfp", record.getAtsfp());
        statement(out, "cltt", record.getCltt());
        statement(out, "binding state", record.getBindingState());
        statement(out, "next binding state", record.getNextBindingState());
        flag(out, record, LeaseFlag.DYNAMIC_BOOTP);
        flag(out, record, LeaseFlag.DYNAMIC);
        flag(out, record, LeaseFlag.BOOTP);
        flag(out, record, LeaseFlag.RESERVED);
        HardwareAddress hardware = record.getHardware();
        if (hardware != null) {
            statement(out, "hardware", hardware.getType() + " " + hardware.getMacAddress());
        }
        statement(out, "uid", record.getUid());
        statement(out, "fixed-address", record.getFixedAddress());
        flag(out, record, LeaseFlag.ABANDONED);
        flag(out, record, LeaseFlag.DELETED);
        statement(out, "option agent.circuit-id", record.getOptionAgentCircuitId());
        statement(out, "option agent.remote-id", record.getOptionAgentRemoteId());
        for (Map.Entry<String, String> variable : record.getVariables().entrySet()) {
            statement(out, "set", variable.getKey() + " = " + variable.getValue());
        }
        OnStatement on = record.getOn();
        if (on != null && !on.getEvents().isEmpty()) {
            out.append(INDENT).append("on ").append(String.join("|", on.getEvents())).append(" {");
            for (String body : on.getStatements()) {
                out.append(' ').append(body).append(';');
            }
            out.append(" }\n");
        }
        statement(out, "client-hostname", record.getClientHostname());
        peerState(out, "my state", record.getMyState());
        peerState(out, "partner state", record.getPartnerState());
        statement(out, "mclt", record.getMclt());
        out.append("}\n");
        return out.toString();
    }

    private static void statement(StringBuilder out, String keyword, String value) {
        if (value == null || value.isEmpty()) {
            return;
        }
        out.append(INDENT).append(keyword).append(' ').append(value).append(";\n");
    }

    private static void flag(StringBuilder out, LeaseRecord record, LeaseFlag flag) {
        if (record.hasFlag(flag)) {
            out.append(INDENT).append(flag.statement()).append(";\n");
        }
    }

    private static void peerState(StringBuilder out, String keyword, PeerState state) {
        if (state != null) {
            statement(out, keyword, state.getState() + " at " + state.getDate());
        }
    }
}
