package com.dhcpleases.lease;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A parsed declaration from a leases file: a lease, host, group, subgroup or failover peer state.
 *
 * <p>Only the statements that occurred in the source are populated. Every optional getter returns
 * {@code null} when its statement was absent, flags are reported through {@link #hasFlag(LeaseFlag)},
 * and timestamps are the verbatim {@code <weekday> YYYY/MM/DD HH:MM:SS} text.
 */
public final class LeaseRecord {
    private final DeclarationType type;
    private final String name;
    private final String ipAddress;
    private final String fixedAddress;
    private final String starts;
    private final String ends;
    private final String tstp;
    private final String tsfp;
    private final String atsfp;
    private final String cltt;
    private final String bindingState;
    private final String nextBindingState;
    private final String uid;
    private final String clientHostname;
    private final String optionAgentCircuitId;
    private final String optionAgentRemoteId;
    private final HardwareAddress hardware;
    private final Set<LeaseFlag> flags;
    private final Map<String, String> variables;
    private final OnStatement on;
    private final PeerState myState;
    private final PeerState partnerState;
    private final String mclt;
    private final boolean quotedName;

    private LeaseRecord(Builder builder) {
        this.type = builder.type;
        this.name = builder.name;
        this.ipAddress = builder.ipAddress;
        this.fixedAddress = builder.fixedAddress;
        this.starts = builder.starts;
        this.ends = builder.ends;
        this.tstp = builder.tstp;
        this.tsfp = builder.tsfp;
        this.atsfp = builder.atsfp;
        this.cltt = builder.cltt;
        this.bindingState = builder.bindingState;
        this.nextBindingState = builder.nextBindingState;
        this.uid = builder.uid;
        this.clientHostname = builder.clientHostname;
        this.optionAgentCircuitId = builder.optionAgentCircuitId;
        this.optionAgentRemoteId = builder.optionAgentRemoteId;
        this.hardware = builder.hardware;
        this.flags = Collections.unmodifiableSet(EnumSet.copyOf(builder.flags));
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(builder.variables));
        this.on = builder.on;
        this.myState = builder.myState;
        this.partnerState = builder.partnerState;
        this.mclt = builder.mclt;
        this.quotedName = builder.quotedName;
    }

    /** For {@link DeclarationType#LEASE} the name is the leased address and also sets the IP address. */
    public static Builder builder(DeclarationType type, String name) {
        return new Builder(type, name);
    }

    public DeclarationType getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public String getFixedAddress() {
        return fixedAddress;
    }

    public String getStarts() {
        return starts;
    }

    public String getEnds() {
        return ends;
    }

    public String getTstp() {
        return tstp;
    }

    public String getTsfp() {
        return tsfp;
    }

    public String getAtsfp() {
        return atsfp;
    }

    public String getCltt() {
        return cltt;
    }

    public String getBindingState() {
        return bindingState;
    }

    public String getNextBindingState() {
        return nextBindingState;
    }

    /** Quoted, including the surrounding quotes and any octal escapes. */
    public String getUid() {
        return uid;
    }

    /** Quoted, including the surrounding quotes. */
    public String getClientHostname() {
        return clientHostname;
    }

    public String getOptionAgentCircuitId() {
        return optionAgentCircuitId;
    }

    public String getOptionAgentRemoteId() {
        return optionAgentRemoteId;
    }

    public HardwareAddress getHardware() {
        return hardware;
    }

    public String getHardwareType() {
        return hardware == null ? null : hardware.getType();
    }

    public String getMacAddress() {
        return hardware == null ? null : hardware.getMacAddress();
    }

    public boolean hasFlag(LeaseFlag flag) {
        return flags.contains(flag);
    }

    public Set<LeaseFlag> getFlags() {
        return flags;
    }

    /** Values of the {@code set <name> = <expr>;} statements, in the order they were first seen. */
    public Map<String, String> getVariables() {
        return variables;
    }

    public OnStatement getOn() {
        return on;
    }

    public PeerState getMyState() {
        return myState;
    }

    public PeerState getPartnerState() {
        return partnerState;
    }

    public String getMclt() {
        return mclt;
    }

    /**
     * Whether the header wrote the name in double quotes. Only failover peer state headers carry this
     * choice; {@link #getName()} never includes the quotes.
     */
    public boolean isQuotedName() {
        return quotedName;
    }

    public Builder toBuilder() {
        Builder builder = new Builder(type, name);
        builder.ipAddress = ipAddress;
        builder.fixedAddress = fixedAddress;
        builder.starts = starts;
        builder.ends = ends;
        builder.tstp = tstp;
        builder.tsfp = tsfp;
        builder.atsfp = atsfp;
        builder.cltt = cltt;
        builder.bindingState = bindingState;
        builder.nextBindingState = nextBindingState;
        builder.uid = uid;
        builder.clientHostname = clientHostname;
        builder.optionAgentCircuitId = optionAgentCircuitId;
        builder.optionAgentRemoteId = optionAgentRemoteId;
        builder.hardware = hardware;
        builder.flags.addAll(flags);
        builder.variables.putAll(variables);
        builder.on = on;
        builder.myState = myState;
        builder.partnerState = partnerState;
        builder.mclt = mclt;
        builder.quotedName = quotedName;
        return builder;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof LeaseRecord)) {
            return false;
        }
        LeaseRecord other = (LeaseRecord) obj;
        return type == other.type
                && Objects.equals(name, other.name)
                && Objects.equals(ipAddress, other.ipAddress)
                && Objects.equals(fixedAddress, other.fixedAddress)
                && Objects.equals(starts, other.starts)
                && Objects.equals(ends, other.ends)
                && Objects.equals(tstp, other.tstp)
                && Objects.equals(tsfp, other.tsfp)
                && Objects.equals(atsfp, other.atsfp)
                && Objects.equals(cltt, other.cltt)
                && Objects.equals(bindingState, other.bindingState)
                && Objects.equals(nextBindingState, other.nextBindingState)
                && Objects.equals(uid, other.uid)
                && Objects.equals(clientHostname, other.clientHostname)
                && Objects.equals(optionAgentCircuitId, other.optionAgentCircuitId)
                && Objects.equals(optionAgentRemoteId, other.optionAgentRemoteId)
                && Objects.equals(hardware, other.hardware)
                && flags.equals(other.flags)
                && variables.equals(other.variables)
                && Objects.equals(on, other.on)
                && Objects.equals(myState, other.myState)
                && Objects.equals(partnerState, other.partnerState)
                && Objects.equals(mclt, other.mclt)
                && quotedName == other.quotedName;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, ipAddress, starts, ends, bindingState, hardware, flags);
    }

    @Override
    public String toString() {
        return type.keyword() + " " + name;
    }

    public static final class Builder {
        private final DeclarationType type;
        private final String name;
        private String ipAddress;
        private String fixedAddress;
        private String starts;
        private String ends;
        private String tstp;
        private String tsfp;
        private String atsfp;
        private String cltt;
        private String bindingState;
        private String nextBindingState;
        private String uid;
        private String clientHostname;
        private String optionAgentCircuitId;
        private String optionAgentRemoteId;
        private HardwareAddress hardware;
        private final Set<LeaseFlag> flags = EnumSet.noneOf(LeaseFlag.class);
        private final Map<String, String> variables = new LinkedHashMap<>();
        private OnStatement on;
        private PeerState myState;
        private PeerState partnerState;
        private String mclt;
        private boolean quotedName;

        private Builder(DeclarationType type, String name) {
            this.type = Objects.requireNonNull(type, "type");
            this.name = Objects.requireNonNull(name, "name");
            if (type == DeclarationType.LEASE) {
                this.ipAddress = name;
            }
            // dhcpd itself writes failover peer names quoted
            this.quotedName = type == DeclarationType.FAILOVER_STATE;
        }

        public Builder ipAddress(String value) {
            this.ipAddress = value;
            return this;
        }

        public Builder fixedAddress(String value) {
            this.fixedAddress = value;
            return this;
        }

        public Builder starts(String value) {
            this.starts = value;
            return this;
        }

        public Builder ends(String value) {
            this.ends = value;
            return this;
        }

        public Builder tstp(String value) {
            this.tstp = value;
            return this;
        }

        public Builder tsfp(String value) {
            this.tsfp = value;
            return this;
        }

        public Builder atsfp(String value) {
            this.atsfp = value;
            return this;
        }

        public Builder cltt(String value) {
            this.cltt = value;
            return this;
        }

        public Builder bindingState(String value) {
            this.bindingState = value;
            return this;
        }

        public Builder nextBindingState(String value) {
            this.nextBindingState = value;
            return this;
        }

        public Builder uid(String value) {
            this.uid = value;
            return this;
        }

        public Builder clientHostname(String value) {
            this.clientHostname = value;
            return this;
        }

        public Builder optionAgentCircuitId(String value) {
            this.optionAgentCircuitId = value;
            return this;
        }

        public Builder optionAgentRemoteId(String value) {
            this.optionAgentRemoteId = value;
            return this;
        }

        public Builder hardware(HardwareAddress value) {
            this.hardware = value;
            return this;
        }

        public Builder flag(LeaseFlag flag) {
            flags.add(Objects.requireNonNull(flag, "flag"));
            return this;
        }

        public Builder variable(String variable, String expression) {
            variables.put(
                    Objects.requireNonNull(variable, "variable"), Objects.requireNonNull(expression, "expression"));
            return this;
        }

        public Builder on(OnStatement value) {
            this.on = value;
            return this;
        }

        public Builder myState(PeerState value) {
            this.myState = value;
            return this;
        }

        public Builder partnerState(PeerState value) {
            this.partnerState = value;
            return this;
        }

        public Builder mclt(String value) {
            this.mclt = value;
            return this;
        }

        public Builder quotedName(boolean value) {
            this.quotedName = value;
            return this;
        }

        public LeaseRecord build() {
            return new LeaseRecord(this);
        }
    }
}
