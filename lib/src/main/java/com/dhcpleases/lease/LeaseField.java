package com.dhcpleases.lease;

import java.util.function.Function;

/**
 * Scalar and flag fields of a {@link LeaseRecord} by their snake_case key. Values are rendered as the
 * text found in the leases file; a set flag renders as {@code "1"}, an absent field as {@code null}.
 */
public enum LeaseField {
    TYPE("type", record -> record.getType().keyword()),
    NAME("name", LeaseRecord::getName),
    IP_ADDRESS("ip_address", LeaseRecord::getIpAddress),
    FIXED_ADDRESS("fixed_address", LeaseRecord::getFixedAddress),
    STARTS("starts", LeaseRecord::getStarts),
    ENDS("ends", LeaseRecord::getEnds),
    TSTP("tstp", LeaseRecord::getTstp),
    TSFP("tsfp", LeaseRecord::getTsfp),
    ATSFP("atsfp", LeaseRecord::getAtsfp),
    CLTT("cltt", LeaseRecord::getCltt),
    BINDING_STATE("binding_state", LeaseRecord::getBindingState),
    NEXT_BINDING_STATE("next_binding_state", LeaseRecord::getNextBindingState),
    UID("uid", LeaseRecord::getUid),
    CLIENT_HOSTNAME("client_hostname", LeaseRecord::getClientHostname),
    ABANDONED("abandoned", flag(LeaseFlag.ABANDONED)),
    DELETED("deleted", flag(LeaseFlag.DELETED)),
    DYNAMIC_BOOTP("dynamic_bootp", flag(LeaseFlag.DYNAMIC_BOOTP)),
    DYNAMIC("dynamic", flag(LeaseFlag.DYNAMIC)),
    BOOTP("bootp", flag(LeaseFlag.BOOTP)),
    RESERVED("reserved", flag(LeaseFlag.RESERVED)),
    OPTION_AGENT_CIRCUIT_ID("option_agent_circuit_id", LeaseRecord::getOptionAgentCircuitId),
    OPTION_AGENT_REMOTE_ID("option_agent_remote_id", LeaseRecord::getOptionAgentRemoteId),
    HARDWARE_TYPE("hardware_type", LeaseRecord::getHardwareType),
    MAC_ADDRESS("mac_address", LeaseRecord::getMacAddress),
    MY_STATE("my_state", record -> record.getMyState() == null ? null : record.getMyState().getState()),
    MY_STATE_DATE("my_state_date", record -> record.getMyState() == null ? null : record.getMyState().getDate()),
    PARTNER_STATE(
            "partner_state",
            record -> record.getPartnerState() == null ? null : record.getPartnerState().getState()),
    PARTNER_STATE_DATE(
            "partner_state_date",
            record -> record.getPartnerState() == null ? null : record.getPartnerState().getDate()),
    MCLT("mclt", LeaseRecord::getMclt);

    private final String key;
    private final Function<LeaseRecord, String> accessor;

    LeaseField(String key, Function<LeaseRecord, String> accessor) {
        this.key = key;
        this.accessor = accessor;
    }

    public String key() {
        return key;
    }

    public String valueOf(LeaseRecord record) {
        return accessor.apply(record);
    }

    public static LeaseField fromKey(String key) {
        for (LeaseField field : values()) {
            if (field.key.equals(key)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown lease field: " + key);
    }

    private static Function<LeaseRecord, String> flag(LeaseFlag flag) {
        return record -> record.hasFlag(flag) ? "1" : null;
    }
}
