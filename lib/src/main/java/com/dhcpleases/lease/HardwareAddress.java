package com.dhcpleases.lease;

import java.util.Objects;

/** The {@code hardware <type> <mac>;} pair, e.g. {@code ethernet 00:11:85:5d:4e:11}. */
public final class HardwareAddress {
    private final String type;
    private final String macAddress;

    public HardwareAddress(String type, String macAddress) {
        this.type = Objects.requireNonNull(type, "type");
        this.macAddress = Objects.requireNonNull(macAddress, "macAddress");
    }

    public String getType() {
        return type;
    }

    public String getMacAddress() {
        return macAddress;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof HardwareAddress)) {
            return false;
        }
        HardwareAddress other = (HardwareAddress) obj;
        return type.equals(other.type) && macAddress.equals(other.macAddress);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, macAddress);
    }

    @Override
    public String toString() {
        return type + " " + macAddress;
    }
}
