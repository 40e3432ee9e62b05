package com.dhcpleases.lease;

import com.dhcpleases.loader.StatementPrinter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The records of one leases file in file order. Repeated declarations for the same address are all kept;
 * dhcpd appends a new block each time a lease changes, so the last match is the current one.
 */
public final class LeaseData {
    private final List<LeaseRecord> records;

    public LeaseData(List<LeaseRecord> records) {
        this.records = List.copyOf(records);
    }

    public List<LeaseRecord> getRecords() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public List<LeaseRecord> findByAddress(String ipAddress) {
        return find(Map.of(LeaseField.IP_ADDRESS, ipAddress));
    }

    public List<LeaseRecord> findByName(String name) {
        return find(Map.of(LeaseField.NAME, name));
    }

    /**
     * Records whose every given field is present and equal to the requested value. An empty criteria map
     * matches everything.
     */
    public List<LeaseRecord> find(Map<LeaseField, String> criteria) {
        Objects.requireNonNull(criteria, "criteria");
        List<LeaseRecord> matches = new ArrayList<>();
        for (LeaseRecord record : records) {
            if (matches(record, criteria)) {
                matches.add(record);
            }
        }
        return matches;
    }

    /** Canonical text of every record, concatenated in file order. */
    public String print() {
        StatementPrinter printer = new StatementPrinter();
        StringBuilder out = new StringBuilder();
        for (LeaseRecord record : records) {
            out.append(printer.print(record));
        }
        return out.toString();
    }

    private static boolean matches(LeaseRecord record, Map<LeaseField, String> criteria) {
        for (Map.Entry<LeaseField, String> criterion : criteria.entrySet()) {
            String value = criterion.getKey().valueOf(record);
            if (value == null || !value.equals(criterion.getValue())) {
                return false;
            }
        }
        return true;
    }
}
