package com.dhcpleases.loader;

import com.dhcpleases.lease.LeaseData;
import java.util.List;

/** Records loaded from one leases file together with the non-fatal diagnostics raised on the way. */
public final class LoaderResult {
    private final LeaseData leaseData;
    private final List<LoaderMessage> messages;

    public LoaderResult(LeaseData leaseData, List<LoaderMessage> messages) {
        this.leaseData = leaseData;
        this.messages = List.copyOf(messages);
    }

    public LeaseData getLeaseData() {
        return leaseData;
    }

    public List<LoaderMessage> getMessages() {
        return messages;
    }
}
