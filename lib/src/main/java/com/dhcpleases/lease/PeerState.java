package com.dhcpleases.lease;

import java.util.Objects;

/**
 * One side of a failover peer state declaration: the protocol state and the timestamp it was entered,
 * kept in the leases file's own {@code <weekday> YYYY/MM/DD HH:MM:SS} text.
 */
public final class PeerState {
    private final String state;
    private final String date;

    public PeerState(String state, String date) {
        this.state = Objects.requireNonNull(state, "state");
        this.date = Objects.requireNonNull(date, "date");
    }

    public String getState() {
        return state;
    }

    public String getDate() {
        return date;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof PeerState)) {
            return false;
        }
        PeerState other = (PeerState) obj;
        return state.equals(other.state) && date.equals(other.date);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, date);
    }

    @Override
    public String toString() {
        return state + " at " + date;
    }
}
