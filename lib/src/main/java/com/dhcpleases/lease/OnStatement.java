package com.dhcpleases.lease;

import java.util.List;
import java.util.Objects;

/**
 * A single-line {@code on <events> { <statements> }} block. Events are the {@code |}-separated names;
 * statements are the {@code ;}-terminated bodies with the terminator removed. Only the one-line form is
 * modelled.
 */
public final class OnStatement {
    private final List<String> events;
    private final List<String> statements;

    public OnStatement(List<String> events, List<String> statements) {
        this.events = List.copyOf(events);
        this.statements = List.copyOf(statements);
    }

    public List<String> getEvents() {
        return events;
    }

    public List<String> getStatements() {
        return statements;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof OnStatement)) {
            return false;
        }
        OnStatement other = (OnStatement) obj;
        return events.equals(other.events) && statements.equals(other.statements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(events, statements);
    }

    @Override
    public String toString() {
        return "on " + String.join("|", events) + " " + statements;
    }
}
