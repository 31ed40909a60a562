package org.calista.streetsense.ai.typo;

import java.util.Objects;

public final class Correction {
    public final String from;
    public final String to;
    public final int distance;

    public Correction(String from, String to, int distance) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        this.distance = distance;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Correction c)) return false;
        return distance == c.distance && from.equals(c.from) && to.equals(c.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, distance);
    }

    @Override
    public String toString() {
        return from + " -> " + to + " (d=" + distance + ")";
    }
}
