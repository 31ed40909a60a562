package org.calista.streetsense.ai.text;

import java.util.Objects;

/**
 * One rewrite applied to the input: {@code from -> to} with its origin.
 */
public final class Substitution {
    public final String from;
    public final String to;
    public final SubstitutionType type;

    public Substitution(String from, String to, SubstitutionType type) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        this.type = Objects.requireNonNull(type, "type");
    }

    public static Substitution of(String from, String to, SubstitutionType type) {
        return new Substitution(from, to, type);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Substitution s)) return false;
        return from.equals(s.from) && to.equals(s.to) && type == s.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, type);
    }

    @Override
    public String toString() {
        return from + " -> " + to + " (" + type.tag() + ")";
    }
}
