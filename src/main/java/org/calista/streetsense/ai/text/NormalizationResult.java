package org.calista.streetsense.ai.text;

import java.util.List;
import java.util.Objects;

public final class NormalizationResult {
    public final String original;
    public final String normalized;
    public final List<Substitution> changes;

    public NormalizationResult(String original, String normalized, List<Substitution> changes) {
        this.original = original == null ? "" : original;
        this.normalized = Objects.requireNonNull(normalized, "normalized");
        this.changes = List.copyOf(Objects.requireNonNull(changes, "changes"));
    }

    /** True when at least one substitution fired. Cleanup alone (case, spacing) does not count. */
    public boolean wasModified() {
        return !changes.isEmpty();
    }

    @Override
    public String toString() {
        return "NormalizationResult{normalized='" + normalized + "', changes=" + changes + '}';
    }
}
