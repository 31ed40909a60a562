package org.calista.streetsense.ai.hybrid;

import org.calista.streetsense.ai.text.Substitution;

import java.util.List;
import java.util.Objects;

/**
 * What preprocessing did to the raw input.
 * {@code normalized} is the text after normalization and typo correction, the one both classifiers saw.
 * Changes list normalizer substitutions first, then typo corrections.
 */
public final class PreprocessTrace {
    public final String original;
    public final String normalized;
    public final List<Substitution> changes;

    public PreprocessTrace(String original, String normalized, List<Substitution> changes) {
        this.original = Objects.requireNonNull(original, "original");
        this.normalized = Objects.requireNonNull(normalized, "normalized");
        this.changes = List.copyOf(Objects.requireNonNull(changes, "changes"));
    }

    public boolean wasModified() {
        return !changes.isEmpty();
    }

    @Override
    public String toString() {
        return "PreprocessTrace{'" + original + "' -> '" + normalized + "', changes=" + changes + '}';
    }
}
