package org.calista.streetsense.ai.typo;

import java.util.List;
import java.util.Objects;

public final class CorrectionResult {
    public final String original;
    public final String corrected;
    public final List<Correction> corrections;

    public CorrectionResult(String original, String corrected, List<Correction> corrections) {
        this.original = original == null ? "" : original;
        this.corrected = Objects.requireNonNull(corrected, "corrected");
        this.corrections = List.copyOf(Objects.requireNonNull(corrections, "corrections"));
    }

    public boolean wasModified() {
        return !corrections.isEmpty();
    }

    @Override
    public String toString() {
        return "CorrectionResult{corrected='" + corrected + "', corrections=" + corrections + '}';
    }
}
