package org.calista.streetsense.ai.hybrid;

import java.util.Locale;

/** Which branch of the pipeline produced the final decision. */
public enum ClassificationSource {
    PATTERN_HIGH,
    COMBINED_AGREEMENT,
    PATTERN_PREFERRED,
    SEMANTIC_PREFERRED,
    PATTERN_ONLY,
    SEMANTIC_ONLY,
    SEMANTIC_FALLBACK,
    NO_MATCH,
    EMPTY_INPUT;

    /** Lower-case tag used in logs and reports, e.g. {@code pattern_high}. */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean usedPattern() {
        return this == PATTERN_HIGH || this == PATTERN_PREFERRED || this == PATTERN_ONLY;
    }

    public boolean usedSemantic() {
        return this == SEMANTIC_PREFERRED || this == SEMANTIC_ONLY || this == SEMANTIC_FALLBACK;
    }

    @Override
    public String toString() {
        return tag();
    }
}
