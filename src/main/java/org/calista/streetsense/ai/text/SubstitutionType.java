package org.calista.streetsense.ai.text;

import java.util.Locale;

public enum SubstitutionType {
    PHRASE,
    CONTRACTION,
    ABBREVIATION,
    SLANG,
    /** Produced by the typo corrector, not the normalizer. */
    TYPO;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
