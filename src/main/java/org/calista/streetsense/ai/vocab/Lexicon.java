package org.calista.streetsense.ai.vocab;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Rewrite tables for the normalizer. Keys are lower-case surface forms,
 * values are canonical forms. Insertion order is kept.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Lexicon {

    public Map<String, String> contractions = new LinkedHashMap<>();
    public Map<String, String> abbreviations = new LinkedHashMap<>();
    public Map<String, String> slang = new LinkedHashMap<>();

    /** Multi-word phrases, matched on word boundaries before the token pass. */
    public Map<String, String> idioms = new LinkedHashMap<>();

    public void validate() {
        contractions = clean(contractions);
        abbreviations = clean(abbreviations);
        slang = clean(slang);
        idioms = clean(idioms);
    }

    private static Map<String, String> clean(Map<String, String> in) {
        LinkedHashMap<String, String> out = new LinkedHashMap<>();
        if (in == null) return out;
        for (Map.Entry<String, String> e : in.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            String k = e.getKey().trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
            String v = e.getValue().trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
            if (k.isEmpty() || v.isEmpty()) continue;
            out.put(k, v);
        }
        return out;
    }
}
