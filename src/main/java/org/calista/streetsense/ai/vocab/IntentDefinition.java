package org.calista.streetsense.ai.vocab;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * IntentDefinition: one entry of the closed intent catalog.
 *
 * Goals:
 * - public fields for Jackson (minimal boilerplate); read-only once inside a catalog
 * - deterministic validation/normalization
 * - exemplars feed the semantic engine, keywords/triggers feed the pattern matcher
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class IntentDefinition {

    public static final String UNKNOWN = "unknown";

    /** Stable key, e.g. {@code money_advice}. */
    public String id;

    /** Display name, e.g. "Money Tips". */
    public String friendlyName;

    /** One-line clarification text offered when this intent is a runner-up. */
    public String hint = "";

    /** Example phrasings, in authoring order. */
    public List<String> exemplars = new ArrayList<>();

    /** word -> weight added per literal occurrence. */
    public Map<String, Double> keywords = new LinkedHashMap<>();

    /** Regex rules (case-insensitive find), each worth a fixed trigger score. */
    public List<String> triggers = new ArrayList<>();

    public IntentDefinition() {
    }

    public IntentDefinition(String id, String friendlyName) {
        this.id = id;
        this.friendlyName = friendlyName;
    }

    public static IntentDefinition unknown() {
        IntentDefinition d = new IntentDefinition(UNKNOWN, "Unknown");
        d.validate();
        return d;
    }

    // ---------------------------------------------------------------------
    // Validation / normalization
    // ---------------------------------------------------------------------

    public void validate() {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("IntentDefinition.id is required");
        id = id.trim().toLowerCase(Locale.ROOT);

        if (friendlyName == null || friendlyName.isBlank()) friendlyName = id;
        friendlyName = friendlyName.trim();

        if (hint == null) hint = "";
        hint = hint.trim();

        LinkedHashSet<String> ex = new LinkedHashSet<>();
        if (exemplars != null) {
            for (String e : exemplars) {
                if (e == null) continue;
                String x = e.trim();
                if (!x.isEmpty()) ex.add(x);
            }
        }
        exemplars = new ArrayList<>(ex);

        LinkedHashMap<String, Double> kw = new LinkedHashMap<>();
        if (keywords != null) {
            for (Map.Entry<String, Double> e : keywords.entrySet()) {
                if (e.getKey() == null || e.getValue() == null) continue;
                String k = e.getKey().trim().toLowerCase(Locale.ROOT);
                double w = e.getValue();
                if (k.isEmpty() || !Double.isFinite(w) || w <= 0.0) continue;
                kw.put(k, w);
            }
        }
        keywords = kw;

        ArrayList<String> tr = new ArrayList<>();
        if (triggers != null) {
            for (String t : triggers) {
                if (t != null && !t.isBlank()) tr.add(t);
            }
        }
        triggers = tr;
    }

    public boolean isUnknown() {
        return UNKNOWN.equals(id);
    }

    public double keywordWeight(String word) {
        Double w = keywords.get(word);
        return w == null ? 0.0 : w;
    }

    @Override
    public String toString() {
        return "IntentDefinition{id=" + id + ", exemplars=" + exemplars.size()
                + ", keywords=" + keywords.size() + ", triggers=" + triggers.size() + '}';
    }
}
