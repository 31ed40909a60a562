package org.calista.streetsense.ai.vocab;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Word clusters (one vector dimension per cluster, in declaration order) and word importance.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ConceptTable {

    public Map<String, List<String>> clusters = new LinkedHashMap<>();

    /** word -> positive weight; absent words weigh 1.0. */
    public Map<String, Double> importance = new LinkedHashMap<>();

    public void validate() {
        LinkedHashMap<String, List<String>> c = new LinkedHashMap<>();
        if (clusters != null) {
            for (Map.Entry<String, List<String>> e : clusters.entrySet()) {
                if (e.getKey() == null || e.getKey().isBlank()) continue;
                LinkedHashSet<String> words = new LinkedHashSet<>();
                if (e.getValue() != null) {
                    for (String w : e.getValue()) {
                        if (w == null || w.isBlank()) continue;
                        words.add(w.trim().toLowerCase(Locale.ROOT));
                    }
                }
                c.put(e.getKey().trim().toLowerCase(Locale.ROOT), new ArrayList<>(words));
            }
        }
        clusters = c;

        LinkedHashMap<String, Double> imp = new LinkedHashMap<>();
        if (importance != null) {
            for (Map.Entry<String, Double> e : importance.entrySet()) {
                if (e.getKey() == null || e.getValue() == null) continue;
                double w = e.getValue();
                if (!Double.isFinite(w) || w <= 0.0) continue;
                imp.put(e.getKey().trim().toLowerCase(Locale.ROOT), w);
            }
        }
        importance = imp;
    }
}
