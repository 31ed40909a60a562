package org.calista.streetsense.ai.vocab;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Closed, ordered set of intents. Catalog order is the tie-break order everywhere.
 * The reserved {@code unknown} intent is always present.
 */
public final class IntentCatalog {

    private final LinkedHashMap<String, IntentDefinition> byId = new LinkedHashMap<>();

    public IntentCatalog(List<IntentDefinition> intents) {
        Objects.requireNonNull(intents, "intents");
        for (IntentDefinition d : intents) {
            Objects.requireNonNull(d, "intent");
            d.validate();
            if (byId.putIfAbsent(d.id, d) != null) {
                throw new IllegalArgumentException("Duplicate intent id: " + d.id);
            }
        }
        byId.putIfAbsent(IntentDefinition.UNKNOWN, IntentDefinition.unknown());
    }

    /**
     * Definitions in catalog order. Treat them as read-only: exemplars are added through
     * {@link VocabularyStore#addExemplar(String, String)} so that derived vectors follow the revision.
     */
    public List<IntentDefinition> all() {
        return Collections.unmodifiableList(new ArrayList<>(byId.values()));
    }

    public List<String> ids() {
        return List.copyOf(byId.keySet());
    }

    public Optional<IntentDefinition> find(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(byId.get(id));
    }

    public boolean contains(String id) {
        return id != null && byId.containsKey(id);
    }

    public String friendlyName(String id) {
        IntentDefinition d = (id == null) ? null : byId.get(id);
        return d == null ? String.valueOf(id) : d.friendlyName;
    }

    public String hint(String id) {
        IntentDefinition d = (id == null) ? null : byId.get(id);
        return d == null ? "" : d.hint;
    }

    public int size() {
        return byId.size();
    }

    public int exemplarCount() {
        int n = 0;
        for (IntentDefinition d : byId.values()) n += d.exemplars.size();
        return n;
    }
}
