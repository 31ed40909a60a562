package org.calista.streetsense.ai.hybrid;

import org.calista.streetsense.ai.intent.ExtractedEntities;
import org.calista.streetsense.ai.intent.IntentMatch;
import org.calista.streetsense.ai.vocab.IntentDefinition;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Final answer of the hybrid classifier. Always populated: "no match" is an {@code unknown} result,
 * never an exception.
 *
 * <p>A result served from the cache carries only the summary (intent, confidence, friendly name,
 * source): {@code preprocessed} is null and {@code topMatches} is empty.
 */
public final class ClassificationResult {
    public final String intent;
    public final double confidence;
    public final String friendlyName;
    public final ClassificationSource source;
    public final PreprocessTrace preprocessed;
    public final List<IntentMatch> topMatches;
    public final ExtractedEntities entities;
    public final boolean fromCache;

    public ClassificationResult(String intent, double confidence, String friendlyName, ClassificationSource source,
                                PreprocessTrace preprocessed, List<IntentMatch> topMatches,
                                ExtractedEntities entities, boolean fromCache) {
        this.intent = Objects.requireNonNull(intent, "intent");
        this.confidence = confidence;
        this.friendlyName = friendlyName == null ? intent : friendlyName;
        this.source = Objects.requireNonNull(source, "source");
        this.preprocessed = preprocessed;
        this.topMatches = topMatches == null ? List.of() : List.copyOf(topMatches);
        this.entities = entities == null ? ExtractedEntities.NONE : entities;
        this.fromCache = fromCache;
    }

    public static ClassificationResult empty(String raw) {
        return new ClassificationResult(IntentDefinition.UNKNOWN, 0.0, "Unknown", ClassificationSource.EMPTY_INPUT,
                new PreprocessTrace(raw == null ? "" : raw, "", List.of()), List.of(), ExtractedEntities.NONE, false);
    }

    public boolean isUnknown() {
        return IntentDefinition.UNKNOWN.equals(intent);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "ClassificationResult{%s (%s) conf=%.3f source=%s%s}",
                intent, friendlyName, confidence, source.tag(), fromCache ? " cached" : "");
    }
}
