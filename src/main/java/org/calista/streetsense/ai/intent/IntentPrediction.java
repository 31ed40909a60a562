package org.calista.streetsense.ai.intent;

import org.calista.streetsense.ai.vocab.IntentDefinition;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Output of one {@link IntentClassifier}.
 *
 * - confidence: [0..1], comparable across classifiers
 * - score: classifier-specific raw value (rule score for patterns, top similarity for semantics)
 * - topMatches: ranked runner-ups, may be empty
 */
public final class IntentPrediction {
    public final String intent;
    public final double confidence;
    public final double score;
    public final List<IntentMatch> topMatches;
    public final ExtractedEntities entities;

    public IntentPrediction(String intent, double confidence, double score,
                            List<IntentMatch> topMatches, ExtractedEntities entities) {
        this.intent = Objects.requireNonNull(intent, "intent");
        this.confidence = confidence;
        this.score = score;
        this.topMatches = topMatches == null ? List.of() : List.copyOf(topMatches);
        this.entities = entities == null ? ExtractedEntities.NONE : entities;
    }

    public static IntentPrediction unknown() {
        return new IntentPrediction(IntentDefinition.UNKNOWN, 0.0, 0.0, List.of(), ExtractedEntities.NONE);
    }

    public static IntentPrediction unknown(ExtractedEntities entities) {
        return new IntentPrediction(IntentDefinition.UNKNOWN, 0.0, 0.0, List.of(), entities);
    }

    public boolean isUnknown() {
        return IntentDefinition.UNKNOWN.equals(intent);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "IntentPrediction{%s conf=%.3f score=%.3f top=%s}",
                intent, confidence, score, topMatches);
    }
}
