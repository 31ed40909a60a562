package org.calista.streetsense.ai.hybrid;

import org.calista.streetsense.ai.core.EngineConfig;
import org.calista.streetsense.ai.intent.IntentPrediction;
import org.calista.streetsense.ai.vocab.IntentDefinition;

import java.util.Locale;
import java.util.Objects;

/**
 * Merge policy for a pattern prediction and a semantic prediction. Pure: no state, no I/O.
 *
 * <ul>
 *   <li>both above threshold, same intent: boosted {@code min(1, (p + s) / divisor)}</li>
 *   <li>both above threshold, different intents: the more confident one, penalized (pattern wins ties)</li>
 *   <li>only one above threshold: that one as is</li>
 *   <li>neither: semantic fallback when its raw similarity clears the floor, otherwise unknown</li>
 * </ul>
 */
public final class ConfidenceCombiner {

    private final EngineConfig.Hybrid cfg;

    public ConfidenceCombiner(EngineConfig.Hybrid cfg) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
    }

    /** Pattern confidence high enough to skip semantic work. */
    public boolean isDecisive(IntentPrediction pattern) {
        return pattern != null && pattern.confidence >= cfg.highConfidence;
    }

    public Decision decisive(IntentPrediction pattern) {
        return new Decision(pattern.intent, pattern.confidence, ClassificationSource.PATTERN_HIGH);
    }

    /**
     * @param pattern  pattern prediction (confidence in [0..1])
     * @param semantic semantic prediction; {@code score} is the raw top similarity
     */
    public Decision combine(IntentPrediction pattern, IntentPrediction semantic) {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(semantic, "semantic");

        boolean patternOk = pattern.confidence >= cfg.patternThreshold;
        boolean semanticOk = semantic.confidence >= cfg.semanticThreshold;

        if (patternOk && semanticOk) {
            if (pattern.intent.equals(semantic.intent)) {
                double c = Math.min(1.0, (pattern.confidence + semantic.confidence) / cfg.agreementDivisor);
                return new Decision(pattern.intent, c, ClassificationSource.COMBINED_AGREEMENT);
            }
            if (pattern.confidence >= semantic.confidence) {
                return new Decision(pattern.intent, pattern.confidence * cfg.disagreementPenalty,
                        ClassificationSource.PATTERN_PREFERRED);
            }
            return new Decision(semantic.intent, semantic.confidence * cfg.disagreementPenalty,
                    ClassificationSource.SEMANTIC_PREFERRED);
        }

        if (patternOk) return new Decision(pattern.intent, pattern.confidence, ClassificationSource.PATTERN_ONLY);
        if (semanticOk) return new Decision(semantic.intent, semantic.confidence, ClassificationSource.SEMANTIC_ONLY);

        // последний шанс: слабое, но ненулевое семантическое сходство
        if (semantic.score > cfg.fallbackSimilarity) {
            return new Decision(semantic.intent, semantic.confidence, ClassificationSource.SEMANTIC_FALLBACK);
        }
        return Decision.noMatch();
    }

    public static final class Decision {
        public final String intent;
        public final double confidence;
        public final ClassificationSource source;

        public Decision(String intent, double confidence, ClassificationSource source) {
            this.intent = Objects.requireNonNull(intent, "intent");
            this.confidence = confidence;
            this.source = Objects.requireNonNull(source, "source");
        }

        static Decision noMatch() {
            return new Decision(IntentDefinition.UNKNOWN, 0.0, ClassificationSource.NO_MATCH);
        }

        @Override
        public String toString() {
            return String.format(Locale.ROOT, "%s conf=%.3f via %s", intent, confidence, source.tag());
        }
    }
}
