package org.calista.streetsense.ai.hybrid;

import org.calista.streetsense.ai.intent.IntentPrediction;
import org.calista.streetsense.ai.text.NormalizationResult;
import org.calista.streetsense.ai.typo.CorrectionResult;

import java.util.List;
import java.util.Objects;

/**
 * Every pipeline stage for one input, side by side. Debug only.
 */
public final class Analysis {
    public final String input;
    public final NormalizationResult normalization;
    public final CorrectionResult correction;
    public final IntentPrediction pattern;
    public final IntentPrediction semantic;
    public final List<String> concepts;
    public final ClassificationResult result;

    public Analysis(String input, NormalizationResult normalization, CorrectionResult correction,
                    IntentPrediction pattern, IntentPrediction semantic, List<String> concepts,
                    ClassificationResult result) {
        this.input = input == null ? "" : input;
        this.normalization = Objects.requireNonNull(normalization, "normalization");
        this.correction = Objects.requireNonNull(correction, "correction");
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.semantic = Objects.requireNonNull(semantic, "semantic");
        this.concepts = List.copyOf(Objects.requireNonNull(concepts, "concepts"));
        this.result = Objects.requireNonNull(result, "result");
    }
}
