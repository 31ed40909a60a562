package org.calista.streetsense.ai.intent;

/**
 * One source of intent predictions over preprocessed (normalized, corrected) text.
 * Implementations must be total: any string gives a prediction, never null.
 */
public interface IntentClassifier {
    IntentPrediction classify(String text);
}
