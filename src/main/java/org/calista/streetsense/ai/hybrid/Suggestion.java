package org.calista.streetsense.ai.hybrid;

import java.util.Objects;

/** A clarification candidate: a likely intent with the hint text shown to the player. */
public final class Suggestion {
    public final String intent;
    public final String friendlyName;
    public final double confidence;
    public final String hint;

    public Suggestion(String intent, String friendlyName, double confidence, String hint) {
        this.intent = Objects.requireNonNull(intent, "intent");
        this.friendlyName = friendlyName == null ? intent : friendlyName;
        this.confidence = confidence;
        this.hint = hint == null ? "" : hint;
    }

    @Override
    public String toString() {
        return friendlyName + ": " + hint;
    }
}
