package org.calista.streetsense.ai.intent;

import java.util.Locale;
import java.util.Objects;

/** One ranked candidate intent. */
public final class IntentMatch {
    public final String intent;
    public final String friendlyName;
    public final double score;

    public IntentMatch(String intent, String friendlyName, double score) {
        this.intent = Objects.requireNonNull(intent, "intent");
        this.friendlyName = friendlyName == null ? intent : friendlyName;
        this.score = score;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof IntentMatch m)) return false;
        return Double.compare(score, m.score) == 0 && intent.equals(m.intent) && friendlyName.equals(m.friendlyName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(intent, friendlyName, score);
    }

    @Override
    public String toString() {
        return intent + String.format(Locale.ROOT, "=%.3f", score);
    }
}
