package org.calista.streetsense.ai.hybrid;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Counters of the hybrid classifier.
 *
 * - requests: every non-empty classify call
 * - computed: calls that ran the pipeline (requests minus cache hits)
 * - per-source counts for computed calls
 */
public final class ClassifierStats {

    private long requests;
    private long cacheHits;
    private long emptyInputs;
    private final EnumMap<ClassificationSource, Long> bySource = new EnumMap<>(ClassificationSource.class);

    void recordEmpty() {
        emptyInputs++;
    }

    void recordCacheHit() {
        requests++;
        cacheHits++;
    }

    void recordComputed(ClassificationSource source) {
        requests++;
        bySource.merge(source, 1L, Long::sum);
    }

    void reset() {
        requests = 0;
        cacheHits = 0;
        emptyInputs = 0;
        bySource.clear();
    }

    /** Immutable copy. */
    public Snapshot snapshot(int cacheSize) {
        return new Snapshot(requests, cacheHits, emptyInputs, new EnumMap<>(bySource), cacheSize);
    }

    public static final class Snapshot {
        public final long requests;
        public final long cacheHits;
        public final long emptyInputs;
        public final Map<ClassificationSource, Long> bySource;
        public final int cacheSize;

        Snapshot(long requests, long cacheHits, long emptyInputs, EnumMap<ClassificationSource, Long> bySource, int cacheSize) {
            this.requests = requests;
            this.cacheHits = cacheHits;
            this.emptyInputs = emptyInputs;
            this.bySource = Map.copyOf(bySource);
            this.cacheSize = cacheSize;
        }

        public long computed() {
            return requests - cacheHits;
        }

        public long count(ClassificationSource source) {
            return bySource.getOrDefault(source, 0L);
        }

        public double cacheHitRate() {
            return rate(cacheHits, requests);
        }

        public double patternRate() {
            long n = 0;
            for (ClassificationSource s : ClassificationSource.values()) if (s.usedPattern()) n += count(s);
            return rate(n, computed());
        }

        public double semanticRate() {
            long n = 0;
            for (ClassificationSource s : ClassificationSource.values()) if (s.usedSemantic()) n += count(s);
            return rate(n, computed());
        }

        public double combinedRate() {
            return rate(count(ClassificationSource.COMBINED_AGREEMENT), computed());
        }

        public double noMatchRate() {
            return rate(count(ClassificationSource.NO_MATCH), computed());
        }

        private static double rate(long n, long total) {
            return total <= 0 ? 0.0 : (double) n / (double) total;
        }

        @Override
        public String toString() {
            return String.format(Locale.ROOT,
                    "requests=%d computed=%d cacheHits=%d (%.1f%%) pattern=%.1f%% semantic=%.1f%% combined=%.1f%% noMatch=%.1f%% cacheSize=%d",
                    requests, computed(), cacheHits, cacheHitRate() * 100.0, patternRate() * 100.0,
                    semanticRate() * 100.0, combinedRate() * 100.0, noMatchRate() * 100.0, cacheSize);
        }
    }
}
