package org.calista.streetsense.ai.intent.impl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.streetsense.ai.core.EngineConfig;
import org.calista.streetsense.ai.intent.ExtractedEntities;
import org.calista.streetsense.ai.intent.IntentClassifier;
import org.calista.streetsense.ai.intent.IntentMatch;
import org.calista.streetsense.ai.intent.IntentPrediction;
import org.calista.streetsense.ai.tokenizer.Tokenizer;
import org.calista.streetsense.ai.tokenizer.impl.WordTokenizer;
import org.calista.streetsense.ai.util.Scored;
import org.calista.streetsense.ai.vocab.EntityLexicon;
import org.calista.streetsense.ai.vocab.IntentDefinition;
import org.calista.streetsense.ai.vocab.VocabularyStore;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * PatternIntentClassifier: rule scoring over hand-written triggers and weighted keywords.
 *
 * Score per intent:
 * - {@code triggerScore} for every trigger regex found in the text (case-insensitive)
 * - keyword weight for every word token equal to a keyword (each occurrence counts)
 *
 * The strictly highest score wins, so catalog order breaks ties; confidence = min(1, score / scale).
 * Triggers are compiled lazily, a malformed one surfaces as {@link java.util.regex.PatternSyntaxException}
 * from {@link #classify(String)}.
 */
public final class PatternIntentClassifier implements IntentClassifier {
    private static final Logger log = LogManager.getLogger(PatternIntentClassifier.class);

    private static final Pattern NUMBER = Pattern.compile("\\d+");
    private static final int MAX_NUMBER_DIGITS = 9;

    /** Conversational intents that are never offered as clarification candidates. */
    private static final Set<String> NOT_SUGGESTED = Set.of(IntentDefinition.UNKNOWN, "greeting", "thanks", "who_are_you");

    private final VocabularyStore store;
    private final EngineConfig.PatternMatch cfg;
    private final Tokenizer words = new WordTokenizer();

    // compiled rules, rebuilt when the store revision moves
    private List<Rules> rules = List.of();
    private List<Pattern> namePatterns = List.of();
    private long compiledRevision = -1L;

    public PatternIntentClassifier(VocabularyStore store, EngineConfig.PatternMatch cfg) {
        this.store = Objects.requireNonNull(store, "store");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
    }

    // ---------------------------------------------------------------------
    // API
    // ---------------------------------------------------------------------

    @Override
    public IntentPrediction classify(String text) {
        return classifyIntent(text);
    }

    public IntentPrediction classifyIntent(String text) {
        if (text == null || text.isBlank()) return IntentPrediction.unknown();
        String t = text.toLowerCase(Locale.ROOT);
        List<String> tokens = words.tokenize(t);

        IntentDefinition best = null;
        double bestScore = 0.0;
        for (Rules r : compiled()) {
            double s = score(r, t, tokens);
            if (s > bestScore) {
                bestScore = s;
                best = r.definition();
            }
        }

        ExtractedEntities entities = extractEntities(t, tokens);
        if (best == null) return IntentPrediction.unknown(entities);

        double confidence = Math.min(1.0, bestScore / cfg.confidenceScale);
        if (log.isDebugEnabled()) {
            log.debug("pattern: '{}' -> {} score={} conf={}", text, best.id, bestScore, confidence);
        }
        return new IntentPrediction(best.id, confidence, bestScore, List.of(), entities);
    }

    /**
     * Intents with a positive rule score, best first, without the conversational ones.
     * Scores are raw rule scores.
     */
    public List<IntentMatch> getTopMatches(String text, int n) {
        if (text == null || text.isBlank() || n < 1) return List.of();
        String t = text.toLowerCase(Locale.ROOT);
        List<String> tokens = words.tokenize(t);

        ArrayList<Scored<IntentDefinition>> scored = new ArrayList<>();
        for (Rules r : compiled()) {
            if (NOT_SUGGESTED.contains(r.definition().id)) continue;
            double s = score(r, t, tokens);
            if (s > 0.0) scored.add(Scored.of(r.definition(), s));
        }
        scored.sort(Scored.descending());

        int k = Math.min(n, scored.size());
        ArrayList<IntentMatch> out = new ArrayList<>(k);
        for (int i = 0; i < k; i++) {
            IntentDefinition d = scored.get(i).item;
            out.add(new IntentMatch(d.id, d.friendlyName, scored.get(i).score));
        }
        return out;
    }

    /** True when the named intent has any trigger or keyword hit. */
    public boolean matchesIntent(String text, String intentId) {
        if (text == null || text.isBlank() || intentId == null) return false;
        String t = text.toLowerCase(Locale.ROOT);
        List<String> tokens = words.tokenize(t);
        for (Rules r : compiled()) {
            if (r.definition().id.equals(intentId)) return score(r, t, tokens) > 0.0;
        }
        return false;
    }

    public ExtractedEntities extractEntities(String text) {
        if (text == null || text.isBlank()) return ExtractedEntities.NONE;
        String t = text.toLowerCase(Locale.ROOT);
        return extractEntities(t, words.tokenize(t));
    }

    // ---------------------------------------------------------------------
    // Scoring
    // ---------------------------------------------------------------------

    private double score(Rules r, String text, List<String> tokens) {
        double s = 0.0;
        for (Pattern p : r.triggers()) {
            if (p.matcher(text).find()) s += cfg.triggerScore;
        }
        IntentDefinition d = r.definition();
        if (!d.keywords.isEmpty()) {
            for (String w : tokens) s += d.keywordWeight(w);
        }
        return s;
    }

    // ---------------------------------------------------------------------
    // Entities
    // ---------------------------------------------------------------------

    private ExtractedEntities extractEntities(String text, List<String> tokens) {
        EntityLexicon lex = store.entities();
        compiled();

        String player = null;
        Set<String> stop = new HashSet<>(lex.nameStopWords);
        outer:
        for (Pattern p : namePatterns) {
            Matcher m = p.matcher(text);
            while (m.find()) {
                if (m.groupCount() < 1 || m.group(1) == null) continue;
                String name = m.group(1).toLowerCase(Locale.ROOT);
                if (name.length() > 1 && !stop.contains(name)) {
                    player = name;
                    break outer;
                }
            }
        }

        ArrayList<Integer> numbers = new ArrayList<>(2);
        Matcher nm = NUMBER.matcher(text);
        while (nm.find()) {
            String digits = nm.group();
            if (digits.length() <= MAX_NUMBER_DIGITS) numbers.add(Integer.parseInt(digits));
        }

        Set<String> present = new HashSet<>(tokens);
        return new ExtractedEntities(player, numbers,
                firstPresent(lex.crimeTypes, present),
                firstPresent(lex.jobTypes, present),
                firstPresent(lex.districts, present));
    }

    private static String firstPresent(List<String> terms, Set<String> present) {
        for (String term : terms) {
            if (present.contains(term)) return term;
        }
        return null;
    }

    // ---------------------------------------------------------------------
    // Compilation
    // ---------------------------------------------------------------------

    private List<Rules> compiled() {
        long rev = store.revision();
        if (rev == compiledRevision) return rules;

        ArrayList<Rules> out = new ArrayList<>(store.intents().size());
        for (IntentDefinition d : store.intents().all()) {
            ArrayList<Pattern> ps = new ArrayList<>(d.triggers.size());
            for (String t : d.triggers) ps.add(Pattern.compile(t, Pattern.CASE_INSENSITIVE));
            out.add(new Rules(d, List.copyOf(ps)));
        }

        ArrayList<Pattern> names = new ArrayList<>();
        for (String p : store.entities().playerNamePatterns) names.add(Pattern.compile(p, Pattern.CASE_INSENSITIVE));

        rules = List.copyOf(out);
        namePatterns = List.copyOf(names);
        compiledRevision = rev;
        return rules;
    }

    private record Rules(IntentDefinition definition, List<Pattern> triggers) {}
}
