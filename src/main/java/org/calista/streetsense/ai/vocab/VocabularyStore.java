package org.calista.streetsense.ai.vocab;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.streetsense.ai.tokenizer.Tokenizer;
import org.calista.streetsense.ai.tokenizer.impl.WordTokenizer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * VocabularyStore: owned, mutable home of every table the pipeline reads.
 *
 * <p>Holds the intent catalog, the rewrite lexicon, the concept clusters with importance weights,
 * the entity lexicon and the typo vocabulary. Loaded once, then changed only through the narrow
 * mutation API below. Every mutation bumps {@link #revision()}; consumers that derive state
 * (caches, centroids, compiled idioms) compare revisions and rebuild lazily.
 *
 * <p>The typo vocabulary is the ordered union of the explicit word list, cluster words, intent
 * keywords, words produced by lexicon canonical forms and exemplar words. Its iteration order is
 * the tie-break order of typo correction.
 *
 * Not thread-safe: single owner, external synchronization if shared.
 */
public final class VocabularyStore {
    private static final Logger log = LogManager.getLogger(VocabularyStore.class);

    private static final double DEFAULT_IMPORTANCE = 1.0;
    private static final int[] NO_CLUSTERS = new int[0];

    private final Tokenizer words = new WordTokenizer();

    private final IntentCatalog intents;
    private final LinkedHashMap<String, String> contractions;
    private final LinkedHashMap<String, String> abbreviations;
    private final LinkedHashMap<String, String> slang;
    private final LinkedHashMap<String, String> idioms;

    /** Fixed for the store lifetime: one dimension per cluster. */
    private final List<String> clusterNames;
    private final LinkedHashMap<String, LinkedHashSet<String>> clusterMembers;
    private final HashMap<String, int[]> wordClusters = new HashMap<>();
    private final HashMap<String, Double> importance;

    private final EntityLexicon entities;

    private final LinkedHashSet<String> vocabulary = new LinkedHashSet<>();

    private long revision = 0L;

    public VocabularyStore(IntentCatalog intents,
                           Lexicon lexicon,
                           ConceptTable concepts,
                           List<String> vocabularyWords,
                           EntityLexicon entities) {
        this.intents = Objects.requireNonNull(intents, "intents");
        Objects.requireNonNull(lexicon, "lexicon");
        Objects.requireNonNull(concepts, "concepts");
        Objects.requireNonNull(vocabularyWords, "vocabularyWords");

        lexicon.validate();
        concepts.validate();

        this.contractions = new LinkedHashMap<>(lexicon.contractions);
        this.abbreviations = new LinkedHashMap<>(lexicon.abbreviations);
        this.slang = new LinkedHashMap<>(lexicon.slang);
        this.idioms = new LinkedHashMap<>(lexicon.idioms);

        this.clusterMembers = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : concepts.clusters.entrySet()) {
            clusterMembers.put(e.getKey(), new LinkedHashSet<>(e.getValue()));
        }
        this.clusterNames = List.copyOf(clusterMembers.keySet());
        this.importance = new HashMap<>(concepts.importance);
        rebuildWordClusters();

        EntityLexicon el = (entities == null) ? new EntityLexicon() : entities;
        el.validate();
        this.entities = el;

        // vocabulary order: explicit list, clusters, keywords, lexicon outputs, exemplars
        for (String w : vocabularyWords) addVocabularyText(w);
        for (LinkedHashSet<String> ws : clusterMembers.values()) for (String w : ws) addVocabularyText(w);
        for (IntentDefinition d : intents.all()) for (String k : d.keywords.keySet()) addVocabularyText(k);
        for (String v : contractions.values()) addVocabularyText(v);
        for (String v : abbreviations.values()) addVocabularyText(v);
        for (String v : slang.values()) addVocabularyText(v);
        for (String v : idioms.values()) addVocabularyText(v);
        for (IntentDefinition d : intents.all()) for (String e : d.exemplars) addVocabularyText(e);

        if (log.isDebugEnabled()) {
            log.debug("VocabularyStore: intents={}, clusters={}, vocabulary={}, idioms={}",
                    intents.size(), clusterNames.size(), vocabulary.size(), idioms.size());
        }
    }

    // ---------------------------------------------------------------------
    // Read API
    // ---------------------------------------------------------------------

    public long revision() {
        return revision;
    }

    public IntentCatalog intents() {
        return intents;
    }

    public Map<String, String> contractions() {
        return Collections.unmodifiableMap(contractions);
    }

    public Map<String, String> abbreviations() {
        return Collections.unmodifiableMap(abbreviations);
    }

    public Map<String, String> slang() {
        return Collections.unmodifiableMap(slang);
    }

    public Map<String, String> idioms() {
        return Collections.unmodifiableMap(idioms);
    }

    public List<String> clusterNames() {
        return clusterNames;
    }

    public int dimensions() {
        return clusterNames.size();
    }

    public Collection<String> clusterMembers(String cluster) {
        LinkedHashSet<String> ws = clusterMembers.get(cluster);
        return ws == null ? List.of() : Collections.unmodifiableCollection(ws);
    }

    /** Dimension indexes the word contributes to (empty when unclustered). The array is a copy. */
    public int[] clustersOf(String word) {
        if (word == null) return NO_CLUSTERS;
        int[] dims = wordClusters.get(word);
        return dims == null ? NO_CLUSTERS : dims.clone();
    }

    public double importance(String word) {
        if (word == null) return DEFAULT_IMPORTANCE;
        Double w = importance.get(word);
        return w == null ? DEFAULT_IMPORTANCE : w;
    }

    public EntityLexicon entities() {
        return entities;
    }

    /** Typo vocabulary in iteration (tie-break) order. */
    public Collection<String> vocabulary() {
        return Collections.unmodifiableCollection(vocabulary);
    }

    public boolean isKnownWord(String word) {
        return word != null && vocabulary.contains(word.toLowerCase(Locale.ROOT));
    }

    public int vocabularySize() {
        return vocabulary.size();
    }

    // ---------------------------------------------------------------------
    // Mutation API (in-memory, immediate effect)
    // ---------------------------------------------------------------------

    /** @return true when the word was new */
    public boolean addWord(String word) {
        if (word == null || word.isBlank()) return false;
        boolean added = vocabulary.add(word.trim().toLowerCase(Locale.ROOT));
        if (added) touch("addWord", word);
        return added;
    }

    public int addWords(Collection<String> ws) {
        if (ws == null) return 0;
        int n = 0;
        for (String w : ws) if (addWord(w)) n++;
        return n;
    }

    public void addContraction(String term, String canonical) {
        putRewrite(contractions, "addContraction", term, canonical);
    }

    public void addAbbreviation(String term, String canonical) {
        putRewrite(abbreviations, "addAbbreviation", term, canonical);
    }

    public void addSlang(String term, String canonical) {
        putRewrite(slang, "addSlang", term, canonical);
    }

    public void addIdiom(String phrase, String canonical) {
        putRewrite(idioms, "addIdiom", phrase, canonical);
    }

    /**
     * Adds a word to an existing cluster. The dimension set is fixed, so an unknown cluster is refused.
     */
    public boolean addWordToCluster(String word, String cluster) {
        if (word == null || word.isBlank() || cluster == null) return false;
        LinkedHashSet<String> members = clusterMembers.get(cluster.trim().toLowerCase(Locale.ROOT));
        if (members == null) {
            log.debug("addWordToCluster: unknown cluster {}", cluster);
            return false;
        }
        String w = word.trim().toLowerCase(Locale.ROOT);
        if (!members.add(w)) return false;
        rebuildWordClusters();
        vocabulary.add(w);
        touch("addWordToCluster", w + "->" + cluster);
        return true;
    }

    public void setWordImportance(String word, double weight) {
        if (word == null || word.isBlank()) throw new IllegalArgumentException("word is required");
        if (!Double.isFinite(weight) || weight <= 0.0) {
            throw new IllegalArgumentException("importance must be positive and finite: " + weight);
        }
        importance.put(word.trim().toLowerCase(Locale.ROOT), weight);
        touch("setWordImportance", word + "=" + weight);
    }

    /** @return false for an unknown intent or a duplicate exemplar */
    public boolean addExemplar(String intentId, String phrase) {
        if (phrase == null || phrase.isBlank()) return false;
        IntentDefinition d = intents.find(intentId).orElse(null);
        if (d == null || d.isUnknown()) return false;
        String p = phrase.trim();
        if (d.exemplars.contains(p)) return false;
        d.exemplars.add(p);
        addVocabularyText(p);
        touch("addExemplar", intentId + ": " + p);
        return true;
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private void putRewrite(Map<String, String> table, String op, String term, String canonical) {
        if (term == null || term.isBlank()) throw new IllegalArgumentException(op + ": term is required");
        if (canonical == null || canonical.isBlank()) throw new IllegalArgumentException(op + ": canonical is required");
        String k = term.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        String v = canonical.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        table.put(k, v);
        addVocabularyText(v);
        touch(op, k + "->" + v);
    }

    private void addVocabularyText(String text) {
        for (String w : words.tokenize(text)) vocabulary.add(w);
    }

    private void rebuildWordClusters() {
        HashMap<String, List<Integer>> tmp = new HashMap<>();
        int dim = 0;
        for (LinkedHashSet<String> ws : clusterMembers.values()) {
            for (String w : ws) tmp.computeIfAbsent(w, k -> new ArrayList<>(2)).add(dim);
            dim++;
        }
        wordClusters.clear();
        for (Map.Entry<String, List<Integer>> e : tmp.entrySet()) {
            List<Integer> l = e.getValue();
            int[] a = new int[l.size()];
            for (int i = 0; i < a.length; i++) a[i] = l.get(i);
            wordClusters.put(e.getKey(), a);
        }
    }

    private void touch(String op, String detail) {
        revision++;
        if (log.isDebugEnabled()) log.debug("{}: {} (revision={})", op, detail, revision);
    }
}
