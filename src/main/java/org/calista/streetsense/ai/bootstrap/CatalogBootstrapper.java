package org.calista.streetsense.ai.bootstrap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.streetsense.ai.core.EngineConfig;
import org.calista.streetsense.ai.vocab.ConceptTable;
import org.calista.streetsense.ai.vocab.EntityLexicon;
import org.calista.streetsense.ai.vocab.IntentCatalog;
import org.calista.streetsense.ai.vocab.IntentDefinition;
import org.calista.streetsense.ai.vocab.Lexicon;
import org.calista.streetsense.ai.vocab.VocabularyStore;
import org.calista.streetsense.io.ResourceIO;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Loads the catalog files into a {@link VocabularyStore}.
 *
 * <p>{@code intents.json} and {@code concepts.json} are required, a missing one is an {@link IOException}.
 * The lexicon, vocabulary and entity files are optional (empty when absent).
 *
 * <p>Entries are checked one by one: intents must validate, have a unique id and compile every trigger.
 * With {@code failFast} the first bad entry aborts loading; otherwise it is logged, counted and skipped.
 */
public final class CatalogBootstrapper {
    private static final Logger log = LogManager.getLogger(CatalogBootstrapper.class);

    private final ResourceIO io;
    private final ObjectMapper mapper;

    public CatalogBootstrapper(ResourceIO io, ObjectMapper mapper) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public Result load(EngineConfig.Catalog cfg) throws IOException {
        Objects.requireNonNull(cfg, "cfg");
        ArrayList<Report> reports = new ArrayList<>(5);

        List<IntentDefinition> intents = loadIntents(ResourceIO.child(cfg.location, cfg.intents), cfg.failFast, reports);
        ConceptTable concepts = loadConcepts(ResourceIO.child(cfg.location, cfg.concepts), reports);
        Lexicon lexicon = loadLexicon(ResourceIO.child(cfg.location, cfg.lexicon), reports);
        List<String> words = loadVocabulary(ResourceIO.child(cfg.location, cfg.vocabulary), reports);
        EntityLexicon entities = loadEntities(ResourceIO.child(cfg.location, cfg.entities), cfg.failFast, reports);

        VocabularyStore store = new VocabularyStore(new IntentCatalog(intents), lexicon, concepts, words, entities);
        log.info("Catalog loaded from {}: intents={}, exemplars={}, clusters={}, vocabulary={}",
                cfg.location, store.intents().size(), store.intents().exemplarCount(),
                store.dimensions(), store.vocabularySize());
        return new Result(store, reports);
    }

    // ---------------------------------------------------------------------
    // Files
    // ---------------------------------------------------------------------

    List<IntentDefinition> loadIntents(String location, boolean failFast, List<Report> reports) throws IOException {
        JsonNode root = mapper.readTree(io.read(location));
        JsonNode arr = root.isArray() ? root : root.path("intents");
        if (!arr.isArray()) throw new IOException("No intents array in " + location);

        ArrayList<IntentDefinition> out = new ArrayList<>(arr.size());
        Set<String> seen = new HashSet<>();
        int ok = 0, bad = 0;

        for (JsonNode node : arr) {
            try {
                IntentDefinition d = mapper.treeToValue(node, IntentDefinition.class);
                d.validate();
                if (!seen.add(d.id)) throw new IllegalArgumentException("duplicate intent id " + d.id);
                for (String t : d.triggers) Pattern.compile(t, Pattern.CASE_INSENSITIVE);
                out.add(d);
                ok++;
            } catch (IOException | IllegalArgumentException e) {
                // PatternSyntaxException is an IllegalArgumentException
                bad++;
                log.warn("Bad intent in {}: {}", location, e.toString());
                if (failFast) throw new IOException("Bad intent in " + location + ": " + e, e);
            }
        }

        reports.add(new Report(location, ok, bad));
        log.info("Intents loaded: {} (ok={}, bad={})", location, ok, bad);
        return out;
    }

    ConceptTable loadConcepts(String location, List<Report> reports) throws IOException {
        ConceptTable table = mapper.readValue(io.read(location), ConceptTable.class);
        if (table == null) table = new ConceptTable();
        table.validate();
        if (table.clusters.isEmpty()) throw new IOException("No concept clusters in " + location);

        reports.add(new Report(location, table.clusters.size(), 0));
        log.info("Concepts loaded: {} (clusters={}, weighted words={})", location, table.clusters.size(), table.importance.size());
        return table;
    }

    Lexicon loadLexicon(String location, List<Report> reports) throws IOException {
        String json = readOptional(location);
        if (json == null) {
            reports.add(new Report(location, 0, 0));
            return new Lexicon();
        }
        Lexicon lex = mapper.readValue(json, Lexicon.class);
        if (lex == null) lex = new Lexicon();
        lex.validate();

        int n = lex.contractions.size() + lex.abbreviations.size() + lex.slang.size() + lex.idioms.size();
        reports.add(new Report(location, n, 0));
        log.info("Lexicon loaded: {} (contractions={}, abbreviations={}, slang={}, idioms={})", location,
                lex.contractions.size(), lex.abbreviations.size(), lex.slang.size(), lex.idioms.size());
        return lex;
    }

    List<String> loadVocabulary(String location, List<Report> reports) throws IOException {
        String json = readOptional(location);
        if (json == null) {
            reports.add(new Report(location, 0, 0));
            return List.of();
        }
        JsonNode root = mapper.readTree(json);
        JsonNode arr = root.isArray() ? root : root.path("words");

        ArrayList<String> out = new ArrayList<>(arr.size());
        int bad = 0;
        for (JsonNode n : arr) {
            if (n.isTextual() && !n.asText().isBlank()) out.add(n.asText());
            else bad++;
        }
        reports.add(new Report(location, out.size(), bad));
        log.info("Vocabulary loaded: {} (ok={}, bad={})", location, out.size(), bad);
        return out;
    }

    EntityLexicon loadEntities(String location, boolean failFast, List<Report> reports) throws IOException {
        String json = readOptional(location);
        if (json == null) {
            reports.add(new Report(location, 0, 0));
            return new EntityLexicon();
        }
        EntityLexicon lex = mapper.readValue(json, EntityLexicon.class);
        if (lex == null) lex = new EntityLexicon();
        lex.validate();

        ArrayList<String> patterns = new ArrayList<>(lex.playerNamePatterns.size());
        int bad = 0;
        for (String p : lex.playerNamePatterns) {
            try {
                Pattern.compile(p);
                patterns.add(p);
            } catch (PatternSyntaxException e) {
                bad++;
                log.warn("Bad name pattern in {}: {}", location, e.getDescription());
                if (failFast) throw new IOException("Bad name pattern in " + location + ": " + p, e);
            }
        }
        lex.playerNamePatterns = patterns;

        int ok = patterns.size() + lex.crimeTypes.size() + lex.jobTypes.size() + lex.districts.size();
        reports.add(new Report(location, ok, bad));
        return lex;
    }

    private String readOptional(String location) throws IOException {
        try {
            return io.read(location);
        } catch (NoSuchFileException e) {
            log.warn("Optional catalog file not found: {}", location);
            return null;
        }
    }

    // ---------------------------------------------------------------------
    // Results
    // ---------------------------------------------------------------------

    public static final class Report {
        public final String name;
        public final int ok;
        public final int bad;

        public Report(String name, int ok, int bad) {
            this.name = name;
            this.ok = ok;
            this.bad = bad;
        }

        @Override
        public String toString() {
            return name + " (ok=" + ok + ", bad=" + bad + ")";
        }
    }

    public static final class Result {
        public final VocabularyStore store;
        public final List<Report> reports;

        public Result(VocabularyStore store, List<Report> reports) {
            this.store = Objects.requireNonNull(store, "store");
            this.reports = List.copyOf(reports);
        }

        public int badEntries() {
            int n = 0;
            for (Report r : reports) n += r.bad;
            return n;
        }
    }
}
