package org.calista.streetsense.ai;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.streetsense.ai.core.ClassifierEngine;
import org.calista.streetsense.ai.hybrid.Analysis;
import org.calista.streetsense.ai.hybrid.ClassificationResult;
import org.calista.streetsense.ai.hybrid.ClassifierStats;
import org.calista.streetsense.ai.hybrid.Suggestion;
import org.calista.streetsense.ai.intent.IntentMatch;
import org.calista.streetsense.ai.util.ReportBox;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * StreetSenseConsole: interactive diagnostic runner.
 *
 * Commands:
 *   text              -> classification summary
 *   :analyze text     -> every stage in a box
 *   :concepts text    -> concept clusters hit
 *   :top text         -> semantic ranking with hints
 *   :stats / :clear   -> counters / drop caches
 *   exit
 */
public final class StreetSenseConsole {

    private static final Logger log = LogManager.getLogger(StreetSenseConsole.class);

    private static final int TOP_N = 3;

    private final ClassifierEngine engine;
    private final BufferedReader in;
    private final PrintWriter out;

    public StreetSenseConsole(ClassifierEngine engine, Reader in, Writer out) {
        this.engine = Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(in, "in");
        Objects.requireNonNull(out, "out");
        this.in = (in instanceof BufferedReader br) ? br : new BufferedReader(in);
        this.out = (out instanceof PrintWriter pw) ? pw : new PrintWriter(out, true);
    }

    public static void main(String[] args) throws IOException {
        ClassifierEngine engine = ClassifierEngine.builder().build();
        new StreetSenseConsole(engine,
                new InputStreamReader(System.in, StandardCharsets.UTF_8),
                new OutputStreamWriter(System.out, StandardCharsets.UTF_8)).run();
    }

    public void run() throws IOException {
        log.info("Console started. vocabulary={}", engine.vocabulary().vocabularySize());
        out.println("Type text to classify, ':analyze', ':concepts', ':top', ':stats', ':clear' or 'exit'.");
        out.flush();

        while (true) {
            out.print("> ");
            out.flush();
            String line = in.readLine();
            if (line == null) break;
            if (!handle(line.trim())) break;
            out.flush();
        }
        out.println("Bye.");
        out.flush();
    }

    /**
     * @return false when the session should end
     */
    boolean handle(String line) {
        if (line.isEmpty()) return true;
        if (line.equalsIgnoreCase("exit")) return false;

        if (line.startsWith(":")) {
            int sp = line.indexOf(' ');
            String cmd = (sp < 0 ? line : line.substring(0, sp)).toLowerCase(Locale.ROOT);
            String arg = sp < 0 ? "" : line.substring(sp + 1).trim();
            command(cmd, arg);
            return true;
        }

        ClassificationResult r = engine.classify(line);
        out.println(String.format(Locale.ROOT, "%s (%s) confidence=%.3f source=%s%s",
                r.intent, r.friendlyName, r.confidence, r.source.tag(), r.fromCache ? " [cached]" : ""));
        return true;
    }

    private void command(String cmd, String arg) {
        switch (cmd) {
            case ":analyze" -> out.println(renderAnalysis(engine.analyze(arg)));
            case ":concepts" -> {
                List<String> concepts = engine.getConcepts(arg);
                out.println(concepts.isEmpty() ? "(no concepts)" : String.join(", ", concepts));
            }
            case ":top" -> {
                List<Suggestion> suggestions = engine.getSuggestions(arg);
                if (suggestions.isEmpty()) out.println("(no matches)");
                for (Suggestion s : suggestions) {
                    out.println(String.format(Locale.ROOT, "%-22s %.3f  %s", s.intent, s.confidence, s.hint));
                }
            }
            case ":stats" -> out.println(renderStats(engine.stats()));
            case ":clear" -> {
                engine.clearCache();
                out.println("Caches cleared.");
            }
            default -> out.println("Unknown command: " + cmd);
        }
    }

    static String renderAnalysis(Analysis a) {
        return ReportBox.render("analyze: " + a.input, b -> {
            b.kv("normalized", a.normalization.normalized);
            b.kv("changes", a.normalization.changes);
            b.kv("corrected", a.correction.corrected);
            b.kv("typos", a.correction.corrections);
            b.sep();
            b.kv("pattern", a.pattern.intent);
            b.score("pattern.conf", a.pattern.confidence);
            b.kv("entities", a.pattern.entities);
            b.sep();
            b.kv("semantic", a.semantic.intent);
            b.score("semantic.conf", a.semantic.confidence);
            b.score("similarity", a.semantic.score);
            for (IntentMatch m : a.semantic.topMatches) b.score("  " + m.intent, m.score);
            b.kv("concepts", a.concepts);
            b.sep();
            b.kv("final", a.result.intent + " (" + a.result.friendlyName + ")");
            b.score("confidence", a.result.confidence);
            b.kv("source", a.result.source.tag());
        });
    }

    static String renderStats(ClassifierStats.Snapshot s) {
        return ReportBox.render("stats", b -> {
            b.kv("requests", s.requests);
            b.kv("computed", s.computed());
            b.kv("cacheHits", s.cacheHits);
            b.kv("cacheSize", s.cacheSize);
            b.sep();
            b.score("cacheHitRate", s.cacheHitRate());
            b.score("patternRate", s.patternRate());
            b.score("semanticRate", s.semanticRate());
            b.score("combinedRate", s.combinedRate());
            b.score("noMatchRate", s.noMatchRate());
        });
    }
}
