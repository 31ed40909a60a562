package org.calista.streetsense.ai.text;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.streetsense.ai.vocab.VocabularyStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * TextNormalizer: rewrites slang-heavy chat input into canonical words.
 *
 * Pipeline per pass:
 * 1) clean: whitespace, quote glyphs, repeated terminal punctuation, lower case
 * 2) idioms, longest first, on word boundaries
 * 3) per token: contraction, then abbreviation, then slang (first hit wins)
 * 4) whitespace cleanup
 *
 * <p>Canonical forms may contain further table keys, so passes repeat on the output until nothing
 * fires (bounded by {@code maxPasses}). Normalizing normalized text therefore yields no changes.
 *
 * <p>Never throws on input; null/blank gives an empty result.
 */
public final class TextNormalizer {
    private static final Logger log = LogManager.getLogger(TextNormalizer.class);

    private static final Pattern WS = Pattern.compile("\\s+");
    private static final Pattern APOSTROPHES = Pattern.compile("[\\u2018\\u2019`\\u00B4]");
    private static final Pattern QUOTES = Pattern.compile("[\\u201C\\u201D]");
    private static final Pattern REPEATED_TERMINAL = Pattern.compile("([!?.]){2,}");

    private final VocabularyStore store;
    private final int maxPasses;

    // compiled idioms, rebuilt when the store revision moves
    private List<CompiledIdiom> idioms = List.of();
    private long idiomsRevision = -1L;

    public TextNormalizer(VocabularyStore store, int maxPasses) {
        this.store = Objects.requireNonNull(store, "store");
        this.maxPasses = Math.max(1, maxPasses);
    }

    // ---------------------------------------------------------------------
    // API
    // ---------------------------------------------------------------------

    public NormalizationResult normalize(String text) {
        if (text == null || text.isBlank()) return new NormalizationResult(text, "", List.of());

        ArrayList<Substitution> changes = new ArrayList<>(8);
        String out = pass(text, changes);
        if (changes.isEmpty()) return new NormalizationResult(text, out, changes);

        // fixed point: re-run on own output while something still fires
        for (int i = 1; i < maxPasses; i++) {
            int before = changes.size();
            String next = pass(out, changes);
            if (changes.size() == before) break;
            out = next;
        }

        if (log.isDebugEnabled() && !changes.isEmpty()) {
            log.debug("normalize: '{}' -> '{}' {}", text, out, changes);
        }
        return new NormalizationResult(text, out, changes);
    }

    /**
     * True when any token (or idiom) of the text would be rewritten.
     */
    public boolean hasSlang(String text) {
        return normalize(text).wasModified();
    }

    public Stats stats() {
        return new Stats(store.contractions().size(), store.abbreviations().size(),
                store.slang().size(), store.idioms().size());
    }

    public static final class Stats {
        public final int contractions;
        public final int abbreviations;
        public final int slang;
        public final int idioms;

        public Stats(int contractions, int abbreviations, int slang, int idioms) {
            this.contractions = contractions;
            this.abbreviations = abbreviations;
            this.slang = slang;
            this.idioms = idioms;
        }

        @Override
        public String toString() {
            return "contractions=" + contractions + ", abbreviations=" + abbreviations
                    + ", slang=" + slang + ", idioms=" + idioms;
        }
    }

    // ---------------------------------------------------------------------
    // Pass
    // ---------------------------------------------------------------------

    private String pass(String text, List<Substitution> changes) {
        String s = clean(text);
        s = expandIdioms(s, changes);
        s = rewriteTokens(s, changes);
        return WS.matcher(s).replaceAll(" ").trim();
    }

    static String clean(String text) {
        String s = WS.matcher(text).replaceAll(" ").trim();
        s = APOSTROPHES.matcher(s).replaceAll("'");
        s = QUOTES.matcher(s).replaceAll("\"");
        s = REPEATED_TERMINAL.matcher(s).replaceAll("$1");
        return s.toLowerCase(Locale.ROOT);
    }

    private String expandIdioms(String s, List<Substitution> changes) {
        for (CompiledIdiom idiom : compiledIdioms()) {
            if (idiom.phrase.equals(idiom.canonical)) continue;

            Matcher m = idiom.pattern.matcher(s);
            if (!m.find()) continue;

            StringBuilder b = new StringBuilder(s.length() + 16);
            do {
                changes.add(Substitution.of(m.group(), idiom.canonical, SubstitutionType.PHRASE));
                m.appendReplacement(b, Matcher.quoteReplacement(idiom.canonical));
            } while (m.find());
            m.appendTail(b);
            s = b.toString();
        }
        return s;
    }

    private String rewriteTokens(String s, List<Substitution> changes) {
        if (s.isEmpty()) return s;

        String[] tokens = s.split(" ");
        StringBuilder out = new StringBuilder(s.length() + 16);

        for (String tok : tokens) {
            if (tok.isEmpty()) continue;
            if (out.length() > 0) out.append(' ');

            Rewrite r = lookup(tok);
            if (r != null) {
                out.append(r.canonical);
                changes.add(Substitution.of(tok, r.canonical, r.type));
                continue;
            }

            // retry without surrounding punctuation: "rn?" -> "right now?"
            int start = 0;
            int end = tok.length();
            while (start < end && !isWordChar(tok.charAt(start))) start++;
            while (end > start && !isWordChar(tok.charAt(end - 1))) end--;
            if (start < end && (start > 0 || end < tok.length())) {
                String core = tok.substring(start, end);
                r = lookup(core);
                if (r != null) {
                    out.append(tok, 0, start).append(r.canonical).append(tok, end, tok.length());
                    changes.add(Substitution.of(core, r.canonical, r.type));
                    continue;
                }
            }

            out.append(tok);
        }
        return out.toString();
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private Rewrite lookup(String token) {
        Rewrite r = lookupIn(store.contractions(), token, SubstitutionType.CONTRACTION);
        if (r == null) r = lookupIn(store.abbreviations(), token, SubstitutionType.ABBREVIATION);
        if (r == null) r = lookupIn(store.slang(), token, SubstitutionType.SLANG);
        return r;
    }

    private static Rewrite lookupIn(Map<String, String> table, String token, SubstitutionType type) {
        String v = table.get(token);
        if (v == null || v.equals(token)) return null;
        return new Rewrite(v, type);
    }

    private List<CompiledIdiom> compiledIdioms() {
        long rev = store.revision();
        if (rev == idiomsRevision) return idioms;

        ArrayList<CompiledIdiom> list = new ArrayList<>(store.idioms().size());
        for (Map.Entry<String, String> e : store.idioms().entrySet()) {
            Pattern p = Pattern.compile("\\b" + Pattern.quote(e.getKey()) + "\\b");
            list.add(new CompiledIdiom(e.getKey(), e.getValue(), p));
        }
        // longest first; List.sort is stable, so equal lengths keep insertion order
        list.sort(Comparator.comparingInt((CompiledIdiom c) -> c.phrase.length()).reversed());

        idioms = List.copyOf(list);
        idiomsRevision = rev;
        return idioms;
    }

    private record Rewrite(String canonical, SubstitutionType type) {}

    private record CompiledIdiom(String phrase, String canonical, Pattern pattern) {}
}
