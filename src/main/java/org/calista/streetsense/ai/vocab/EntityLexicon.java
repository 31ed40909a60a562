package org.calista.streetsense.ai.vocab;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/**
 * Domain terms and name patterns used for shallow entity extraction.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EntityLexicon {

    /** Regexes whose first group captures a player name. */
    public List<String> playerNamePatterns = new ArrayList<>();

    /** Captures that are common words rather than names. */
    public List<String> nameStopWords = new ArrayList<>();

    public List<String> crimeTypes = new ArrayList<>();
    public List<String> jobTypes = new ArrayList<>();
    public List<String> districts = new ArrayList<>();

    public void validate() {
        playerNamePatterns = nonBlank(playerNamePatterns, false);
        nameStopWords = nonBlank(nameStopWords, true);
        crimeTypes = nonBlank(crimeTypes, true);
        jobTypes = nonBlank(jobTypes, true);
        districts = nonBlank(districts, true);
    }

    private static List<String> nonBlank(List<String> in, boolean lower) {
        if (in == null) return new ArrayList<>();
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String s : in) {
            if (s == null || s.isBlank()) continue;
            out.add(lower ? s.trim().toLowerCase(Locale.ROOT) : s);
        }
        return new ArrayList<>(out);
    }
}
