package org.calista.streetsense.ai.typo;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * String distances used by the typo corrector.
 *
 * <ul>
 *   <li>{@link #damerauLevenshtein(String, String)}: optimal string alignment, every edit costs 1.
 *   This is the strict distance behind correction.</li>
 *   <li>{@link #weighted(String, String)}: the same recurrence with discounted substitutions for
 *   QWERTY-adjacent keys and phonetically close letters, and a cheaper transposition. Only used to rank
 *   suggestions.</li>
 * </ul>
 */
public final class EditDistance {

    private static final Map<Character, String> ADJACENT_KEYS = new HashMap<>();
    private static final String[] PHONETIC_GROUPS = {
            "ck", "gj", "scz", "iy", "ae", "ou", "nm", "bp", "dt", "vw"
    };

    static {
        String[][] rows = {
                {"q", "wa"}, {"w", "qesa"}, {"e", "wrds"}, {"r", "etfd"}, {"t", "rygf"},
                {"y", "tuhg"}, {"u", "yijh"}, {"i", "uokj"}, {"o", "iplk"}, {"p", "ol"},
                {"a", "qwsz"}, {"s", "weadzx"}, {"d", "ersfxc"}, {"f", "rtdgcv"}, {"g", "tyfhvb"},
                {"h", "yugjbn"}, {"j", "uihknm"}, {"k", "iojlm"}, {"l", "opk"},
                {"z", "asx"}, {"x", "zsdc"}, {"c", "xdfv"}, {"v", "cfgb"}, {"b", "vghn"},
                {"n", "bhjm"}, {"m", "njk"}
        };
        for (String[] r : rows) ADJACENT_KEYS.put(r[0].charAt(0), r[1]);
    }

    private final double adjacentKeyCost;
    private final double phoneticCost;
    private final double transpositionCost;

    public EditDistance() {
        this(0.5, 0.7, 0.5);
    }

    public EditDistance(double adjacentKeyCost, double phoneticCost, double transpositionCost) {
        this.adjacentKeyCost = adjacentKeyCost;
        this.phoneticCost = phoneticCost;
        this.transpositionCost = transpositionCost;
    }

    // ---------------------------------------------------------------------
    // Strict
    // ---------------------------------------------------------------------

    public static int damerauLevenshtein(String a, String b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        final int n = a.length();
        final int m = b.length();
        if (n == 0) return m;
        if (m == 0) return n;

        int[][] d = new int[n + 1][m + 1];
        for (int i = 0; i <= n; i++) d[i][0] = i;
        for (int j = 0; j <= m; j++) d[0][j] = j;

        for (int i = 1; i <= n; i++) {
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= m; j++) {
                char cb = b.charAt(j - 1);
                int cost = (ca == cb) ? 0 : 1;

                int v = Math.min(Math.min(d[i - 1][j] + 1, d[i][j - 1] + 1), d[i - 1][j - 1] + cost);
                if (i > 1 && j > 1 && ca == b.charAt(j - 2) && a.charAt(i - 2) == cb) {
                    v = Math.min(v, d[i - 2][j - 2] + cost);
                }
                d[i][j] = v;
            }
        }
        return d[n][m];
    }

    // ---------------------------------------------------------------------
    // Weighted
    // ---------------------------------------------------------------------

    public double weighted(String a, String b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        final int n = a.length();
        final int m = b.length();
        if (n == 0) return m;
        if (m == 0) return n;

        double[][] d = new double[n + 1][m + 1];
        for (int i = 0; i <= n; i++) d[i][0] = i;
        for (int j = 0; j <= m; j++) d[0][j] = j;

        for (int i = 1; i <= n; i++) {
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= m; j++) {
                char cb = b.charAt(j - 1);
                double cost = substitutionCost(ca, cb);

                double v = Math.min(Math.min(d[i - 1][j] + 1.0, d[i][j - 1] + 1.0), d[i - 1][j - 1] + cost);
                if (i > 1 && j > 1 && ca == b.charAt(j - 2) && a.charAt(i - 2) == cb) {
                    v = Math.min(v, d[i - 2][j - 2] + transpositionCost);
                }
                d[i][j] = v;
            }
        }
        return d[n][m];
    }

    double substitutionCost(char a, char b) {
        if (a == b) return 0.0;
        char x = Character.toLowerCase(a);
        char y = Character.toLowerCase(b);
        if (isAdjacentKey(x, y)) return adjacentKeyCost;
        if (isPhoneticallySimilar(x, y)) return phoneticCost;
        return 1.0;
    }

    public static boolean isAdjacentKey(char a, char b) {
        String near = ADJACENT_KEYS.get(Character.toLowerCase(a));
        return near != null && near.indexOf(Character.toLowerCase(b)) >= 0;
    }

    public static boolean isPhoneticallySimilar(char a, char b) {
        char x = Character.toLowerCase(a);
        char y = Character.toLowerCase(b);
        for (String g : PHONETIC_GROUPS) {
            if (g.indexOf(x) >= 0 && g.indexOf(y) >= 0) return true;
        }
        return false;
    }
}
