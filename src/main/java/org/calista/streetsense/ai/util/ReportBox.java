package org.calista.streetsense.ai.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * ReportBox: рисует диагностический отчёт в "коробке" из псевдографики.
 *
 * <p>Lines longer than {@code maxWidth} are wrapped, so long inputs stay readable in a terminal.
 */
public final class ReportBox {

    private static final String SEPARATOR = "\u0000--";
    private static final int MIN_WIDTH = 24;
    private static final int MAX_WIDTH = 96;

    private ReportBox() {}

    public static String render(String title, Consumer<Builder> fill) {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(fill, "fill");

        Builder b = new Builder();
        fill.accept(b);
        return renderBox(title, b.lines);
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder {
        private final List<String> lines = new ArrayList<>(32);

        public Builder kv(String key, Object value) {
            lines.add((key == null ? "" : key) + ": " + value);
            return this;
        }

        public Builder score(String key, double value) {
            return kv(key, String.format(Locale.ROOT, "%.3f", value));
        }

        public Builder line(String text) {
            lines.add(text == null ? "" : text);
            return this;
        }

        public Builder sep() {
            lines.add(SEPARATOR);
            return this;
        }
    }

    // ---------------------------------------------------------------------
    // Rendering
    // ---------------------------------------------------------------------

    private static String renderBox(String title, List<String> raw) {
        List<String> lines = new ArrayList<>(raw.size());
        for (String l : raw) {
            if (SEPARATOR.equals(l)) lines.add(l);
            else wrap(l, MAX_WIDTH - 2, lines);
        }

        int contentWidth = title.length();
        for (String l : lines) {
            if (!SEPARATOR.equals(l)) contentWidth = Math.max(contentWidth, l.length());
        }
        int w = Math.max(MIN_WIDTH, contentWidth + 2);

        StringBuilder out = new StringBuilder((lines.size() + 5) * (w + 8));
        out.append('┌').append("─".repeat(w)).append("┐\n");
        out.append("│ ").append(padRight(title, w - 1)).append("│\n");
        out.append('├').append("─".repeat(w)).append("┤\n");

        for (String l : lines) {
            if (SEPARATOR.equals(l)) {
                out.append('│').append("─".repeat(w)).append("│\n");
                continue;
            }
            out.append("│ ").append(padRight(l, w - 1)).append("│\n");
        }

        out.append('└').append("─".repeat(w)).append('┘');
        return out.toString();
    }

    private static void wrap(String s, int width, List<String> out) {
        if (s.length() <= width) {
            out.add(s);
            return;
        }
        int i = 0;
        while (i < s.length()) {
            int end = Math.min(s.length(), i + width);
            out.add(i == 0 ? s.substring(i, end) : "  " + s.substring(i, end));
            i = end;
        }
    }

    private static String padRight(String s, int width) {
        if (s.length() >= width) return s;
        return s + " ".repeat(width - s.length());
    }
}
