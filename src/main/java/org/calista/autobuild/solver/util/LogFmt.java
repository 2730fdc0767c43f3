package org.calista.autobuild.solver.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * LogFmt — рамка для многострочных итогов (диагностика прохода, отчёт CLI).
 *
 * <pre>
 * ┌──────────────────────────┐
 * │ title                    │
 * ├──────────────────────────┤
 * │ key: value               │
 * └──────────────────────────┘
 * </pre>
 */
public final class LogFmt {

    private static final String SEP = "\u0000sep";
    private static final int MIN_WIDTH = 24;

    private LogFmt() {}

    public static String box(String title, Consumer<Box> fill) {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(fill, "fill");
        Box b = new Box();
        fill.accept(b);
        return render(title, b.lines);
    }

    /** Fixed 2-decimal rendering independent of the default locale. */
    public static String num(double v) {
        if (Double.isNaN(v)) return "NaN";
        if (Double.isInfinite(v)) return v > 0 ? "+inf" : "-inf";
        return String.format(Locale.ROOT, "%.2f", v);
    }

    public static final class Box {
        private final List<String> lines = new ArrayList<>(16);

        public Box kv(String key, Object value) {
            lines.add((key == null ? "" : key) + ": " + value);
            return this;
        }

        public Box kv(String key, double value) {
            return kv(key, (Object) num(value));
        }

        public Box line(String text) {
            lines.add(text == null ? "" : text);
            return this;
        }

        public Box sep() {
            lines.add(SEP);
            return this;
        }
    }

    private static String render(String title, List<String> lines) {
        int content = title.length();
        for (String l : lines) {
            if (!SEP.equals(l)) content = Math.max(content, l.length());
        }
        int w = Math.max(MIN_WIDTH, content + 2);
        String bar = "─".repeat(w);

        StringBuilder out = new StringBuilder((lines.size() + 4) * (w + 4));
        out.append('┌').append(bar).append("┐\n");
        out.append("│ ").append(pad(title, w - 1)).append("│\n");
        out.append('├').append(bar).append("┤\n");
        for (String l : lines) {
            if (SEP.equals(l)) {
                out.append('│').append(bar).append("│\n");
            } else {
                out.append("│ ").append(pad(l, w - 1)).append("│\n");
            }
        }
        out.append('└').append(bar).append('┘');
        return out.toString();
    }

    private static String pad(String s, int width) {
        return s.length() >= width ? s : s + " ".repeat(width - s.length());
    }
}
