package org.calista.steer.generate;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Renders key/value blocks for startup and run-summary log entries.
 *
 * <pre>
 * +- smc.engine ------------+
 * | particles  = 16         |
 * |-------------------------|
 * | workers    = 7          |
 * +-------------------------+
 * </pre>
 */
public final class SteerLogFmt {

    private static final int MAX_VALUE_WIDTH = 72;

    private SteerLogFmt() {}

    public static String box(String title, Consumer<Block> fill) {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(fill, "fill");
        Block b = new Block();
        fill.accept(b);
        return b.render(title);
    }

    /** Fixed-precision rendering used for weights and ESS values. */
    public static String num(double v) {
        if (Double.isNaN(v)) return "NaN";
        if (v == Double.NEGATIVE_INFINITY) return "-inf";
        if (v == Double.POSITIVE_INFINITY) return "+inf";
        return String.format(Locale.ROOT, "%.4f", v);
    }

    public static String clip(String s, int max) {
        if (s == null) return "null";
        if (s.length() <= max) return s;
        return s.substring(0, Math.max(0, max - 3)) + "...";
    }

    public static final class Block {
        private final List<String[]> rows = new ArrayList<>();

        public Block kv(String key, Object value) {
            String v = value instanceof Double ? num((Double) value) : String.valueOf(value);
            rows.add(new String[]{key == null ? "" : key, clip(v, MAX_VALUE_WIDTH)});
            return this;
        }

        public Block sep() {
            rows.add(null);
            return this;
        }

        private String render(String title) {
            int keyWidth = 0;
            for (String[] r : rows) if (r != null) keyWidth = Math.max(keyWidth, r[0].length());

            int width = title.length() + 4;
            for (String[] r : rows) if (r != null) width = Math.max(width, keyWidth + 3 + r[1].length());
            width += 2;

            StringBuilder out = new StringBuilder();
            out.append("+- ").append(title).append(' ').append("-".repeat(Math.max(0, width - title.length() - 3))).append("+\n");
            for (String[] r : rows) {
                if (r == null) {
                    out.append('|').append("-".repeat(width)).append("|\n");
                    continue;
                }
                String line = " " + pad(r[0], keyWidth) + " = " + r[1];
                out.append('|').append(pad(line, width)).append("|\n");
            }
            out.append('+').append("-".repeat(width)).append('+');
            return out.toString();
        }
    }

    private static String pad(String s, int width) {
        return s.length() >= width ? s : s + " ".repeat(width - s.length());
    }
}
