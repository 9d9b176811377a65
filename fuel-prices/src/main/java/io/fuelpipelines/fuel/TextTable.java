package io.fuelpipelines.fuel;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Right-aligned plain-text table, one line per row under a header line. */
final class TextTable {
    private final List<String> headers;
    private final List<List<String>> rows = new ArrayList<>();

    TextTable(String... headers) {
        this.headers = List.of(headers);
    }

    TextTable row(Object... cells) {
        if (cells.length != headers.size()) {
            throw new IllegalArgumentException("Expected " + headers.size() + " cells, got " + cells.length);
        }
        rows.add(Arrays.stream(cells).map(c -> c == null ? "" : c.toString()).toList());
        return this;
    }

    String render() {
        int[] widths = new int[headers.size()];
        for (int i = 0; i < widths.length; i++) widths[i] = headers.get(i).length();
        for (List<String> r : rows) {
            for (int i = 0; i < widths.length; i++) widths[i] = Math.max(widths[i], r.get(i).length());
        }
        StringBuilder sb = new StringBuilder();
        line(sb, headers, widths);
        for (List<String> r : rows) line(sb, r, widths);
        return sb.toString();
    }

    private static void line(StringBuilder sb, List<String> cells, int[] widths) {
        for (int i = 0; i < widths.length; i++) {
            if (i > 0) sb.append("  ");
            String c = cells.get(i);
            sb.append(" ".repeat(widths[i] - c.length())).append(c);
        }
        sb.append('\n');
    }
}
