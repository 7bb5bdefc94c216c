package sml.wsv;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Serializes single values and whole tables to WSV.
 */
public final class WsvWriter {

    private static final String QUOTED_QUOTE = "\"\"";
    private static final String QUOTED_LINE_FEED = "\"/\"";
    private static final String EMPTY_STRING = "\"\"";

    private WsvWriter() {
    }

    /**
     * Serializes one value so that {@link WsvTokenizer} reads it back unchanged.
     */
    public static String serialize(String value) {
        if (value == null) {
            return WsvTokenizer.NULL_VALUE;
        }
        if (value.isEmpty()) {
            return EMPTY_STRING;
        }
        if (!needsQuotes(value)) {
            return value;
        }
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append(WsvTokenizer.QUOTE);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == WsvTokenizer.QUOTE) {
                sb.append(QUOTED_QUOTE);
            } else if (c == WsvTokenizer.LINE_FEED) {
                sb.append(QUOTED_LINE_FEED);
            } else {
                sb.append(c);
            }
        }
        sb.append(WsvTokenizer.QUOTE);
        return sb.toString();
    }

    static boolean needsQuotes(String value) {
        return WsvTokenizer.NULL_VALUE.equals(value)
                || value.indexOf(WsvTokenizer.QUOTE) >= 0
                || value.indexOf(WsvTokenizer.COMMENT) >= 0
                || WsvChars.containsWhitespace(value);
    }

    /**
     * Serializes a table and aligns its columns.
     *
     * @param rows raw values, one list per row; rows may differ in length
     * @return one line per row, without line separators
     */
    public static List<String> writeRows(List<List<String>> rows, ColumnAlignment alignment) {
        List<List<String>> serialized = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            List<String> values = new ArrayList<>(row.size());
            for (String value : row) {
                values.add(serialize(value));
            }
            serialized.add(values);
        }

        int[] widths = alignment == ColumnAlignment.NONE ? new int[0] : ColumnWidths.of(serialized);
        List<String> lines = new ArrayList<>(serialized.size());
        for (List<String> row : serialized) {
            lines.add(writeRow(row, widths, alignment));
        }
        return lines;
    }

    private static String writeRow(List<String> row, int[] widths, ColumnAlignment alignment) {
        StringJoiner line = new StringJoiner(" ");
        for (int i = 0; i < row.size(); i++) {
            String value = row.get(i);
            int padding = alignment == ColumnAlignment.NONE ? 0 : widths[i] - ColumnWidths.width(value);
            if (alignment == ColumnAlignment.RIGHT) {
                line.add(StringUtils.repeat(' ', padding) + value);
            } else if (alignment == ColumnAlignment.LEFT && i < row.size() - 1) {
                line.add(value + StringUtils.repeat(' ', padding));
            } else {
                line.add(value);
            }
        }
        return line.toString();
    }
}
