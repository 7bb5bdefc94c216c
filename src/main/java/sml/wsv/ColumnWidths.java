package sml.wsv;

import java.util.List;

/**
 * Column widths of a table whose rows may have different lengths.
 * A row only contributes to the columns it actually has.
 */
public final class ColumnWidths {

    private ColumnWidths() {
    }

    /**
     * @param rows already serialized values, one list per row
     * @return the widest value per column, in code points
     */
    public static int[] of(List<List<String>> rows) {
        int columns = 0;
        for (List<String> row : rows) {
            columns = Math.max(columns, row.size());
        }
        int[] widths = new int[columns];
        for (List<String> row : rows) {
            for (int i = 0; i < row.size(); i++) {
                widths[i] = Math.max(widths[i], width(row.get(i)));
            }
        }
        return widths;
    }

    static int width(String value) {
        return value.codePointCount(0, value.length());
    }
}
