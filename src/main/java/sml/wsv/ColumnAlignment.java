package sml.wsv;

public enum ColumnAlignment {
    /** Values separated by a single space. */
    NONE,
    /** Values padded on the right up to the column width; the last value of a row is never padded. */
    LEFT,
    /** Values padded on the left up to the column width. */
    RIGHT
}
