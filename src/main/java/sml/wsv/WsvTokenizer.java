package sml.wsv;

import sml.SmlErrorType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits WSV text into rows of optional values.
 *
 * <p>Rules: runs of {@link WsvChars whitespace} separate values, {@code #} starts a comment,
 * a bare {@code -} is null, and a value opening with {@code "} runs to its closing quote.
 * Inside quotes {@code ""} stands for one quote and {@code "/"} for a line feed.
 * Lines that hold nothing but whitespace or a comment produce no row.
 */
public final class WsvTokenizer {

    static final char QUOTE = '"';
    static final char COMMENT = '#';
    static final char LINE_FEED = '\n';
    static final char LINE_FEED_ESCAPE = '/';
    static final String NULL_VALUE = "-";

    private WsvTokenizer() {
    }

    public static List<WsvRow> tokenize(CharSequence text) {
        Objects.requireNonNull(text, "text");
        List<WsvRow> rows = new ArrayList<>();
        int length = text.length();
        int lineStart = 0;
        int lineNumber = 1;
        while (lineStart <= length) {
            int lineEnd = indexOf(text, LINE_FEED, lineStart);
            if (lineEnd < 0) {
                lineEnd = length;
            }
            List<String> values = new LineReader(text, lineStart, lineEnd, lineNumber).read();
            if (!values.isEmpty()) {
                rows.add(new WsvRow(lineNumber, values));
            }
            lineStart = lineEnd + 1;
            lineNumber++;
        }
        return rows;
    }

    private static int indexOf(CharSequence text, char ch, int from) {
        for (int i = from; i < text.length(); i++) {
            if (text.charAt(i) == ch) {
                return i;
            }
        }
        return -1;
    }

    private static final class LineReader {
        private final CharSequence text;
        private final int end;
        private final int line;
        private int pos;
        private int column = 1;

        LineReader(CharSequence text, int start, int end, int line) {
            this.text = text;
            this.pos = start;
            this.end = end;
            this.line = line;
        }

        List<String> read() {
            List<String> values = new ArrayList<>();
            while (true) {
                skipWhitespace();
                if (pos >= end || text.charAt(pos) == COMMENT) {
                    return values;
                }
                if (text.charAt(pos) == QUOTE) {
                    values.add(readQuoted());
                } else {
                    values.add(readUnquoted());
                }
            }
        }

        private String readUnquoted() {
            int start = pos;
            while (pos < end) {
                int cp = current();
                if (WsvChars.isWhitespace(cp) || cp == COMMENT) {
                    break;
                }
                if (cp == QUOTE) {
                    throw error(SmlErrorType.INVALID_DOUBLE_QUOTE_IN_VALUE, column, "Invalid double quote in value");
                }
                advance();
            }
            String value = text.subSequence(start, pos).toString();
            return NULL_VALUE.equals(value) ? null : value;
        }

        private String readQuoted() {
            int openColumn = column;
            advance();
            StringBuilder value = new StringBuilder();
            while (true) {
                if (pos >= end) {
                    throw error(SmlErrorType.STRING_NOT_CLOSED, openColumn, "String not closed");
                }
                int cp = current();
                advance();
                if (cp != QUOTE) {
                    value.appendCodePoint(cp);
                } else if (pos < end && text.charAt(pos) == QUOTE) {
                    value.append(QUOTE);
                    advance();
                } else if (pos + 1 < end && text.charAt(pos) == LINE_FEED_ESCAPE && text.charAt(pos + 1) == QUOTE) {
                    value.append(LINE_FEED);
                    advance();
                    advance();
                } else {
                    break;
                }
            }
            if (pos < end) {
                int next = current();
                if (!WsvChars.isWhitespace(next) && next != COMMENT) {
                    throw error(SmlErrorType.INVALID_CHARACTER_AFTER_STRING, column, "Invalid character after string");
                }
            }
            return value.toString();
        }

        private void skipWhitespace() {
            while (pos < end && WsvChars.isWhitespace(current())) {
                advance();
            }
        }

        private int current() {
            return Character.codePointAt(text, pos);
        }

        private void advance() {
            pos += Character.charCount(current());
            column++;
        }

        private WsvParseException error(SmlErrorType type, int atColumn, String message) {
            return new WsvParseException(type, line, atColumn,
                    String.format("Line %d, column %d: %s", line, atColumn, message));
        }
    }
}
