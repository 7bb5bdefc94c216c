package sml.wsv;

import org.junit.jupiter.api.Test;
import sml.SmlErrorType;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WsvTokenizerTest {

    @Test
    void splitsOnAnyWhitespaceRun() {
        List<WsvRow> rows = WsvTokenizer.tokenize("a  b\tc\u3000 d\r");

        assertEquals(1, rows.size());
        assertEquals(1, rows.get(0).getLine());
        assertEquals(List.of("a", "b", "c", "d"), rows.get(0).getValues());
    }

    @Test
    void skipsBlankAndCommentLines() {
        List<WsvRow> rows = WsvTokenizer.tokenize("\n  # comment\n\nx y # trailing\n");

        assertEquals(1, rows.size());
        assertEquals(4, rows.get(0).getLine());
        assertEquals(List.of("x", "y"), rows.get(0).getValues());
    }

    @Test
    void handlesWindowsLineEndings() {
        List<WsvRow> rows = WsvTokenizer.tokenize("x y\r\nz\r\n");

        assertEquals(2, rows.size());
        assertEquals(List.of("x", "y"), rows.get(0).getValues());
        assertEquals(List.of("z"), rows.get(1).getValues());
        assertEquals(2, rows.get(1).getLine());
    }

    @Test
    void distinguishesNullFromEmptyAndQuotedDash() {
        List<WsvRow> rows = WsvTokenizer.tokenize("a - \"-\" \"\"");

        assertEquals(Arrays.asList("a", null, "-", ""), rows.get(0).getValues());
    }

    @Test
    void readsQuotedValuesLiterally() {
        List<WsvRow> rows = WsvTokenizer.tokenize("\"Hero 123\" \"a#b\" \"say \"\"hi\"\"\" \"one\"/\"two\"");

        assertEquals(List.of("Hero 123", "a#b", "say \"hi\"", "one\ntwo"), rows.get(0).getValues());
    }

    @Test
    void commentEndsUnquotedValue() {
        List<WsvRow> rows = WsvTokenizer.tokenize("abc#comment\n\"x\"# right after a string");

        assertEquals(List.of("abc"), rows.get(0).getValues());
        assertEquals(List.of("x"), rows.get(1).getValues());
    }

    @Test
    void rejectsUnterminatedString() {
        WsvParseException e = assertThrows(WsvParseException.class,
                () -> WsvTokenizer.tokenize("Root\nName \"Hero\nEnd"));

        assertEquals(SmlErrorType.STRING_NOT_CLOSED, e.getErrorType());
        assertEquals(2, e.getLine());
        assertEquals(6, e.getColumn());
        assertTrue(e.getMessage().contains("Line 2, column 6"));
    }

    @Test
    void rejectsCharacterAfterString() {
        WsvParseException e = assertThrows(WsvParseException.class, () -> WsvTokenizer.tokenize("\"abc\"def"));

        assertEquals(SmlErrorType.INVALID_CHARACTER_AFTER_STRING, e.getErrorType());
        assertEquals(1, e.getLine());
        assertEquals(6, e.getColumn());
    }

    @Test
    void rejectsQuoteInsideValue() {
        WsvParseException e = assertThrows(WsvParseException.class, () -> WsvTokenizer.tokenize("x\nab\"c"));

        assertEquals(SmlErrorType.INVALID_DOUBLE_QUOTE_IN_VALUE, e.getErrorType());
        assertEquals(2, e.getLine());
        assertEquals(3, e.getColumn());
    }

    @Test
    void countsColumnsInCodePoints() {
        WsvParseException e = assertThrows(WsvParseException.class,
                () -> WsvTokenizer.tokenize("\uD83D\uDE00\"x"));

        assertEquals(2, e.getColumn());
    }

    @Test
    void emptyTextHasNoRows() {
        assertTrue(WsvTokenizer.tokenize("").isEmpty());
        assertTrue(WsvTokenizer.tokenize("# only a comment\n\n").isEmpty());
    }
}
