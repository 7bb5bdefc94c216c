package sml;

import lombok.NonNull;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sml.wsv.WsvRow;
import sml.wsv.WsvTokenizer;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Builds an element tree out of SML text.
 *
 * <p>A row with one value either closes the innermost open element, when it equals the end
 * keyword, or opens a child element. A row with more values is an attribute of the innermost
 * open element. Open elements are kept on a heap stack, so nesting depth is bounded by
 * {@link SmlParserOptions#getMaxDepth()} rather than by the call stack.
 *
 * <p>Elements still open at the end of input are closed implicitly; this is not an error.
 * An end keyword with nothing left to close is rejected.
 */
public class SmlParser {

    private static final Logger log = LoggerFactory.getLogger(SmlParser.class);

    private final SmlParserOptions options;

    public SmlParser() {
        this(SmlParserOptions.defaults());
    }

    public SmlParser(@NonNull SmlParserOptions options) {
        Validate.isTrue(options.getMaxDepth() > 0, "maxDepth must be positive, was %d", options.getMaxDepth());
        this.options = options;
    }

    /**
     * Parses text held by the caller. The sequence is read in place and must not change
     * while this call runs; the returned tree does not refer to it afterwards.
     */
    public TreeNode<SmlElement> parse(@NonNull CharSequence text) {
        List<WsvRow> rows = WsvTokenizer.tokenize(text);
        return new BuildContext(rows, resolveEndKeyword(rows), options.getMaxDepth()).build();
    }

    /**
     * Drains {@code reader} into a buffer owned by the parser, then parses it.
     * The reader is not closed.
     */
    public TreeNode<SmlElement> parse(@NonNull Reader reader) throws IOException {
        StringWriter buffer = new StringWriter();
        reader.transferTo(buffer);
        return parse(buffer.getBuffer());
    }

    private String resolveEndKeyword(List<WsvRow> rows) {
        if (options.isDetectEndKeyword() && !rows.isEmpty()) {
            WsvRow last = rows.get(rows.size() - 1);
            if (last.size() == 1) {
                return last.get(0);
            }
        }
        return options.getEndKeyword();
    }

    static boolean isEndKeyword(String value, String endKeyword) {
        if (endKeyword == null) {
            return value == null;
        }
        return value != null && value.equalsIgnoreCase(endKeyword);
    }

    private static final class Scope {
        private final TreeNode<SmlElement> node;
        private final String closer;
        private final int line;

        Scope(TreeNode<SmlElement> node, String closer, int line) {
            this.node = node;
            this.closer = closer;
            this.line = line;
        }
    }

    private static final class BuildContext {
        private final List<WsvRow> rows;
        private final String endKeyword;
        private final int maxDepth;
        private final Deque<Scope> scopes = new ArrayDeque<>();
        private TreeNode<SmlElement> root;

        BuildContext(List<WsvRow> rows, String endKeyword, int maxDepth) {
            this.rows = rows;
            this.endKeyword = endKeyword;
            this.maxDepth = maxDepth;
        }

        TreeNode<SmlElement> build() {
            if (rows.isEmpty()) {
                throw new SmlParseException(SmlErrorType.EMPTY_DOCUMENT, 1, "Document contains no elements");
            }
            openRoot(rows.get(0));
            for (int i = 1; i < rows.size(); i++) {
                WsvRow row = rows.get(i);
                if (scopes.isEmpty()) {
                    rejectAfterRoot(row);
                } else if (row.size() == 1) {
                    onSingleValue(row);
                } else {
                    onAttribute(row);
                }
            }
            closeRemaining();
            log.debug("Parsed {} rows into root element '{}'", rows.size(), root.getValue().getName());
            return root;
        }

        private void openRoot(WsvRow row) {
            if (row.size() > 1) {
                throw error(SmlErrorType.INVALID_ROOT_ELEMENT_START, row, "Root element must be alone on its line");
            }
            open(row);
        }

        private void onSingleValue(WsvRow row) {
            if (isEndKeyword(row.get(0), scopes.peek().closer)) {
                close();
            } else {
                open(row);
            }
        }

        private void onAttribute(WsvRow row) {
            String name = row.get(0);
            if (name == null) {
                throw error(SmlErrorType.NULL_ATTRIBUTE_NAME, row, "Attribute name can not be null");
            }
            List<String> values = row.getValues().subList(1, row.size());
            scopes.peek().node.getValue().getAttributes().add(new SmlAttribute(name, values));
        }

        private void open(WsvRow row) {
            String name = row.get(0);
            if (name == null) {
                throw error(SmlErrorType.NULL_ELEMENT_NAME, row, "Element name can not be null");
            }
            if (scopes.size() >= maxDepth) {
                throw error(SmlErrorType.NESTING_TOO_DEEP, row, "Elements nested deeper than " + maxDepth);
            }
            scopes.push(new Scope(new TreeNode<>(new SmlElement(name)), endKeyword, row.getLine()));
        }

        private void close() {
            Scope closed = scopes.pop();
            if (scopes.isEmpty()) {
                root = closed.node;
            } else {
                scopes.peek().node.addChild(closed.node);
            }
        }

        private void closeRemaining() {
            if (scopes.isEmpty()) {
                return;
            }
            log.debug("End of input with {} open element(s), closing '{}' opened at line {} and its ancestors",
                    scopes.size(), scopes.peek().node.getValue().getName(), scopes.peek().line);
            while (!scopes.isEmpty()) {
                close();
            }
        }

        private void rejectAfterRoot(WsvRow row) {
            if (row.size() == 1 && isEndKeyword(row.get(0), endKeyword)) {
                throw error(SmlErrorType.STRAY_END_KEYWORD, row, "End keyword without an open element");
            }
            throw error(SmlErrorType.ONLY_ONE_ROOT_ELEMENT_ALLOWED, row, "Content after the root element was closed");
        }

        private static SmlParseException error(SmlErrorType type, WsvRow row, String message) {
            return new SmlParseException(type, row.getLine(), String.format("Line %d: %s", row.getLine(), message));
        }
    }
}
