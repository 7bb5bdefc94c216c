package sml;

import java.io.IOException;
import java.io.Reader;

/**
 * Shortcuts for parsing and writing with default options.
 */
public final class Sml {

    private static final SmlParser PARSER = new SmlParser();
    private static final SmlWriter WRITER = new SmlWriter();

    private Sml() {
    }

    public static TreeNode<SmlElement> parse(CharSequence text) {
        return PARSER.parse(text);
    }

    public static TreeNode<SmlElement> parse(Reader reader) throws IOException {
        return PARSER.parse(reader);
    }

    public static String write(TreeNode<SmlElement> root) {
        return WRITER.write(root);
    }

    public static String write(TreeNode<SmlElement> root, SmlWriterOptions options) {
        return new SmlWriter(options).write(root);
    }
}
