package sml;

import lombok.NonNull;
import org.apache.commons.lang3.StringUtils;
import sml.wsv.ColumnAlignment;
import sml.wsv.WsvChars;
import sml.wsv.WsvWriter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Renders an element tree as SML text.
 *
 * <p>Options are checked when the writer is created, so an invalid indent never produces
 * partial output. Rendering does not modify the tree.
 */
public class SmlWriter {

    private static final String LINE_SEPARATOR = "\n";

    private final String endKeyword;
    private final String closer;
    private final String indent;
    private final ColumnAlignment alignment;

    public SmlWriter() {
        this(SmlWriterOptions.defaults());
    }

    public SmlWriter(@NonNull SmlWriterOptions options) {
        validateIndent(options.getIndent());
        this.alignment = Objects.requireNonNull(options.getAlignment(), "alignment");
        this.indent = options.getIndent();
        this.endKeyword = StringUtils.isEmpty(options.getEndKeyword()) ? null : options.getEndKeyword();
        this.closer = WsvWriter.serialize(endKeyword);
    }

    private static void validateIndent(String indent) {
        if (StringUtils.isEmpty(indent)) {
            throw new SmlConfigurationException(SmlErrorType.INVALID_INDENT, "Indent can not be empty");
        }
        if (!WsvChars.isWhitespace(indent)) {
            int offending = indent.codePoints()
                    .filter(cp -> !WsvChars.isWhitespace(cp))
                    .findFirst()
                    .orElseThrow();
            throw new SmlConfigurationException(SmlErrorType.INVALID_INDENT,
                    String.format("Indent may only contain whitespace, found U+%04X", offending));
        }
    }

    public String write(@NonNull TreeNode<SmlElement> root) {
        List<String> lines = new ArrayList<>();
        Deque<Frame> frames = new ArrayDeque<>();
        enter(root, 0, lines, frames);
        while (!frames.isEmpty()) {
            Frame frame = frames.peek();
            List<TreeNode<SmlElement>> children = frame.node.getChildren();
            if (frame.nextChild < children.size()) {
                enter(children.get(frame.nextChild++), frame.depth + 1, lines, frames);
            } else {
                frames.pop();
                lines.add(indent(frame.depth) + closer);
            }
        }
        return String.join(LINE_SEPARATOR, lines);
    }

    private void enter(TreeNode<SmlElement> node, int depth, List<String> lines, Deque<Frame> frames) {
        SmlElement element = Objects.requireNonNull(node.getValue(), "element");
        if (isEndKeyword(element.getName())) {
            throw new SmlWriteException(SmlErrorType.ELEMENT_HAS_END_KEYWORD_NAME,
                    "Element name '" + element.getName() + "' collides with the end keyword");
        }
        lines.add(indent(depth) + WsvWriter.serialize(element.getName()));

        List<List<String>> table = new ArrayList<>(element.getAttributes().size());
        for (SmlAttribute attribute : element.getAttributes()) {
            table.add(toRow(element, attribute));
        }
        String attributeIndent = indent(depth + 1);
        for (String row : WsvWriter.writeRows(table, alignment)) {
            lines.add(attributeIndent + row);
        }
        frames.push(new Frame(node, depth));
    }

    private List<String> toRow(SmlElement element, SmlAttribute attribute) {
        if (isEndKeyword(attribute.getName())) {
            throw new SmlWriteException(SmlErrorType.ATTRIBUTE_HAS_END_KEYWORD_NAME,
                    "Attribute name '" + attribute.getName() + "' collides with the end keyword");
        }
        if (attribute.getValues().isEmpty()) {
            throw new SmlWriteException(SmlErrorType.ATTRIBUTE_WITHOUT_VALUES,
                    "Attribute '" + attribute.getName() + "' of element '" + element.getName() + "' has no values");
        }
        List<String> row = new ArrayList<>(attribute.getValues().size() + 1);
        row.add(attribute.getName());
        row.addAll(attribute.getValues());
        return row;
    }

    private boolean isEndKeyword(String name) {
        return endKeyword != null && endKeyword.equalsIgnoreCase(name);
    }

    private String indent(int depth) {
        return StringUtils.repeat(indent, depth);
    }

    private static final class Frame {
        private final TreeNode<SmlElement> node;
        private final int depth;
        private int nextChild;

        Frame(TreeNode<SmlElement> node, int depth) {
            this.node = node;
            this.depth = depth;
        }
    }
}
