package sml.flat;

import lombok.AllArgsConstructor;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import sml.SmlAttribute;
import sml.SmlElement;
import sml.SmlParser;
import sml.SmlWriter;
import sml.TreeNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flat view of an SML document: one item per attribute, keyed by the dotted path of its
 * element plus its own name, e.g. {@code Configuration.Video.Resolution}. A segment gets an
 * {@code [i]} suffix when it is the i-th sibling (i &gt; 0) with the same name. Item values are
 * the attribute's value lists. Elements with neither attributes nor children are kept as
 * items with a {@code null} value.
 */
public class FlatSml implements FlatService {

    private static final String SEPARATOR = ".";
    private static final Pattern SEGMENT_PATTERN = Pattern.compile("^([^.\\[\\]]+)(?:\\[(\\d+)])?$");

    private final SmlParser parser;
    private final SmlWriter writer;

    public FlatSml() {
        this(new SmlParser(), new SmlWriter());
    }

    public FlatSml(SmlParser parser, SmlWriter writer) {
        this.parser = parser;
        this.writer = writer;
    }

    @Override
    public Map<String, FileDataItem> flatToMap(String data) {
        Map<String, FileDataItem> flatData = new LinkedHashMap<>();
        if (StringUtils.isBlank(data)) {
            return flatData;
        }
        TreeNode<SmlElement> root = parser.parse(data);
        flatten(root, segment(root.getValue().getName(), 0), flatData);
        return flatData;
    }

    @Override
    public String flatToString(Map<String, FileDataItem> data) {
        if (data == null || data.isEmpty()) {
            return StringUtils.EMPTY;
        }
        validate(data);

        TreeNode<SmlElement> root = null;
        for (FileDataItem item : data.values()) {
            List<Segment> segments = parseKey(item.getKey());
            if (root == null) {
                root = new TreeNode<>(new SmlElement(segments.get(0).name));
            }
            boolean attribute = item.getValue() != null;
            int elementCount = attribute ? segments.size() - 1 : segments.size();

            TreeNode<SmlElement> current = root;
            for (int i = 1; i < elementCount; i++) {
                current = childAt(current, segments.get(i));
            }
            if (attribute) {
                String name = segments.get(segments.size() - 1).name;
                current.getValue().getAttributes().add(new SmlAttribute(name, toValues((List<?>) item.getValue())));
            }
        }
        return writer.write(root);
    }

    @Override
    public void validate(Map<String, FileDataItem> data) {
        if (data == null) {
            throw new IllegalArgumentException("Flat SML data can not be null");
        }
        String rootName = null;
        for (Map.Entry<String, FileDataItem> entry : data.entrySet()) {
            FileDataItem item = entry.getValue();
            if (item == null || item.getKey() == null) {
                throw new IllegalArgumentException("Item without a key under '" + entry.getKey() + "'");
            }
            List<Segment> segments = parseKey(item.getKey());
            Segment first = segments.get(0);
            if (first.index != 0) {
                throw new IllegalArgumentException("Root segment can not be indexed: " + item.getKey());
            }
            if (rootName == null) {
                rootName = first.name;
            } else if (!rootName.equals(first.name)) {
                throw new IllegalArgumentException(
                        String.format("Key '%s' does not start with root element '%s'", item.getKey(), rootName));
            }
            Object value = item.getValue();
            if (value != null && !(value instanceof List)) {
                throw new IllegalArgumentException("Value of '" + item.getKey() + "' must be a list of values");
            }
            if (value != null && segments.size() < 2) {
                throw new IllegalArgumentException("Attribute '" + item.getKey() + "' has no element");
            }
        }
    }

    private void flatten(TreeNode<SmlElement> root, String rootPath, Map<String, FileDataItem> result) {
        Deque<Frame> frames = new ArrayDeque<>();
        frames.push(new Frame(root, rootPath));
        while (!frames.isEmpty()) {
            Frame frame = frames.pop();
            SmlElement element = frame.node.getValue();
            if (element.getAttributes().isEmpty() && frame.node.isLeaf()) {
                put(result, FileDataItem.builder().key(frame.path).path(frame.path).build());
                continue;
            }

            Map<String, Integer> seenAttributes = new HashMap<>();
            for (SmlAttribute attribute : element.getAttributes()) {
                int index = seenAttributes.merge(attribute.getName(), 1, Integer::sum) - 1;
                String key = frame.path + SEPARATOR + segment(attribute.getName(), index);
                put(result, FileDataItem.builder()
                        .key(key)
                        .path(frame.path)
                        .value(new ArrayList<>(attribute.getValues()))
                        .build());
            }

            Map<String, Integer> seenChildren = new HashMap<>();
            List<Frame> children = new ArrayList<>(frame.node.getChildren().size());
            for (TreeNode<SmlElement> child : frame.node.getChildren()) {
                String name = child.getValue().getName();
                int index = seenChildren.merge(name, 1, Integer::sum) - 1;
                children.add(new Frame(child, frame.path + SEPARATOR + segment(name, index)));
            }
            for (int i = children.size() - 1; i >= 0; i--) {
                frames.push(children.get(i));
            }
        }
    }

    // An empty element and an attribute of its parent with the same name map to the same key.
    private static void put(Map<String, FileDataItem> result, FileDataItem item) {
        if (result.putIfAbsent(item.getKey(), item) != null) {
            throw new IllegalArgumentException("Key '" + item.getKey()
                    + "' names both an attribute and an empty element and can not be flattened");
        }
    }

    private static String segment(String name, int index) {
        if (name.isEmpty() || StringUtils.containsAny(name, ".[]")) {
            throw new IllegalArgumentException("Name '" + name + "' can not be used in a flat key");
        }
        return index == 0 ? name : name + "[" + index + "]";
    }

    private static List<Segment> parseKey(String key) {
        List<Segment> segments = new ArrayList<>();
        for (String part : key.split(Pattern.quote(SEPARATOR), -1)) {
            Matcher matcher = SEGMENT_PATTERN.matcher(part);
            if (!matcher.matches()) {
                throw new IllegalArgumentException("Invalid flat key '" + key + "'");
            }
            int index = matcher.group(2) == null ? 0 : Integer.parseInt(matcher.group(2));
            segments.add(new Segment(matcher.group(1), index));
        }
        return segments;
    }

    private static TreeNode<SmlElement> childAt(TreeNode<SmlElement> parent, Segment segment) {
        int seen = 0;
        for (TreeNode<SmlElement> child : parent.getChildren()) {
            if (child.getValue().getName().equals(segment.name)) {
                if (seen == segment.index) {
                    return child;
                }
                seen++;
            }
        }
        TreeNode<SmlElement> created = null;
        for (; seen <= segment.index; seen++) {
            created = new TreeNode<>(new SmlElement(segment.name));
            parent.addChild(created);
        }
        return created;
    }

    private static List<String> toValues(List<?> raw) {
        List<String> values = new ArrayList<>(raw.size());
        for (Object value : raw) {
            values.add(value == null ? null : value.toString());
        }
        return values;
    }

    @AllArgsConstructor
    private static class Frame {
        private final TreeNode<SmlElement> node;
        private final String path;
    }

    @Data
    @AllArgsConstructor
    private static class Segment {
        private String name;
        private int index;
    }
}
