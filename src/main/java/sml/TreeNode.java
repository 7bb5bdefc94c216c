package sml;

import lombok.Data;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A value plus the ordered children it owns. Nodes keep no reference to their parent.
 *
 * <p>{@code equals}, {@code hashCode} and {@code toString} recurse into the children, so on
 * very deep trees they can overflow the call stack. Walk such trees with an explicit stack.
 */
@Data
public class TreeNode<T> {

    private T value;
    @NonNull
    private List<TreeNode<T>> children;

    public TreeNode(T value) {
        this(value, new ArrayList<>());
    }

    public TreeNode(T value, @NonNull List<TreeNode<T>> children) {
        this.value = value;
        this.children = new ArrayList<>(children);
    }

    @SafeVarargs
    public static <T> TreeNode<T> of(T value, TreeNode<T>... children) {
        return new TreeNode<>(value, Arrays.asList(children));
    }

    public TreeNode<T> addChild(@NonNull TreeNode<T> child) {
        children.add(child);
        return this;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }
}
