package ai.speakregex.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ordered tree node owning its children and keeping a back-reference to its parent.
 *
 * <p>A node has at most one parent. Adding a node that already has a parent moves it, and no operation may make a
 * node its own ancestor.
 *
 * @param <T> payload type
 */
public final class TreeNode<T> {

    private final T data;
    private final List<TreeNode<T>> children = new ArrayList<>();
    private TreeNode<T> parent;

    public TreeNode(T data) {
        this.data = data;
    }

    /**
     * Payload of this node; {@code null} for synthetic roots.
     */
    public T data() {
        return data;
    }

    public Optional<TreeNode<T>> parent() {
        return Optional.ofNullable(parent);
    }

    public List<TreeNode<T>> children() {
        return Collections.unmodifiableList(children);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public Optional<TreeNode<T>> lastChild() {
        return children.isEmpty() ? Optional.empty() : Optional.of(children.get(children.size() - 1));
    }

    /**
     * Appends {@code child}, detaching it from its current parent first.
     *
     * @return this node
     */
    public TreeNode<T> add(TreeNode<T> child) {
        requireAdoptable(child);
        child.detach();
        children.add(child);
        child.parent = this;
        return this;
    }

    /**
     * @throws IllegalArgumentException when {@code child} is not a child of this node
     */
    public TreeNode<T> remove(TreeNode<T> child) {
        if (child == null || child.parent != this || !children.remove(child)) {
            throw new IllegalArgumentException("node is not a child of this node");
        }
        child.parent = null;
        return this;
    }

    public TreeNode<T> detach() {
        if (parent != null) {
            parent.remove(this);
        }
        return this;
    }

    /**
     * Puts {@code replacement} at the position of {@code child}, which is detached.
     */
    public void replace(TreeNode<T> child, TreeNode<T> replacement) {
        if (child == null || child.parent != this) {
            throw new IllegalArgumentException("node is not a child of this node");
        }
        if (child == replacement) {
            return;
        }
        requireAdoptable(replacement);
        replacement.detach();
        int position = children.indexOf(child);
        children.set(position, replacement);
        child.parent = null;
        replacement.parent = this;
    }

    /**
     * The sibling directly before this node, if any.
     */
    public Optional<TreeNode<T>> olderSibling() {
        if (parent == null) {
            return Optional.empty();
        }
        int position = parent.children.indexOf(this);
        return position > 0 ? Optional.of(parent.children.get(position - 1)) : Optional.empty();
    }

    /**
     * The sibling directly after this node, if any.
     */
    public Optional<TreeNode<T>> youngerSibling() {
        if (parent == null) {
            return Optional.empty();
        }
        int position = parent.children.indexOf(this);
        return position < parent.children.size() - 1 ? Optional.of(parent.children.get(position + 1)) : Optional.empty();
    }

    /**
     * Siblings before this node, nearest first.
     */
    public List<TreeNode<T>> olderSiblings() {
        if (parent == null) {
            return List.of();
        }
        List<TreeNode<T>> older = new ArrayList<>(parent.children.subList(0, parent.children.indexOf(this)));
        Collections.reverse(older);
        return older;
    }

    /**
     * Siblings after this node, nearest first.
     */
    public List<TreeNode<T>> youngerSiblings() {
        if (parent == null) {
            return List.of();
        }
        int position = parent.children.indexOf(this);
        return List.copyOf(parent.children.subList(position + 1, parent.children.size()));
    }

    public int depth() {
        int depth = 0;
        for (TreeNode<T> node = parent; node != null; node = node.parent) {
            depth++;
        }
        return depth;
    }

    /**
     * Depth-first, pre-order walk starting with this node.
     */
    public List<TreeNode<T>> iterate() {
        List<TreeNode<T>> nodes = new ArrayList<>();
        collect(this, nodes);
        return nodes;
    }

    /**
     * Renders this node and its descendants one per line, indented two spaces per level.
     */
    public String dump() {
        List<String> lines = new ArrayList<>();
        dump(this, 0, lines);
        return String.join("\n", lines);
    }

    @Override
    public String toString() {
        return data + " node (" + (parent == null ? "no" : "1") + " parent, " + children.size() + " children)";
    }

    private void requireAdoptable(TreeNode<T> node) {
        if (node == null) {
            throw new IllegalArgumentException("node must not be null");
        }
        for (TreeNode<T> ancestor = this; ancestor != null; ancestor = ancestor.parent) {
            if (ancestor == node) {
                throw new IllegalArgumentException("adding this node would create a cycle");
            }
        }
    }

    private static <T> void collect(TreeNode<T> node, List<TreeNode<T>> nodes) {
        nodes.add(node);
        for (TreeNode<T> child : node.children) {
            collect(child, nodes);
        }
    }

    private static <T> void dump(TreeNode<T> node, int level, List<String> lines) {
        lines.add("  ".repeat(level) + node.data);
        for (TreeNode<T> child : node.children) {
            dump(child, level + 1, lines);
        }
    }
}
