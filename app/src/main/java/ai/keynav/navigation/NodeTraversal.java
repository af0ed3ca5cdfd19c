package ai.keynav.navigation;

import ai.keynav.blocks.FocusableNode;
import ai.keynav.blocks.NodeNavigator;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;

/**
 * Walks a {@link NodeNavigator} graph in pre-order (forward) or reverse pre-order (backward), returning the first
 * node accepted by a predicate. Wrapping around the ends of the graph happens here, never in the navigator, and only
 * when the caller asks for it. Every walk keeps an identity-based visited set, so malformed or cyclic graphs end in
 * {@code null} instead of spinning.
 */
public final class NodeTraversal {
    private final NodeNavigator navigator;
    private final FocusableNode root;

    public NodeTraversal(NodeNavigator navigator, FocusableNode root) {
        this.navigator = navigator;
        this.root = root;
    }

    public @Nullable FocusableNode getNextNode(
            @Nullable FocusableNode node, Predicate<FocusableNode> isValid, boolean loop) {
        if (node == null || (!loop && node == getLastNode())) {
            return null;
        }
        var visited = identitySet();
        var current = node;
        while (visited.add(current)) {
            var candidate = nextInPreOrder(current, loop);
            if (candidate == null) {
                return null;
            }
            if (isValid.test(candidate)) {
                return candidate;
            }
            current = candidate;
        }
        return null;
    }

    public @Nullable FocusableNode getPreviousNode(
            @Nullable FocusableNode node, Predicate<FocusableNode> isValid, boolean loop) {
        if (node == null || (!loop && node == getFirstNode())) {
            return null;
        }
        var visited = identitySet();
        var current = node;
        while (visited.add(current)) {
            var candidate = previousInPreOrder(current, loop);
            if (candidate == null) {
                return null;
            }
            if (isValid.test(candidate)) {
                return candidate;
            }
            current = candidate;
        }
        return null;
    }

    public @Nullable FocusableNode getFirstNode() {
        return navigator.getFirstChild(root);
    }

    /** The node one looping backward step before the first node, i.e. the deepest last descendant of the root. */
    public @Nullable FocusableNode getLastNode() {
        return getPreviousNode(getFirstNode(), n -> true, true);
    }

    private @Nullable FocusableNode nextInPreOrder(FocusableNode node, boolean loop) {
        var candidate = navigator.getFirstChild(node);
        if (candidate == null) {
            candidate = navigator.getNextSibling(node);
        }
        var climbed = identitySet();
        var target = node;
        while (candidate == null) {
            var parent = navigator.getParent(target);
            if (parent == null || !climbed.add(parent)) {
                break;
            }
            candidate = navigator.getNextSibling(parent);
            target = parent;
        }
        if (candidate == null && loop) {
            candidate = navigator.getFirstChild(root);
        }
        return candidate;
    }

    private @Nullable FocusableNode previousInPreOrder(FocusableNode node, boolean loop) {
        var previousSibling = navigator.getPreviousSibling(node);
        if (previousSibling != null) {
            return rightMostChild(previousSibling, node);
        }
        var parent = navigator.getParent(node);
        if (loop && (parent == null || parent == root)) {
            var last = lastChild(root);
            return last == null ? null : rightMostChild(last, node);
        }
        return parent;
    }

    /** Deepest last descendant of {@code node}, never descending into or past {@code stopIfFound}. */
    private FocusableNode rightMostChild(FocusableNode node, FocusableNode stopIfFound) {
        var visited = identitySet();
        var current = node;
        while (visited.add(current)) {
            var first = navigator.getFirstChild(current);
            if (first == null || first == stopIfFound) {
                return current;
            }
            var last = first;
            var siblings = identitySet();
            siblings.add(first);
            var next = navigator.getNextSibling(first);
            while (next != null && next != stopIfFound && siblings.add(next)) {
                last = next;
                next = navigator.getNextSibling(next);
            }
            current = last;
        }
        return current;
    }

    private @Nullable FocusableNode lastChild(FocusableNode node) {
        var child = navigator.getFirstChild(node);
        if (child == null) {
            return null;
        }
        var seen = identitySet();
        seen.add(child);
        var next = navigator.getNextSibling(child);
        while (next != null && seen.add(next)) {
            child = next;
            next = navigator.getNextSibling(next);
        }
        return child;
    }

    private static Set<FocusableNode> identitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }
}
