package org.dxworks.fortranframe.rewrite;

import org.dxworks.fortranframe.model.Node;

import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Removes whole subtrees. Traversal is pre-order: a node is tested before its descendants,
 * and the descendants of a removed node are never tested. The root itself is never removed.
 */
public final class TreePruner {

    private TreePruner() {}

    /**
     * @return number of subtrees removed
     */
    public static int prune(Node root, Predicate<Node> predicate) {
        int removed = 0;
        for (List<Node> sequence : root.childSequences()) {
            Iterator<Node> it = sequence.iterator();
            while (it.hasNext()) {
                Node child = it.next();
                if (predicate.test(child)) {
                    it.remove();
                    removed++;
                } else {
                    removed += prune(child, predicate);
                }
            }
        }
        return removed;
    }
}
