package org.dxworks.fortranframe.rewrite;

import org.dxworks.fortranframe.model.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * Named prune passes applied one after another in insertion order. The order matters when
 * predicates overlap: removing assignments before empty loops lets loops emptied by the first
 * pass be dropped by the second.
 */
public class PruneSequence {

    private final List<Pass> passes = new ArrayList<>();
    private final Logger logger;

    public PruneSequence(Logger logger) {
        this.logger = logger;
    }

    public PruneSequence add(String name, Predicate<Node> predicate) {
        passes.add(new Pass(name, predicate));
        return this;
    }

    public List<String> passNames() {
        List<String> names = new ArrayList<>();
        for (Pass pass : passes) {
            names.add(pass.name);
        }
        return Collections.unmodifiableList(names);
    }

    /** @return total subtrees removed */
    public int apply(Node root) {
        int total = 0;
        for (Pass pass : passes) {
            int removed = TreePruner.prune(root, pass.predicate);
            logger.fine(() -> "Prune pass '" + pass.name + "' removed " + removed + " subtree(s)");
            total += removed;
        }
        return total;
    }

    private static final class Pass {
        final String name;
        final Predicate<Node> predicate;

        Pass(String name, Predicate<Node> predicate) {
            this.name = name;
            this.predicate = predicate;
        }
    }
}
