package net.chalk.ast;

import net.chalk.print.CanonicalPrinter;

/**
 * Base class of all syntax tree nodes.
 * The set of node classes is closed: every subclass lives in this package,
 * and the renderers in net.chalk.print dispatch over all of them. Nodes are
 * immutable and own their children exclusively.
 */
public abstract class Node {

    Node() {}

    public String toString() {
        return CanonicalPrinter.render(this);
    }

    static <T> T checkNotNull(T value, String what) {
        if (value == null)
            throw new NullPointerException(what + " may not be null");
        return value;
    }

}
