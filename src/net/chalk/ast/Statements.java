package net.chalk.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A non-empty sequence of statements.
 */
public final class Statements extends Node {

    private final List<Statement> items;

    public Statements(List<? extends Statement> items) {
        checkNotNull(items, "Statement list");
        if (items.isEmpty())
            throw new IllegalArgumentException(
                "Statement list may not be empty");
        List<Statement> copy = new ArrayList<Statement>(items);
        for (Statement st : copy) checkNotNull(st, "Statement");
        this.items = Collections.unmodifiableList(copy);
    }

    public boolean equals(Object other) {
        if (! (other instanceof Statements)) return false;
        return items.equals(((Statements) other).getItems());
    }

    public int hashCode() {
        return items.hashCode();
    }

    public List<Statement> getItems() {
        return items;
    }

    public int size() {
        return items.size();
    }

    public Statement get(int index) {
        return items.get(index);
    }

}
