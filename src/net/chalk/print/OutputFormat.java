package net.chalk.print;

import java.util.Locale;
import net.chalk.ast.Node;

public enum OutputFormat {

    TREE, CANONICAL, JSON;

    /**
     * Render node in this format.
     * The result always ends with a newline.
     */
    public String render(Node node, int indent) {
        switch (this) {
            case TREE:
                return new TreePrinter(indent).render(node);
            case CANONICAL:
                return CanonicalPrinter.render(node) + "\n";
            case JSON:
                return JsonPrinter.render(node, indent) + "\n";
            default:
                throw new AssertionError("This should not happen!");
        }
    }

    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static OutputFormat fromName(String name) {
        for (OutputFormat f : values()) {
            if (f.getName().equals(name.trim().toLowerCase(Locale.ROOT)))
                return f;
        }
        throw new IllegalArgumentException("Unknown output format " + name);
    }

}
