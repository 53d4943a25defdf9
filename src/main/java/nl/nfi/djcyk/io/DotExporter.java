package nl.nfi.djcyk.io;

import nl.nfi.djcyk.cyk.DerivationNode;

import java.util.ArrayList;
import java.util.List;

import static java.lang.String.join;

// Graphviz DOT rendering of a derivation tree, top to bottom
public final class DotExporter {

    private static final String VARIABLE_STYLE = "shape=ellipse, style=filled, fillcolor=\"#cfe2f3\"";
    private static final String TERMINAL_STYLE = "shape=box, style=filled, fillcolor=\"#fff2cc\"";
    private static final String EPSILON_LABEL = "ε";

    private final boolean colorize;

    private DotExporter(final boolean colorize) {
        this.colorize = colorize;
    }

    public static DotExporter plain() {
        return new DotExporter(false);
    }

    public static DotExporter colored() {
        return new DotExporter(true);
    }

    public String export(final DerivationNode tree) {
        final List<String> lines = new ArrayList<>();
        lines.add("digraph ParseTree {");
        lines.add("  rankdir=TB;");
        lines.add("  node [shape=plaintext, fontsize=12];");
        emit(tree, new int[]{0}, lines);
        lines.add("}");
        return join("\n", lines) + "\n";
    }

    private String emit(final DerivationNode node, final int[] counter, final List<String> lines) {
        final String id = "n" + counter[0]++;
        lines.add(nodeLine(id, node.symbol().name(), !node.isTerminal()));
        if (node.isEpsilon()) {
            final String leaf = "n" + counter[0]++;
            lines.add(nodeLine(leaf, EPSILON_LABEL, false));
            lines.add("  %s -> %s;".formatted(id, leaf));
        }
        for (final DerivationNode child : node.children()) {
            final String childId = emit(child, counter, lines);
            lines.add("  %s -> %s;".formatted(id, childId));
        }
        return id;
    }

    private String nodeLine(final String id, final String label, final boolean variable) {
        if (!colorize) {
            return "  %s [label=\"%s\"];".formatted(id, escape(label));
        }
        return "  %s [label=\"%s\", %s];".formatted(id, escape(label), variable ? VARIABLE_STYLE : TERMINAL_STYLE);
    }

    private static String escape(final String label) {
        return label.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
