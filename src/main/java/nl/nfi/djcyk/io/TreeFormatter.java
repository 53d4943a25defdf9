package nl.nfi.djcyk.io;

import nl.nfi.djcyk.cyk.DerivationNode;

import java.util.ArrayList;
import java.util.List;

import static java.lang.String.join;

// indented text rendering, one variable per line, e.g.
//   S0
//     NP -> 'she'
//     VP
//       ...
public final class TreeFormatter {

    private static final String INDENT = "  ";

    private TreeFormatter() {
    }

    public static String format(final DerivationNode tree) {
        final List<String> lines = new ArrayList<>();
        format(tree, 0, lines);
        return join("\n", lines);
    }

    private static void format(final DerivationNode node, final int depth, final List<String> lines) {
        final String indent = INDENT.repeat(depth);
        if (node.isEpsilon()) {
            lines.add("%s%s -> ε".formatted(indent, node.symbol().name()));
        } else if (node.isTerminal()) {
            lines.add("%s'%s'".formatted(indent, node.symbol().name()));
        } else if (node.isPreterminal()) {
            lines.add("%s%s -> '%s'".formatted(indent, node.symbol().name(), node.children().get(0).symbol().name()));
        } else {
            lines.add(indent + node.symbol().name());
            node.children().forEach(child -> format(child, depth + 1, lines));
        }
    }
}
