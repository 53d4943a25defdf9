package nl.nfi.djcyk.cyk;

import nl.nfi.djcyk.cyk.Witness.Split;
import nl.nfi.djcyk.cyk.Witness.TerminalMatch;
import nl.nfi.djcyk.grammar.Symbol.Variable;

import java.util.List;

/**
 * Reconstructs a derivation tree from the witnesses of a {@link ParseTable}. Where a cell holds
 * several witnesses for a variable, the first one (the first found by the parser) is used, so the
 * same table always yields the same tree.
 */
public final class TreeBuilder {

    private TreeBuilder() {
    }

    public static DerivationNode buildTree(final ParseTable table, final Variable variable, final Span span) {
        final List<Witness> witnesses = table.witnesses(span, variable);
        if (witnesses.isEmpty()) {
            throw new IllegalArgumentException("Variable %s does not derive span %s".formatted(variable, span));
        }

        final Witness witness = witnesses.get(0);
        if (witness instanceof TerminalMatch match) {
            return DerivationNode.preterminal(variable, match.terminal());
        }
        final Split split = (Split) witness;
        return DerivationNode.binary(
                variable,
                buildTree(table, split.left(), span.left(split.split())),
                buildTree(table, split.right(), span.right(split.split()))
        );
    }
}
