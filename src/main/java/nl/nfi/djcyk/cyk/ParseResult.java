package nl.nfi.djcyk.cyk;

import nl.nfi.djcyk.grammar.Symbol.Variable;

import java.util.List;
import java.util.Optional;

public record ParseResult(Variable start, boolean accepted, ParseTable table) {

    public List<String> tokens() {
        return table.tokens();
    }

    // empty when rejected, a single epsilon node when the empty sequence was accepted
    public Optional<DerivationNode> derivation() {
        if (!accepted) {
            return Optional.empty();
        }
        if (table.size() == 0) {
            return Optional.of(DerivationNode.epsilon(start));
        }
        return Optional.of(TreeBuilder.buildTree(table, start, table.fullSpan()));
    }
}
