package nl.nfi.djcyk.normalize;

import nl.nfi.djcyk.grammar.Grammar;
import nl.nfi.djcyk.grammar.Production;
import nl.nfi.djcyk.grammar.Symbol.Variable;

import java.util.Map;
import java.util.Set;

import static nl.nfi.djcyk.normalize.SymbolClosures.unitClosure;

// A -> B chains are replaced by the non-unit productions of every B in the unit closure of A
final class RemoveUnitProductions implements NormalizationPhase {

    @Override
    public Grammar apply(final Grammar grammar) {
        final Map<Variable, Set<Variable>> closure = unitClosure(grammar);

        final Grammar.Builder result = Grammar.builder()
                .start(grammar.start())
                .variables(grammar.variables())
                .terminals(grammar.terminals());

        closure.forEach((head, targets) -> {
            for (final Variable target : targets) {
                for (final Production body : grammar.productionsOf(target)) {
                    if (!body.isUnit()) {
                        result.production(head, body);
                    }
                }
            }
        });
        return result.build();
    }
}
