package nl.nfi.djcyk.normalize;

import nl.nfi.djcyk.grammar.Grammar;
import nl.nfi.djcyk.grammar.Production;
import nl.nfi.djcyk.grammar.Symbol;
import nl.nfi.djcyk.grammar.Symbol.Variable;

import java.util.Map;
import java.util.Set;

// A -> B C D E becomes A -> B X1, X1 -> C X2, X2 -> D E
final class Binarize implements NormalizationPhase {

    static final String INTERMEDIATE_PREFIX = "X";

    @Override
    public Grammar apply(final Grammar grammar) {
        final FreshVariables fresh = FreshVariables.avoiding(grammar);

        final Grammar.Builder result = Grammar.builder()
                .start(grammar.start())
                .variables(grammar.variables())
                .terminals(grammar.terminals());

        for (final Map.Entry<Variable, Set<Production>> entry : grammar.productions().entrySet()) {
            for (final Production body : entry.getValue()) {
                if (body.length() <= 2) {
                    result.production(entry.getKey(), body);
                    continue;
                }
                Variable head = entry.getKey();
                for (int position = 0; position < body.length() - 2; position++) {
                    final Variable rest = fresh.numbered(INTERMEDIATE_PREFIX);
                    result.variable(rest).production(head, body.symbolAt(position), rest);
                    head = rest;
                }
                final Symbol left = body.symbolAt(body.length() - 2);
                final Symbol right = body.symbolAt(body.length() - 1);
                result.production(head, left, right);
            }
        }
        return result.build();
    }
}
