package nl.nfi.djcyk.grammar;

import nl.nfi.djcyk.grammar.Symbol.Variable;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A grammar in Chomsky Normal Form. Every production is either {@code A -> B C} with two
 * variables, or {@code A -> a} with a single terminal. Only the start variable may have an
 * epsilon production, and the start variable never occurs on a right-hand side.
 */
public record CnfGrammar(Grammar grammar) {

    public CnfGrammar {
        violation(grammar).ifPresent(message -> {
            throw new MalformedGrammarException("Grammar is not in CNF: " + message);
        });
    }

    public static CnfGrammar of(final Grammar grammar) {
        return new CnfGrammar(grammar);
    }

    public static boolean isCnf(final Grammar grammar) {
        return violation(grammar).isEmpty();
    }

    public Variable start() {
        return grammar.start();
    }

    public boolean acceptsEmpty() {
        return grammar.productionsOf(grammar.start()).contains(Production.epsilon());
    }

    private static Optional<String> violation(final Grammar grammar) {
        final Variable start = grammar.start();
        for (final Map.Entry<Variable, Set<Production>> entry : grammar.productions().entrySet()) {
            final Variable head = entry.getKey();
            for (final Production body : entry.getValue()) {
                if (body.isEpsilon()) {
                    if (!head.equals(start)) {
                        return Optional.of("epsilon production on non-start variable %s".formatted(head));
                    }
                } else if (!body.isTerminal() && !body.isBinary()) {
                    return Optional.of("production %s -> %s".formatted(head, body));
                }
                if (body.references(start) && grammar.productionsOf(start).contains(Production.epsilon())) {
                    return Optional.of("start variable %s occurs in %s -> %s".formatted(start, head, body));
                }
            }
        }
        return Optional.empty();
    }
}
