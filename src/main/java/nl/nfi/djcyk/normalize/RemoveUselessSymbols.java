package nl.nfi.djcyk.normalize;

import nl.nfi.djcyk.grammar.Grammar;
import nl.nfi.djcyk.grammar.Production;
import nl.nfi.djcyk.grammar.Symbol;
import nl.nfi.djcyk.grammar.Symbol.Terminal;
import nl.nfi.djcyk.grammar.Symbol.Variable;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import static nl.nfi.djcyk.normalize.SymbolClosures.generating;
import static nl.nfi.djcyk.normalize.SymbolClosures.reachable;

// keeps the variables that are both generating and reachable, generating first:
// a production is only usable when all of its variables generate, and reachability
// is computed over usable productions only
final class RemoveUselessSymbols implements NormalizationPhase {

    @Override
    public Grammar apply(final Grammar grammar) {
        final Set<Variable> generating = generating(grammar);

        final Grammar.Builder productive = Grammar.builder()
                .start(grammar.start())
                .variable(grammar.start())
                .variables(generating)
                .terminals(grammar.terminals());
        for (final Map.Entry<Variable, Set<Production>> entry : grammar.productions().entrySet()) {
            if (!generating.contains(entry.getKey())) {
                continue;
            }
            for (final Production body : entry.getValue()) {
                if (usesOnly(body, generating)) {
                    productive.production(entry.getKey(), body);
                }
            }
        }
        final Grammar filtered = productive.build();

        final Set<Variable> useful = new LinkedHashSet<>(reachable(filtered));
        useful.retainAll(generating);

        final Grammar.Builder result = Grammar.builder()
                .start(grammar.start())
                .variable(grammar.start())
                .variables(useful);
        final Set<Terminal> referenced = new LinkedHashSet<>();
        for (final Variable head : useful) {
            for (final Production body : filtered.productionsOf(head)) {
                result.production(head, body);
                for (final Symbol symbol : body.symbols()) {
                    if (symbol instanceof Terminal terminal) {
                        referenced.add(terminal);
                    }
                }
            }
        }
        // declaration order of the input grammar
        grammar.terminals().stream().filter(referenced::contains).forEach(result::terminal);
        return result.build();
    }

    private static boolean usesOnly(final Production body, final Set<Variable> variables) {
        return body.symbols().stream().allMatch(symbol -> symbol instanceof Terminal || variables.contains(symbol));
    }
}
