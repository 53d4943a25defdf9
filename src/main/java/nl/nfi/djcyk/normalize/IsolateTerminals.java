package nl.nfi.djcyk.normalize;

import nl.nfi.djcyk.grammar.Grammar;
import nl.nfi.djcyk.grammar.Production;
import nl.nfi.djcyk.grammar.Symbol;
import nl.nfi.djcyk.grammar.Symbol.Terminal;
import nl.nfi.djcyk.grammar.Symbol.Variable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

// a terminal inside a body of length > 1 is replaced by a variable T_x with the sole production T_x -> x,
// one such variable per terminal
final class IsolateTerminals implements NormalizationPhase {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^0-9A-Za-z]+");

    @Override
    public Grammar apply(final Grammar grammar) {
        final FreshVariables fresh = FreshVariables.avoiding(grammar);
        final Map<Terminal, Variable> replacements = new LinkedHashMap<>();

        final Grammar.Builder result = Grammar.builder()
                .start(grammar.start())
                .variables(grammar.variables())
                .terminals(grammar.terminals());

        for (final Map.Entry<Variable, Set<Production>> entry : grammar.productions().entrySet()) {
            for (final Production body : entry.getValue()) {
                if (body.length() <= 1) {
                    result.production(entry.getKey(), body);
                    continue;
                }
                final List<Symbol> symbols = new ArrayList<>(body.length());
                for (final Symbol symbol : body.symbols()) {
                    if (symbol instanceof Terminal terminal) {
                        symbols.add(replacements.computeIfAbsent(terminal, t -> fresh.named("T_" + slug(t.text()))));
                    } else {
                        symbols.add(symbol);
                    }
                }
                result.production(entry.getKey(), new Production(symbols));
            }
        }

        replacements.forEach((terminal, variable) -> result
                .variable(variable)
                .production(variable, terminal));
        return result.build();
    }

    static String slug(final String text) {
        final String slug = NON_ALPHANUMERIC.matcher(text).replaceAll("_");
        return slug.isEmpty() ? "sym" : slug;
    }
}
