package nl.nfi.djcyk.normalize;

import nl.nfi.djcyk.grammar.Grammar;
import nl.nfi.djcyk.grammar.Production;
import nl.nfi.djcyk.grammar.Symbol;
import nl.nfi.djcyk.grammar.Symbol.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static nl.nfi.djcyk.normalize.SymbolClosures.nullable;

// replaces every body by all variants with any subset of its nullable occurrences left out,
// only the start variable keeps an epsilon production (when it is nullable)
final class RemoveEpsilonProductions implements NormalizationPhase {

    private static final Logger LOG = LoggerFactory.getLogger(RemoveEpsilonProductions.class);

    static final int LARGE_EXPANSION = 16;
    private static final int MAX_EXPANSION = Long.SIZE - 2;

    @Override
    public Grammar apply(final Grammar grammar) {
        final Set<Variable> nullable = nullable(grammar);
        final Variable start = grammar.start();

        final Grammar.Builder result = Grammar.builder()
                .start(start)
                .variables(grammar.variables())
                .terminals(grammar.terminals());

        for (final Map.Entry<Variable, Set<Production>> entry : grammar.productions().entrySet()) {
            final Variable head = entry.getKey();
            for (final Production body : entry.getValue()) {
                if (body.isEpsilon()) {
                    continue;
                }
                for (final Production variant : variants(head, body, nullable)) {
                    if (!variant.isEpsilon()) {
                        result.production(head, variant);
                    }
                }
            }
        }

        if (nullable.contains(start)) {
            result.production(start, Production.epsilon());
        }
        return result.build();
    }

    private static List<Production> variants(final Variable head, final Production body, final Set<Variable> nullable) {
        final List<Integer> positions = new ArrayList<>();
        for (int position = 0; position < body.length(); position++) {
            if (nullable.contains(body.symbolAt(position))) {
                positions.add(position);
            }
        }

        final int count = positions.size();
        if (count > MAX_EXPANSION) {
            throw new UnsupportedOperationException("Production %s -> %s has %d nullable occurrences, cannot expand 2^%d variants".formatted(head, body, count, count));
        }
        if (count > LARGE_EXPANSION) {
            LOG.warn("Production {} -> {} has {} nullable occurrences, expanding to {} variants", head, body, count, 1L << count);
        }

        final List<Production> variants = new ArrayList<>();
        for (long mask = 0; mask < 1L << count; mask++) {
            final List<Symbol> symbols = new ArrayList<>(body.length());
            int next = 0;
            for (int position = 0; position < body.length(); position++) {
                if (next < count && positions.get(next) == position) {
                    final boolean skip = (mask >> next & 1) == 1;
                    next++;
                    if (skip) {
                        continue;
                    }
                }
                symbols.add(body.symbolAt(position));
            }
            variants.add(new Production(symbols));
        }
        return variants;
    }
}
