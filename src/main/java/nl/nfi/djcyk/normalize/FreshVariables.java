package nl.nfi.djcyk.normalize;

import nl.nfi.djcyk.grammar.Grammar;
import nl.nfi.djcyk.grammar.Symbol;
import nl.nfi.djcyk.grammar.Symbol.Variable;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

// hands out variable names that collide with neither a variable nor a terminal of the grammar,
// nor with a name handed out before
final class FreshVariables {

    private final Set<String> used;
    private final Map<String, Integer> counters;

    private FreshVariables(final Set<String> used) {
        this.used = used;
        this.counters = new HashMap<>();
    }

    static FreshVariables avoiding(final Grammar grammar) {
        final Set<String> used = new HashSet<>();
        grammar.variables().stream().map(Symbol::name).forEach(used::add);
        grammar.terminals().stream().map(Symbol::name).forEach(used::add);
        return new FreshVariables(used);
    }

    // base, base1, base2, ...
    Variable named(final String base) {
        String candidate = base;
        int suffix = 1;
        while (used.contains(candidate)) {
            candidate = base + suffix++;
        }
        used.add(candidate);
        return new Variable(candidate);
    }

    // prefix1, prefix2, ... monotonically increasing per prefix
    Variable numbered(final String prefix) {
        int counter = counters.getOrDefault(prefix, 1);
        String candidate = prefix + counter;
        while (used.contains(candidate)) {
            candidate = prefix + ++counter;
        }
        counters.put(prefix, counter + 1);
        used.add(candidate);
        return new Variable(candidate);
    }
}
