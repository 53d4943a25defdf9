package nl.nfi.djcyk.normalize;

import nl.nfi.djcyk.grammar.Grammar;
import nl.nfi.djcyk.grammar.Production;
import nl.nfi.djcyk.grammar.Symbol;
import nl.nfi.djcyk.grammar.Symbol.Terminal;
import nl.nfi.djcyk.grammar.Symbol.Variable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import static java.util.Collections.unmodifiableSet;

/**
 * Fixed-point set computations over a grammar. All of them iterate to a fixed point or drain a
 * worklist, so cyclic grammars (e.g. {@code A -> B, B -> A}) terminate.
 */
public final class SymbolClosures {

    private SymbolClosures() {
    }

    /**
     * Variables from which some terminal string (possibly empty) can be derived.
     */
    public static Set<Variable> generating(final Grammar grammar) {
        final Set<Variable> generating = new LinkedHashSet<>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (final Map.Entry<Variable, Set<Production>> entry : grammar.productions().entrySet()) {
                if (generating.contains(entry.getKey())) {
                    continue;
                }
                for (final Production body : entry.getValue()) {
                    if (body.symbols().stream().allMatch(symbol -> symbol instanceof Terminal || generating.contains(symbol))) {
                        generating.add(entry.getKey());
                        changed = true;
                        break;
                    }
                }
            }
        }
        return unmodifiableSet(generating);
    }

    /**
     * Variables reachable from the start variable, the start variable included.
     */
    public static Set<Variable> reachable(final Grammar grammar) {
        final Set<Variable> reachable = new LinkedHashSet<>();
        final Deque<Variable> frontier = new ArrayDeque<>();
        reachable.add(grammar.start());
        frontier.push(grammar.start());
        while (!frontier.isEmpty()) {
            final Variable current = frontier.pop();
            for (final Production body : grammar.productionsOf(current)) {
                for (final Symbol symbol : body.symbols()) {
                    if (symbol instanceof Variable variable && reachable.add(variable)) {
                        frontier.push(variable);
                    }
                }
            }
        }
        return unmodifiableSet(reachable);
    }

    /**
     * Variables that derive the empty string: a variable is nullable when it has an epsilon
     * production, or a production consisting of nullable variables only.
     */
    public static Set<Variable> nullable(final Grammar grammar) {
        final Set<Variable> nullable = new LinkedHashSet<>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (final Map.Entry<Variable, Set<Production>> entry : grammar.productions().entrySet()) {
                if (nullable.contains(entry.getKey())) {
                    continue;
                }
                for (final Production body : entry.getValue()) {
                    if (body.symbols().stream().allMatch(nullable::contains)) {
                        nullable.add(entry.getKey());
                        changed = true;
                        break;
                    }
                }
            }
        }
        return unmodifiableSet(nullable);
    }

    /**
     * For every variable, the variables reachable through chains of unit productions
     * {@code A -> B}, the variable itself included (transitive and reflexive closure).
     */
    public static Map<Variable, Set<Variable>> unitClosure(final Grammar grammar) {
        final Map<Variable, Set<Variable>> closure = new LinkedHashMap<>();
        for (final Variable head : grammar.variables()) {
            final Set<Variable> reachable = new LinkedHashSet<>();
            final Deque<Variable> stack = new ArrayDeque<>();
            reachable.add(head);
            stack.push(head);
            while (!stack.isEmpty()) {
                final Variable current = stack.pop();
                for (final Production body : grammar.productionsOf(current)) {
                    if (body.isUnit()) {
                        final Variable target = (Variable) body.symbolAt(0);
                        if (reachable.add(target)) {
                            stack.push(target);
                        }
                    }
                }
            }
            closure.put(head, unmodifiableSet(reachable));
        }
        return closure;
    }
}
