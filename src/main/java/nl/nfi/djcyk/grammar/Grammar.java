package nl.nfi.djcyk.grammar;

import nl.nfi.djcyk.grammar.Symbol.Terminal;
import nl.nfi.djcyk.grammar.Symbol.Variable;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static java.util.Collections.unmodifiableMap;
import static java.util.Collections.unmodifiableSet;

// context-free grammar, immutable once built
// all collections keep insertion order so that enumeration over a grammar is deterministic
public final class Grammar {

    private final Set<Variable> variables;
    private final Set<Terminal> terminals;
    private final Variable start;
    private final Map<Variable, Set<Production>> productions;

    private Grammar(final Set<Variable> variables, final Set<Terminal> terminals, final Variable start, final Map<Variable, Set<Production>> productions) {
        this.variables = variables;
        this.terminals = terminals;
        this.start = start;
        this.productions = productions;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        final Builder builder = new Builder()
                .start(start)
                .variables(variables)
                .terminals(terminals);
        productions.forEach(builder::productions);
        return builder;
    }

    public Set<Variable> variables() {
        return variables;
    }

    public Set<Terminal> terminals() {
        return terminals;
    }

    public Variable start() {
        return start;
    }

    // only variables with at least one production are keys
    public Map<Variable, Set<Production>> productions() {
        return productions;
    }

    public Set<Production> productionsOf(final Variable variable) {
        return productions.getOrDefault(variable, Set.of());
    }

    public int productionCount() {
        return productions.values().stream().mapToInt(Set::size).sum();
    }

    // a grammar whose start symbol has no production generates no strings
    public boolean isEmpty() {
        return productionsOf(start).isEmpty();
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Grammar grammar)) {
            return false;
        }
        return variables.equals(grammar.variables)
                && terminals.equals(grammar.terminals)
                && start.equals(grammar.start)
                && productions.equals(grammar.productions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variables, terminals, start, productions);
    }

    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder();
        builder.append("Grammar(start = ").append(start).append(")");
        productions.forEach((head, bodies) -> {
            builder.append("\n  ").append(head).append(" ->");
            String separator = " ";
            for (final Production body : bodies) {
                builder.append(separator).append(body);
                separator = " | ";
            }
        });
        return builder.toString();
    }

    public static final class Builder {

        private final Set<Variable> variables = new LinkedHashSet<>();
        private final Set<Terminal> terminals = new LinkedHashSet<>();
        private final Map<Variable, Set<Production>> productions = new LinkedHashMap<>();
        private Variable start;

        private Builder() {
        }

        public Builder start(final Variable start) {
            this.start = start;
            return this;
        }

        public Builder variable(final Variable variable) {
            variables.add(variable);
            return this;
        }

        public Builder variables(final Collection<Variable> variables) {
            this.variables.addAll(variables);
            return this;
        }

        public Builder terminal(final Terminal terminal) {
            terminals.add(terminal);
            return this;
        }

        public Builder terminals(final Collection<Terminal> terminals) {
            this.terminals.addAll(terminals);
            return this;
        }

        // duplicates collapse
        public Builder production(final Variable head, final Production body) {
            productions.computeIfAbsent(head, h -> new LinkedHashSet<>()).add(body);
            return this;
        }

        public Builder production(final Variable head, final Symbol... body) {
            return production(head, Production.of(body));
        }

        public Builder productions(final Variable head, final Collection<Production> bodies) {
            bodies.forEach(body -> production(head, body));
            return this;
        }

        public Grammar build() {
            if (start == null) {
                throw new MalformedGrammarException("Grammar has no start symbol");
            }
            if (!variables.contains(start)) {
                throw new MalformedGrammarException("Start symbol is not a declared variable: %s".formatted(start));
            }
            final Set<String> variableNames = new LinkedHashSet<>();
            variables.forEach(variable -> variableNames.add(variable.name()));
            for (final Terminal terminal : terminals) {
                if (variableNames.contains(terminal.text())) {
                    throw new MalformedGrammarException("Name declared as both variable and terminal: %s".formatted(terminal.text()));
                }
            }

            final Map<Variable, Set<Production>> frozen = new LinkedHashMap<>();
            productions.forEach((head, bodies) -> {
                if (!variables.contains(head)) {
                    throw new MalformedGrammarException("Production head is not a declared variable: %s".formatted(head));
                }
                for (final Production body : bodies) {
                    for (final Symbol symbol : body.symbols()) {
                        final boolean declared = symbol instanceof Variable variable
                                ? variables.contains(variable)
                                : terminals.contains((Terminal) symbol);
                        if (!declared) {
                            throw new MalformedGrammarException("Production %s -> %s references undeclared symbol %s".formatted(head, body, symbol));
                        }
                    }
                }
                if (!bodies.isEmpty()) {
                    frozen.put(head, unmodifiableSet(new LinkedHashSet<>(bodies)));
                }
            });

            return new Grammar(
                    unmodifiableSet(new LinkedHashSet<>(variables)),
                    unmodifiableSet(new LinkedHashSet<>(terminals)),
                    start,
                    unmodifiableMap(frozen)
            );
        }
    }
}
