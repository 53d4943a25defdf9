package nl.nfi.djcyk.grammar;

import nl.nfi.djcyk.grammar.Symbol.Terminal;
import nl.nfi.djcyk.grammar.Symbol.Variable;

import java.util.List;

import static java.lang.String.join;

// right-hand side of a rule, an empty body is an epsilon production
public record Production(List<Symbol> symbols) {

    private static final Production EPSILON = new Production(List.of());

    public Production {
        symbols = List.copyOf(symbols);
    }

    public static Production of(final Symbol... symbols) {
        return new Production(List.of(symbols));
    }

    public static Production epsilon() {
        return EPSILON;
    }

    public int length() {
        return symbols.size();
    }

    public Symbol symbolAt(final int position) {
        return symbols.get(position);
    }

    public boolean isEpsilon() {
        return symbols.isEmpty();
    }

    // A -> B
    public boolean isUnit() {
        return symbols.size() == 1 && symbols.get(0) instanceof Variable;
    }

    // A -> a
    public boolean isTerminal() {
        return symbols.size() == 1 && symbols.get(0) instanceof Terminal;
    }

    // A -> B C
    public boolean isBinary() {
        return symbols.size() == 2 && symbols.get(0) instanceof Variable && symbols.get(1) instanceof Variable;
    }

    public boolean references(final Symbol symbol) {
        return symbols.contains(symbol);
    }

    @Override
    public String toString() {
        return isEpsilon() ? "ε" : join(" ", symbols.stream().map(Symbol::toString).toList());
    }
}
