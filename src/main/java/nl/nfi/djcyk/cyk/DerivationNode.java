package nl.nfi.djcyk.cyk;

import nl.nfi.djcyk.grammar.Symbol;
import nl.nfi.djcyk.grammar.Symbol.Terminal;
import nl.nfi.djcyk.grammar.Symbol.Variable;

import java.util.ArrayList;
import java.util.List;

/**
 * Node of a derivation tree over a CNF grammar. A variable node has either two variable
 * children ({@code A -> B C}) or a single terminal child ({@code A -> a}); terminal nodes are
 * leaves. The only other shape is a childless start variable, for an accepted empty input.
 */
public record DerivationNode(Symbol symbol, List<DerivationNode> children) {

    public DerivationNode {
        children = List.copyOf(children);
    }

    public static DerivationNode leaf(final Terminal terminal) {
        return new DerivationNode(terminal, List.of());
    }

    public static DerivationNode preterminal(final Variable variable, final Terminal terminal) {
        return new DerivationNode(variable, List.of(leaf(terminal)));
    }

    public static DerivationNode binary(final Variable variable, final DerivationNode left, final DerivationNode right) {
        return new DerivationNode(variable, List.of(left, right));
    }

    public static DerivationNode epsilon(final Variable start) {
        return new DerivationNode(start, List.of());
    }

    public boolean isTerminal() {
        return symbol instanceof Terminal;
    }

    public boolean isPreterminal() {
        return children.size() == 1 && children.get(0).isTerminal();
    }

    public boolean isEpsilon() {
        return symbol instanceof Variable && children.isEmpty();
    }

    // terminal leaves, left to right
    public List<String> yield() {
        final List<String> tokens = new ArrayList<>();
        collectYield(this, tokens);
        return tokens;
    }

    private static void collectYield(final DerivationNode node, final List<String> tokens) {
        if (node.symbol instanceof Terminal terminal) {
            tokens.add(terminal.text());
            return;
        }
        node.children.forEach(child -> collectYield(child, tokens));
    }

    // bracketed form, e.g. (S (NP 'she') (VP ...))
    @Override
    public String toString() {
        if (isTerminal()) {
            return symbol.toString();
        }
        final StringBuilder builder = new StringBuilder("(").append(symbol);
        children.forEach(child -> builder.append(' ').append(child));
        return builder.append(')').toString();
    }
}
