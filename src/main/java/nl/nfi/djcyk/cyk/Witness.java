package nl.nfi.djcyk.cyk;

import nl.nfi.djcyk.grammar.Symbol.Terminal;
import nl.nfi.djcyk.grammar.Symbol.Variable;

// evidence that a variable derives the tokens of a span
public sealed interface Witness permits Witness.TerminalMatch, Witness.Split {

    // A -> a, with a the single token of a span of length 1
    record TerminalMatch(Terminal terminal) implements Witness {
    }

    // A -> B C, with B deriving [start, start + split) and C deriving [start + split, end)
    record Split(int split, Variable left, Variable right) implements Witness {
    }
}
