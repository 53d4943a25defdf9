package nl.nfi.djcyk.grammar;

// a grammar that violates the model invariants, e.g. an undeclared start symbol or
// a production referencing an undeclared symbol
public final class MalformedGrammarException extends IllegalArgumentException {

    public MalformedGrammarException(final String message) {
        super(message);
    }
}
