package nl.nfi.djcyk.grammar;

import static java.util.Objects.requireNonNull;

// a grammar symbol, either a variable (non-terminal) or a terminal,
// the kind of a symbol is fixed by its type
public sealed interface Symbol permits Symbol.Variable, Symbol.Terminal {

    String name();

    static Variable variable(final String name) {
        return new Variable(name);
    }

    static Terminal terminal(final String text) {
        return new Terminal(text);
    }

    record Variable(String name) implements Symbol {

        public Variable {
            requireNonNull(name, "variable name");
            if (name.isBlank()) {
                throw new MalformedGrammarException("Variable name must not be blank");
            }
        }

        @Override
        public String toString() {
            return name;
        }
    }

    // text is the literal token, may contain whitespace
    record Terminal(String text) implements Symbol {

        public Terminal {
            requireNonNull(text, "terminal text");
            if (text.isEmpty()) {
                throw new MalformedGrammarException("Terminal text must not be empty");
            }
        }

        @Override
        public String name() {
            return text;
        }

        @Override
        public String toString() {
            return "'%s'".formatted(text);
        }
    }
}
