package nl.nfi.djcyk.io;

// textual grammar definition that cannot be read, line is 0 when not tied to a single line
public final class GrammarFormatException extends IllegalArgumentException {

    private final int line;

    public GrammarFormatException(final String message) {
        this(message, 0);
    }

    public GrammarFormatException(final String message, final int line) {
        super(line > 0 ? "line %d: %s".formatted(line, message) : message);
        this.line = line;
    }

    public int line() {
        return line;
    }
}
