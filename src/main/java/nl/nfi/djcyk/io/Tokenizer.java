package nl.nfi.djcyk.io;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

// splits a sentence on whitespace, optionally lower-casing every token
public final class Tokenizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final boolean lowercase;

    private Tokenizer(final boolean lowercase) {
        this.lowercase = lowercase;
    }

    public static Tokenizer whitespace() {
        return new Tokenizer(false);
    }

    public Tokenizer lowercase(final boolean lowercase) {
        return new Tokenizer(lowercase);
    }

    public List<String> tokenize(final String sentence) {
        final String stripped = sentence.strip();
        if (stripped.isEmpty()) {
            return List.of();
        }
        final String normalized = lowercase ? stripped.toLowerCase(Locale.ROOT) : stripped;
        return List.of(WHITESPACE.split(normalized));
    }
}
