package nl.nfi.djcyk.io;

import java.util.List;

import static java.lang.String.join;

// output file names derived from the parsed tokens
public final class TreeFiles {

    static final int MAX_BASE_NAME_LENGTH = 50;

    private TreeFiles() {
    }

    public static String fileName(final List<String> tokens, final String extension) {
        String baseName = tokens.isEmpty() ? "epsilon" : join("_", tokens)
                .replace("/", "_")
                .replace("\\", "_")
                .replace(".", "_");
        if (baseName.length() > MAX_BASE_NAME_LENGTH) {
            baseName = baseName.substring(0, MAX_BASE_NAME_LENGTH);
        }
        return "%s.%s".formatted(baseName, extension);
    }
}
