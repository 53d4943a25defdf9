package nl.nfi.djcyk.io;

import nl.nfi.djcyk.grammar.Grammar;
import nl.nfi.djcyk.grammar.Production;
import nl.nfi.djcyk.grammar.Symbol;
import nl.nfi.djcyk.grammar.Symbol.Terminal;
import nl.nfi.djcyk.grammar.Symbol.Variable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static java.lang.String.join;
import static java.nio.charset.StandardCharsets.UTF_8;

// writes a grammar in the format read by GrammarReader, sorted so that output is stable
public final class GrammarWriter {

    private static final Comparator<Production> ALTERNATIVE_ORDER = Comparator
            .comparingInt(Production::length)
            .thenComparing(GrammarWriter::formatBody);

    private GrammarWriter() {
    }

    public static List<String> toLines(final Grammar grammar) {
        final List<String> lines = new ArrayList<>();
        lines.add("Variables: " + join(", ", grammar.variables().stream().map(Variable::name).sorted().toList()));
        lines.add("Terminals: " + join(", ", grammar.terminals().stream().map(Terminal::text).sorted().map(GrammarWriter::quoteIfNeeded).toList()));
        lines.add("Start: " + grammar.start().name());
        lines.add("Rules:");

        grammar.productions().keySet().stream()
                .sorted(Comparator.comparing(Variable::name))
                .forEachOrdered(head -> lines.add("  %s -> %s".formatted(head.name(), join(" | ", grammar.productionsOf(head).stream()
                        .sorted(ALTERNATIVE_ORDER)
                        .map(GrammarWriter::formatBody)
                        .toList()))));
        return lines;
    }

    public static void write(final Grammar grammar, final Path path) throws IOException {
        Files.writeString(path, join("\n", toLines(grammar)) + "\n", UTF_8);
    }

    private static String formatBody(final Production body) {
        if (body.isEpsilon()) {
            return "ε";
        }
        return join(" ", body.symbols().stream().map(GrammarWriter::formatSymbol).toList());
    }

    private static String formatSymbol(final Symbol symbol) {
        return symbol instanceof Terminal terminal ? quoteIfNeeded(terminal.text()) : symbol.name();
    }

    private static String quoteIfNeeded(final String text) {
        final boolean plain = text.chars().noneMatch(c -> Character.isWhitespace(c) || c == '"' || c == '\'' || c == '\\' || c == '|' || c == ',')
                && !text.startsWith("#")
                && !text.contains("->")
                && !GrammarReader.DEFAULT_EPSILON_ALIASES.contains(text);
        if (plain) {
            return text;
        }
        final StringBuilder builder = new StringBuilder("\"");
        for (final char c : text.toCharArray()) {
            switch (c) {
                case '"' -> builder.append("\\\"");
                case '\\' -> builder.append("\\\\");
                case '\n' -> builder.append("\\n");
                case '\t' -> builder.append("\\t");
                case '\r' -> builder.append("\\r");
                default -> builder.append(c);
            }
        }
        return builder.append('"').toString();
    }
}
