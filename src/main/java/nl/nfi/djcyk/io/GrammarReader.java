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
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Reads grammars in the textual format:
 * <pre>
 * # comment
 * Variables: S, NP, VP
 * Terminals: she, eats, "ice cream"
 * Start: S
 * Rules:
 * S -> NP VP
 * NP -> 'she' | "ice cream" | ε
 * </pre>
 * Quoted symbols are always terminals; bare symbols are variables when declared as such and
 * terminals otherwise. Format errors raise {@link GrammarFormatException}, semantic defects
 * (e.g. an undeclared terminal) are reported by the grammar model itself.
 */
public final class GrammarReader {

    public static final List<String> DEFAULT_EPSILON_ALIASES = List.of("ε", "epsilon", "EPSILON");

    private static final Pattern HEADER = Pattern.compile("^(Variables|Terminals|Start|Rules):(.*)$");

    private final Set<String> epsilonAliases;

    private GrammarReader(final Set<String> epsilonAliases) {
        this.epsilonAliases = epsilonAliases;
    }

    public static GrammarReader standard() {
        return new GrammarReader(new LinkedHashSet<>(DEFAULT_EPSILON_ALIASES));
    }

    public GrammarReader epsilonAliases(final Collection<String> epsilonAliases) {
        return new GrammarReader(new LinkedHashSet<>(epsilonAliases));
    }

    public Grammar read(final Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Grammar file does not exist: %s".formatted(path));
        }
        return parse(Files.readString(path, UTF_8));
    }

    public Grammar parse(final String text) {
        final List<Line> lines = new ArrayList<>();
        final String[] rawLines = text.split("\\R", -1);
        for (int index = 0; index < rawLines.length; index++) {
            final String line = rawLines[index].strip();
            if (!line.isEmpty() && !line.startsWith("#")) {
                lines.add(new Line(index + 1, line));
            }
        }
        if (lines.isEmpty()) {
            throw new GrammarFormatException("Grammar file is empty");
        }

        final Map<String, String> headers = new LinkedHashMap<>();
        int rulesStart = -1;
        for (int index = 0; index < lines.size(); index++) {
            final Line line = lines.get(index);
            final Matcher matcher = HEADER.matcher(line.text());
            if (!matcher.matches()) {
                throw new GrammarFormatException("Expected a header line (Variables/Terminals/Start/Rules)", line.number());
            }
            if (matcher.group(1).equals("Rules")) {
                rulesStart = index + 1;
                break;
            }
            headers.put(matcher.group(1), matcher.group(2).strip());
        }

        if (rulesStart < 0) {
            throw new GrammarFormatException("Missing 'Rules:' section");
        }
        if (!headers.containsKey("Variables") || !headers.containsKey("Terminals") || !headers.containsKey("Start")) {
            throw new GrammarFormatException("Headers Variables, Terminals and Start are required");
        }

        final Set<String> variableNames = new LinkedHashSet<>(splitList(headers.get("Variables")));
        final Set<String> terminalTexts = new LinkedHashSet<>(splitList(headers.get("Terminals")));
        final String startName = unquote(headers.get("Start"));
        if (!variableNames.contains(startName)) {
            throw new GrammarFormatException("Start symbol must be one of the declared variables: %s".formatted(startName));
        }

        final List<Line> rules = lines.subList(rulesStart, lines.size());
        if (rules.isEmpty()) {
            throw new GrammarFormatException("Rules section is empty");
        }

        final Grammar.Builder builder = Grammar.builder().start(new Variable(startName));
        variableNames.forEach(name -> builder.variable(new Variable(name)));
        terminalTexts.forEach(terminalText -> builder.terminal(new Terminal(terminalText)));

        for (final Line rule : rules) {
            final int arrow = rule.text().indexOf("->");
            if (arrow < 0) {
                throw new GrammarFormatException("Invalid rule, missing '->': %s".formatted(rule.text()), rule.number());
            }
            final String head = rule.text().substring(0, arrow).strip();
            if (!variableNames.contains(head)) {
                throw new GrammarFormatException("'%s' is not a declared variable".formatted(head), rule.number());
            }

            final List<List<Token>> alternatives = splitAlternatives(rule.text().substring(arrow + 2), rule.number());
            if (alternatives.isEmpty()) {
                throw new GrammarFormatException("Rule without alternatives for '%s'".formatted(head), rule.number());
            }
            for (final List<Token> alternative : alternatives) {
                builder.production(new Variable(head), toProduction(alternative, variableNames));
            }
        }

        return builder.build();
    }

    private Production toProduction(final List<Token> alternative, final Set<String> variableNames) {
        if (alternative.size() == 1 && !alternative.get(0).quoted() && epsilonAliases.contains(alternative.get(0).text())) {
            return Production.epsilon();
        }
        final List<Symbol> symbols = new ArrayList<>(alternative.size());
        for (final Token token : alternative) {
            symbols.add(!token.quoted() && variableNames.contains(token.text())
                    ? new Variable(token.text())
                    : new Terminal(token.text()));
        }
        return new Production(symbols);
    }

    // comma separated, an entry starting with a quote runs to its closing quote and may contain commas
    private static List<String> splitList(final String text) {
        final List<String> entries = new ArrayList<>();
        final StringBuilder entry = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            final char c = text.charAt(i);
            if (c == ',') {
                addEntry(entries, entry);
                i++;
            } else if ((c == '"' || c == '\'') && entry.toString().isBlank()) {
                final int end = closingQuote(text, i);
                if (end < 0) {
                    throw new GrammarFormatException("Unterminated quoted symbol: %s".formatted(text.substring(i)));
                }
                entry.append(text, i, end + 1);
                i = end + 1;
            } else {
                entry.append(c);
                i++;
            }
        }
        addEntry(entries, entry);
        return entries;
    }

    private static void addEntry(final List<String> entries, final StringBuilder entry) {
        final String stripped = entry.toString().strip();
        if (!stripped.isEmpty()) {
            entries.add(unquote(stripped));
        }
        entry.setLength(0);
    }

    // whitespace separated symbols, unquoted '|' separates alternatives, empty alternatives are dropped
    private static List<List<Token>> splitAlternatives(final String text, final int lineNumber) {
        final List<List<Token>> alternatives = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            final char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '|') {
                if (!current.isEmpty()) {
                    alternatives.add(current);
                }
                current = new ArrayList<>();
                i++;
            } else if (c == '"' || c == '\'') {
                final int end = closingQuote(text, i);
                if (end < 0) {
                    throw new GrammarFormatException("Unterminated quoted symbol: %s".formatted(text.substring(i)), lineNumber);
                }
                current.add(new Token(unescape(text.substring(i + 1, end)), true));
                i = end + 1;
            } else {
                int j = i;
                while (j < text.length() && !Character.isWhitespace(text.charAt(j)) && text.charAt(j) != '|') {
                    j++;
                }
                current.add(new Token(text.substring(i, j), false));
                i = j;
            }
        }
        if (!current.isEmpty()) {
            alternatives.add(current);
        }
        return alternatives;
    }

    private static int closingQuote(final String text, final int open) {
        final char quote = text.charAt(open);
        for (int i = open + 1; i < text.length(); i++) {
            if (text.charAt(i) == '\\') {
                i++;
            } else if (text.charAt(i) == quote) {
                return i;
            }
        }
        return -1;
    }

    static String unquote(final String token) {
        if (token.length() >= 2 && token.charAt(0) == token.charAt(token.length() - 1) && (token.charAt(0) == '"' || token.charAt(0) == '\'')) {
            return unescape(token.substring(1, token.length() - 1));
        }
        return token;
    }

    static String unescape(final String text) {
        final StringBuilder builder = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c != '\\' || i == text.length() - 1) {
                builder.append(c);
                continue;
            }
            final char escaped = text.charAt(++i);
            switch (escaped) {
                case 'n' -> builder.append('\n');
                case 't' -> builder.append('\t');
                case 'r' -> builder.append('\r');
                case 'u' -> {
                    if (i + 4 >= text.length()) {
                        throw new GrammarFormatException("Incomplete unicode escape in: %s".formatted(text));
                    }
                    try {
                        builder.append((char) Integer.parseInt(text.substring(i + 1, i + 5), 16));
                    } catch (final NumberFormatException e) {
                        throw new GrammarFormatException("Invalid unicode escape in: %s".formatted(text));
                    }
                    i += 4;
                }
                default -> builder.append(escaped);
            }
        }
        return builder.toString();
    }

    private record Line(int number, String text) {
    }

    private record Token(String text, boolean quoted) {
    }
}
