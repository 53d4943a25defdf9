package nl.nfi.djcyk.cyk;

import nl.nfi.djcyk.grammar.Symbol.Variable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableSet;
import static java.util.Objects.checkIndex;

/**
 * Triangular CYK table over a token sequence of length n. The cell for span {@code (i, l)},
 * {@code 0 <= i < n} and {@code 1 <= l <= n - i}, holds the variables deriving
 * {@code tokens[i, i + l)}, each with every witness found for it, in insertion order.
 */
public final class ParseTable {

    private final List<String> tokens;
    private final Cell[][] cells;

    private ParseTable(final List<String> tokens) {
        this.tokens = List.copyOf(tokens);
        final int n = tokens.size();
        this.cells = new Cell[n][];
        for (int start = 0; start < n; start++) {
            // index 0 unused, lengths 1 .. n - start
            cells[start] = new Cell[n - start + 1];
            for (int length = 1; length <= n - start; length++) {
                cells[start][length] = new Cell();
            }
        }
    }

    static ParseTable forTokens(final List<String> tokens) {
        return new ParseTable(tokens);
    }

    public List<String> tokens() {
        return tokens;
    }

    public int size() {
        return tokens.size();
    }

    /**
     * The span covering every token. An empty input has no cells and therefore no full span,
     * use {@link ParseResult#derivation()} to get the epsilon derivation in that case.
     *
     * @throws IllegalStateException when the table was built for an empty token sequence
     */
    public Span fullSpan() {
        if (tokens.isEmpty()) {
            throw new IllegalStateException("Parse table of an empty token sequence has no full span");
        }
        return Span.of(0, tokens.size());
    }

    public Set<Variable> variables(final Span span) {
        return unmodifiableSet(cell(span).witnesses.keySet());
    }

    public boolean contains(final Span span, final Variable variable) {
        return cell(span).witnesses.containsKey(variable);
    }

    // first witness first, the order in which the parser found them
    public List<Witness> witnesses(final Span span, final Variable variable) {
        final List<Witness> witnesses = cell(span).witnesses.get(variable);
        return witnesses == null ? List.of() : unmodifiableList(witnesses);
    }

    public int filledCellCount() {
        int count = 0;
        for (final Cell[] row : cells) {
            for (int length = 1; length < row.length; length++) {
                if (!row[length].witnesses.isEmpty()) {
                    count++;
                }
            }
        }
        return count;
    }

    void add(final Span span, final Variable variable, final Witness witness) {
        cell(span).witnesses.computeIfAbsent(variable, v -> new ArrayList<>()).add(witness);
    }

    private Cell cell(final Span span) {
        checkIndex(span.start(), tokens.size());
        if (span.end() > tokens.size()) {
            throw new IndexOutOfBoundsException("Span %s exceeds %d tokens".formatted(span, tokens.size()));
        }
        return cells[span.start()][span.length()];
    }

    private static final class Cell {

        private final Map<Variable, List<Witness>> witnesses = new LinkedHashMap<>();
    }
}
