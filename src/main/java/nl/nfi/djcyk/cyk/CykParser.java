package nl.nfi.djcyk.cyk;

import nl.nfi.djcyk.cyk.Witness.Split;
import nl.nfi.djcyk.cyk.Witness.TerminalMatch;
import nl.nfi.djcyk.grammar.CnfGrammar;
import nl.nfi.djcyk.grammar.Production;
import nl.nfi.djcyk.grammar.Symbol.Terminal;
import nl.nfi.djcyk.grammar.Symbol.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cocke-Younger-Kasami recognizer for a grammar in Chomsky Normal Form.
 *
 * <p>The table is filled in increasing span length, a cell of length {@code l} only reads cells
 * of lengths {@code 1 .. l - 1}. Every witness is kept; within a cell, witnesses are appended in
 * order of split point, then left child, then right child (both in their cell's insertion order),
 * then head (in grammar order). Runs in O(n^3 |V|^2) time and O(n^2 |V|) space.
 *
 * <p>A parser holds no per-parse state and can be shared between threads.
 */
public final class CykParser {

    private static final Logger LOG = LoggerFactory.getLogger(CykParser.class);

    private final CnfGrammar grammar;
    // A -> a, indexed by a
    private final Map<String, List<TerminalRule>> terminalRules;
    // A -> B C, indexed by (B, C)
    private final Map<VariablePair, List<Variable>> binaryRules;

    private CykParser(final CnfGrammar grammar) {
        this.grammar = grammar;
        this.terminalRules = new LinkedHashMap<>();
        this.binaryRules = new LinkedHashMap<>();

        for (final Map.Entry<Variable, Set<Production>> entry : grammar.grammar().productions().entrySet()) {
            for (final Production body : entry.getValue()) {
                if (body.isTerminal()) {
                    final Terminal terminal = (Terminal) body.symbolAt(0);
                    terminalRules.computeIfAbsent(terminal.text(), t -> new ArrayList<>()).add(new TerminalRule(entry.getKey(), terminal));
                } else if (body.isBinary()) {
                    final VariablePair pair = new VariablePair((Variable) body.symbolAt(0), (Variable) body.symbolAt(1));
                    binaryRules.computeIfAbsent(pair, p -> new ArrayList<>()).add(entry.getKey());
                }
            }
        }
    }

    public static CykParser forGrammar(final CnfGrammar grammar) {
        return new CykParser(grammar);
    }

    /**
     * Rejection is a regular result, never an exception. An empty token sequence is accepted
     * iff the start variable has an epsilon production, no table cells exist in that case.
     */
    public ParseResult parse(final List<String> tokens) {
        final int n = tokens.size();
        final ParseTable table = ParseTable.forTokens(tokens);

        if (n == 0) {
            return new ParseResult(grammar.start(), grammar.acceptsEmpty(), table);
        }

        for (int start = 0; start < n; start++) {
            final Span span = Span.of(start, 1);
            for (final TerminalRule rule : terminalRules.getOrDefault(tokens.get(start), List.of())) {
                table.add(span, rule.head(), new TerminalMatch(rule.terminal()));
            }
        }

        for (int length = 2; length <= n; length++) {
            for (int start = 0; start + length <= n; start++) {
                final Span span = Span.of(start, length);
                for (int split = 1; split < length; split++) {
                    final Set<Variable> lefts = table.variables(span.left(split));
                    if (lefts.isEmpty()) {
                        continue;
                    }
                    final Set<Variable> rights = table.variables(span.right(split));
                    for (final Variable left : lefts) {
                        for (final Variable right : rights) {
                            for (final Variable head : binaryRules.getOrDefault(new VariablePair(left, right), List.of())) {
                                table.add(span, head, new Split(split, left, right));
                            }
                        }
                    }
                }
            }
        }

        final boolean accepted = table.contains(table.fullSpan(), grammar.start());
        LOG.debug("Parsed {} tokens: accepted {}, {} filled cells", n, accepted, table.filledCellCount());
        return new ParseResult(grammar.start(), accepted, table);
    }

    private record TerminalRule(Variable head, Terminal terminal) {
    }

    private record VariablePair(Variable left, Variable right) {
    }
}
