package nl.nfi.djcyk.normalize;

import nl.nfi.djcyk.grammar.CnfGrammar;
import nl.nfi.djcyk.grammar.Grammar;
import nl.nfi.djcyk.grammar.MalformedGrammarException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Converts a context-free grammar into an equivalent grammar in Chomsky Normal Form.
 *
 * <p>The phases run in a fixed order, each one relying on what the previous ones established:
 * <ol>
 *     <li>introduce a fresh start variable {@code S0 -> S}</li>
 *     <li>remove non-generating and unreachable variables</li>
 *     <li>remove epsilon productions (keeping {@code S0 -> ε} when the language contains ε)</li>
 *     <li>remove unit productions</li>
 *     <li>isolate terminals in long bodies, then binarize bodies longer than two</li>
 * </ol>
 * The input grammar is never modified.
 */
public final class CnfNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(CnfNormalizer.class);

    private final List<NormalizationPhase> phases;

    private CnfNormalizer(final List<NormalizationPhase> phases) {
        this.phases = phases;
    }

    public static CnfNormalizer standard() {
        return new CnfNormalizer(List.of(
                new IntroduceStart(),
                new RemoveUselessSymbols(),
                new RemoveEpsilonProductions(),
                new RemoveUnitProductions(),
                new IsolateTerminals(),
                new Binarize()
        ));
    }

    /**
     * @throws MalformedGrammarException when a phase produces a grammar that is not in CNF, which
     *                                   only happens for a grammar that violates the model invariants
     */
    public CnfGrammar normalize(final Grammar grammar) {
        LOG.debug("Normalizing grammar: {} variables, {} terminals, {} productions",
                grammar.variables().size(), grammar.terminals().size(), grammar.productionCount());

        Grammar current = grammar;
        for (final NormalizationPhase phase : phases) {
            current = phase.apply(current);
            LOG.debug("After {}: {} variables, {} productions", phase.name(), current.variables().size(), current.productionCount());
        }
        return CnfGrammar.of(current);
    }
}
