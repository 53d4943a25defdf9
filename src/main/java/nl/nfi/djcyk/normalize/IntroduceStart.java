package nl.nfi.djcyk.normalize;

import nl.nfi.djcyk.grammar.Grammar;
import nl.nfi.djcyk.grammar.Symbol.Variable;

// S0 -> S, with S0 the new start, so that the start never occurs on a right-hand side
final class IntroduceStart implements NormalizationPhase {

    static final String START_NAME = "S0";

    @Override
    public Grammar apply(final Grammar grammar) {
        final Variable start = FreshVariables.avoiding(grammar).named(START_NAME);
        return grammar.toBuilder()
                .variable(start)
                .start(start)
                .production(start, grammar.start())
                .build();
    }
}
