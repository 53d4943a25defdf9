package nl.nfi.djcyk.normalize;

import nl.nfi.djcyk.grammar.Grammar;

// a single step of the CNF conversion, never mutates its input
@FunctionalInterface
public interface NormalizationPhase {

    Grammar apply(final Grammar grammar);

    default String name() {
        return getClass().getSimpleName();
    }
}
