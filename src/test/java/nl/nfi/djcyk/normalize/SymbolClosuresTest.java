package nl.nfi.djcyk.normalize;

import nl.nfi.djcyk.grammar.Grammar;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static nl.nfi.djcyk.Grammars.load;
import static nl.nfi.djcyk.Grammars.parse;
import static nl.nfi.djcyk.Grammars.v;
import static org.assertj.core.api.Assertions.assertThat;

class SymbolClosuresTest {

    @Test
    void generatingExcludesSelfRecursiveWithoutBase() throws IOException {
        final Grammar grammar = load("useless.txt");

        assertThat(SymbolClosures.generating(grammar)).containsExactlyInAnyOrder(v("S"), v("A"), v("B"), v("D"));
    }

    @Test
    void reachableFromStart() throws IOException {
        final Grammar grammar = load("useless.txt");

        assertThat(SymbolClosures.reachable(grammar)).containsExactlyInAnyOrder(v("S"), v("A"), v("B"), v("C"));
    }

    @Test
    void nullableThroughChains() {
        final Grammar grammar = parse(
                "Variables: S, A, B, C",
                "Terminals: c",
                "Start: S",
                "Rules:",
                "S -> A B | c",
                "A -> ε",
                "B -> A A",
                "C -> c"
        );

        assertThat(SymbolClosures.nullable(grammar)).containsExactlyInAnyOrder(v("S"), v("A"), v("B"));
    }

    @Test
    void unitClosureOnCycle() {
        final Grammar grammar = parse(
                "Variables: S, A, B",
                "Terminals: a",
                "Start: S",
                "Rules:",
                "S -> A",
                "A -> B | a",
                "B -> A"
        );

        assertThat(SymbolClosures.unitClosure(grammar))
                .hasEntrySatisfying(v("S"), closure -> assertThat(closure).containsExactlyInAnyOrder(v("S"), v("A"), v("B")))
                .hasEntrySatisfying(v("A"), closure -> assertThat(closure).containsExactlyInAnyOrder(v("A"), v("B")))
                .hasEntrySatisfying(v("B"), closure -> assertThat(closure).containsExactlyInAnyOrder(v("A"), v("B")));
    }

    @Test
    void freshNamesAvoidVariablesAndTerminals() {
        final Grammar grammar = parse(
                "Variables: S, S0, X1",
                "Terminals: S01, X3",
                "Start: S",
                "Rules:",
                "S -> S0 | X1 | S01 | X3",
                "S0 -> S01",
                "X1 -> X3"
        );
        final FreshVariables fresh = FreshVariables.avoiding(grammar);

        assertThat(fresh.named("S0")).isEqualTo(v("S02"));
        assertThat(fresh.named("S0")).isEqualTo(v("S03"));
        assertThat(fresh.named("T_a")).isEqualTo(v("T_a"));
        assertThat(fresh.numbered("X")).isEqualTo(v("X2"));
        assertThat(fresh.numbered("X")).isEqualTo(v("X4"));
        assertThat(fresh.numbered("X")).isEqualTo(v("X5"));
    }
}
