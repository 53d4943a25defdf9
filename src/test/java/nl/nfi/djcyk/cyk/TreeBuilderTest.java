package nl.nfi.djcyk.cyk;

import nl.nfi.djcyk.grammar.Grammar;
import nl.nfi.djcyk.normalize.CnfNormalizer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.util.List;

import static nl.nfi.djcyk.Grammars.allStrings;
import static nl.nfi.djcyk.Grammars.load;
import static nl.nfi.djcyk.Grammars.t;
import static nl.nfi.djcyk.Grammars.terminalTexts;
import static nl.nfi.djcyk.Grammars.v;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TreeBuilderTest {

    private static CykParser parser(final String name) throws IOException {
        return CykParser.forGrammar(CnfNormalizer.standard().normalize(load(name)));
    }

    @Test
    void englishSentence() throws IOException {
        final ParseResult result = parser("english.txt").parse(List.of("she", "eats", "a", "cake"));

        final DerivationNode tree = result.derivation().orElseThrow();

        assertThat(tree).hasToString("(S0 (NP 'she') (VP (V 'eats') (NP (Det 'a') (N 'cake'))))");
        assertThat(tree.yield()).containsExactly("she", "eats", "a", "cake");
    }

    @Test
    void treeFromOriginalStart() throws IOException {
        final ParseResult result = parser("english.txt").parse(List.of("she", "eats", "a", "cake"));

        final DerivationNode tree = TreeBuilder.buildTree(result.table(), v("S"), result.table().fullSpan());

        assertThat(tree.symbol()).isEqualTo(v("S"));
        assertThat(tree.children()).hasSize(2);
        assertThat(tree.children().get(0)).isEqualTo(DerivationNode.preterminal(v("NP"), t("she")));
        assertThat(tree.children().get(1)).hasToString("(VP (V 'eats') (NP (Det 'a') (N 'cake')))");
    }

    @Test
    void firstWitnessDecidesAmbiguity() throws IOException {
        final CykParser ambiguous = parser("ambiguous.txt");
        final List<String> tokens = List.of("a", "a", "a");

        final DerivationNode tree = ambiguous.parse(tokens).derivation().orElseThrow();

        assertThat(tree).hasToString("(S0 (S 'a') (S (S 'a') (S 'a')))");
        assertThat(ambiguous.parse(tokens).derivation()).contains(tree);
    }

    @ParameterizedTest(name = "{0} up to {1} tokens")
    @CsvSource({
            "english.txt,4",
            "balanced.txt,6",
            "mixed.txt,4",
            "ambiguous.txt,6",
    })
    void yieldEqualsTokensForEveryAcceptedSentence(final String name, final int maxLength) throws IOException {
        final Grammar grammar = load(name);
        final CykParser parser = CykParser.forGrammar(CnfNormalizer.standard().normalize(grammar));

        for (final List<String> tokens : allStrings(terminalTexts(grammar), maxLength)) {
            final ParseResult result = parser.parse(tokens);
            if (result.accepted()) {
                assertThat(result.derivation()).hasValueSatisfying(tree -> assertThat(tree.yield()).isEqualTo(tokens));
            }
        }
    }

    @Test
    void everyVariableNodeIsBinaryOrPreterminal() throws IOException {
        final DerivationNode tree = parser("mixed.txt").parse(List.of("a", "x", "b", "y", "a")).derivation().orElseThrow();

        assertShape(tree);
    }

    private static void assertShape(final DerivationNode node) {
        if (node.isTerminal()) {
            assertThat(node.children()).isEmpty();
            return;
        }
        if (!node.isPreterminal()) {
            assertThat(node.children()).hasSize(2).noneMatch(DerivationNode::isTerminal);
        }
        node.children().forEach(TreeBuilderTest::assertShape);
    }

    @Test
    void variableNotInCell() throws IOException {
        final ParseResult result = parser("english.txt").parse(List.of("she", "eats", "a", "cake"));

        assertThatThrownBy(() -> TreeBuilder.buildTree(result.table(), v("VP"), result.table().fullSpan()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("VP");
    }

    @Test
    void epsilonDerivation() throws IOException {
        final DerivationNode tree = parser("balanced.txt").parse(List.of()).derivation().orElseThrow();

        assertThat(tree.isEpsilon()).isTrue();
        assertThat(tree.symbol()).isEqualTo(v("S0"));
        assertThat(tree.yield()).isEmpty();
    }
}
