package nl.nfi.djcyk.io;

import nl.nfi.djcyk.cyk.CykParser;
import nl.nfi.djcyk.cyk.DerivationNode;
import nl.nfi.djcyk.normalize.CnfNormalizer;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static java.lang.String.join;
import static nl.nfi.djcyk.Grammars.load;
import static nl.nfi.djcyk.Grammars.v;
import static org.assertj.core.api.Assertions.assertThat;

class TreeFormatterTest {

    @Test
    void indentsChildren() throws IOException {
        final DerivationNode tree = CykParser.forGrammar(CnfNormalizer.standard().normalize(load("english.txt")))
                .parse(List.of("she", "eats", "a", "cake"))
                .derivation()
                .orElseThrow();

        assertThat(TreeFormatter.format(tree)).isEqualTo(join("\n",
                "S0",
                "  NP -> 'she'",
                "  VP",
                "    V -> 'eats'",
                "    NP",
                "      Det -> 'a'",
                "      N -> 'cake'"
        ));
    }

    @Test
    void epsilon() {
        assertThat(TreeFormatter.format(DerivationNode.epsilon(v("S0")))).isEqualTo("S0 -> ε");
    }
}
