package nl.nfi.djcyk.io;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TreeFilesTest {

    @Test
    void joinsTokens() {
        assertThat(TreeFiles.fileName(List.of("she", "eats", "a", "cake"), "png")).isEqualTo("she_eats_a_cake.png");
    }

    @Test
    void replacesPathCharacters() {
        assertThat(TreeFiles.fileName(List.of("a/b", "c\\d", "e.f"), "dot")).isEqualTo("a_b_c_d_e_f.dot");
    }

    @Test
    void emptyInput() {
        assertThat(TreeFiles.fileName(List.of(), "dot")).isEqualTo("epsilon.dot");
    }

    @Test
    void truncatesLongNames() {
        final String name = TreeFiles.fileName(List.of("x".repeat(40), "y".repeat(40)), "png");

        assertThat(name).isEqualTo("x".repeat(40) + "_" + "y".repeat(9) + ".png");
    }
}
