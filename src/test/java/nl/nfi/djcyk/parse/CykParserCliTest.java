package nl.nfi.djcyk.parse;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static nl.nfi.djcyk.Grammars.TEST_RESOURCES_PATH;
import static org.assertj.core.api.Assertions.assertThat;

class CykParserCliTest {

    private static final String ENGLISH = grammar("english.txt");

    @TempDir
    Path directory;

    private static String grammar(final String name) {
        return TEST_RESOURCES_PATH.resolve("grammars").resolve(name).toString();
    }

    private static Run run(final String... args) {
        final StringWriter out = new StringWriter();
        final StringWriter err = new StringWriter();
        final int exitCode = new CommandLine(new CykParserCli())
                .setOut(new PrintWriter(out))
                .setErr(new PrintWriter(err))
                .execute(args);
        return new Run(exitCode, out.toString(), err.toString());
    }

    private record Run(int exitCode, String out, String err) {
    }

    @Test
    void acceptedSentence() {
        final Run run = run(ENGLISH, "she eats a cake");

        assertThat(run.exitCode()).isZero();
        assertThat(run.out())
                .contains("Tokens: [she, eats, a, cake]")
                .contains("In language: YES")
                .contains("CYK time: ")
                .contains("Parse tree:")
                .contains("S0\n  NP -> 'she'\n  VP\n");
        assertThat(run.err()).isEmpty();
    }

    @Test
    void rejectedSentenceIsNotAnError() {
        final Run run = run(ENGLISH, "she cake eats");

        assertThat(run.exitCode()).isZero();
        assertThat(run.out())
                .contains("In language: NO")
                .contains("No parse tree, the sentence is not in the language.")
                .doesNotContain("Parse tree:");
    }

    @Test
    void lowercase() {
        assertThat(run(ENGLISH, "She EATS a Cake").out()).contains("In language: NO");
        assertThat(run(ENGLISH, "She EATS a Cake", "--lowercase").out()).contains("In language: YES");
    }

    @Test
    void explicitTokens() {
        final Run run = run(grammar("spaces.txt"), "--tokens", "ice cream", "with", "apple pie");

        assertThat(run.out())
                .contains("Tokens: [ice cream, with, apple pie]")
                .contains("In language: YES");
    }

    @Test
    void emptySentence() {
        assertThat(run(grammar("balanced.txt"), "").out())
                .contains("Tokens: []")
                .contains("In language: YES")
                .contains("S0 -> ε");
        assertThat(run(ENGLISH, "").out()).contains("In language: NO");
    }

    @Test
    void showAndWriteCnf() throws IOException {
        final Path cnf = directory.resolve("english.cnf");

        final Run run = run(ENGLISH, "she eats", "--show_cnf", "--cnf_output", cnf.toString());

        assertThat(run.out())
                .contains("CNF grammar written to: " + cnf)
                .contains("CNF grammar:")
                .contains("Start: S0")
                .contains("  S0 -> NP VP");
        assertThat(Files.readAllLines(cnf)).contains("  NP -> she | Det N");
    }

    @Test
    void exportsDot() throws IOException {
        final Run run = run(ENGLISH, "she eats the cake", "--tree_dot", "--output_directory", directory.toString());

        final Path dot = directory.resolve("she_eats_the_cake.dot");
        assertThat(run.out()).contains("Tree exported as DOT: " + dot);
        assertThat(Files.readString(dot))
                .startsWith("digraph ParseTree {")
                .contains("fillcolor");
    }

    @Test
    void exportsDotWithoutColor() throws IOException {
        run(ENGLISH, "she eats the cake", "--tree_dot", "--no_color", "--output_directory", directory.toString());

        assertThat(Files.readString(directory.resolve("she_eats_the_cake.dot"))).doesNotContain("fillcolor");
    }

    @Test
    void noTreeDisablesExports() {
        final Run run = run(ENGLISH, "she eats the cake", "--tree_dot", "--tree_png", "--no_tree", "--output_directory", directory.toString());

        assertThat(run.exitCode()).isZero();
        assertThat(run.out()).doesNotContain("Tree exported");
        assertThat(directory).isEmptyDirectory();
    }

    @Test
    void settingsFromConfig() throws IOException {
        final Path trees = directory.resolve("trees");
        final Path config = directory.resolve("cyk.ini");
        Files.writeString(config, """
                [TOKENIZER]
                lowercase = true
                [OUTPUT]
                colorize = false
                directory = %s
                """.formatted(trees));

        final Run run = run(ENGLISH, "SHE eats A cake", "--tree_dot", "--config", config.toString());

        assertThat(run.out()).contains("In language: YES");
        assertThat(Files.readString(trees.resolve("she_eats_a_cake.dot"))).doesNotContain("fillcolor");
    }

    @Test
    void batch() throws IOException {
        final Path sentences = directory.resolve("sentences.txt");
        Files.writeString(sentences, "she eats a cake\n\ncake she\nshe eats the cake\n");

        final Run run = run(ENGLISH, "--sentences", sentences.toString(), "--thread_count", "2");

        assertThat(run.exitCode()).isZero();
        assertThat(run.out())
                .contains("YES\tshe eats a cake")
                .contains("NO\tcake she")
                .contains("YES\tshe eats the cake")
                .contains("Accepted 2 of 3 sentences");
        assertThat(run.out().indexOf("a cake")).isLessThan(run.out().indexOf("cake she"));
    }

    @Test
    void missingGrammarFile() {
        final Run run = run(directory.resolve("missing.txt").toString(), "a");

        assertThat(run.exitCode()).isEqualTo(CommandLine.ExitCode.SOFTWARE);
        assertThat(run.err()).contains("Fatal error: Grammar file does not exist");
    }

    @Test
    void malformedGrammarFile() throws IOException {
        final Path grammar = directory.resolve("broken.txt");
        Files.writeString(grammar, "Variables: S\nTerminals: a\nStart: S\nRules:\nS a\n");

        final Run run = run(grammar.toString(), "a");

        assertThat(run.exitCode()).isEqualTo(CommandLine.ExitCode.SOFTWARE);
        assertThat(run.err()).contains("Fatal error: line 5: Invalid rule");
    }
}
