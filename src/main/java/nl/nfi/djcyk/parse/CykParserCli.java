package nl.nfi.djcyk.parse;

import nl.nfi.djcyk.common.Timers;
import nl.nfi.djcyk.common.Timers.Timed;
import nl.nfi.djcyk.common.ini.IniConfig;
import nl.nfi.djcyk.cyk.BatchParser;
import nl.nfi.djcyk.cyk.CykParser;
import nl.nfi.djcyk.cyk.DerivationNode;
import nl.nfi.djcyk.cyk.ParseResult;
import nl.nfi.djcyk.grammar.CnfGrammar;
import nl.nfi.djcyk.grammar.Grammar;
import nl.nfi.djcyk.io.DotExporter;
import nl.nfi.djcyk.io.GrammarReader;
import nl.nfi.djcyk.io.GrammarWriter;
import nl.nfi.djcyk.io.GraphvizRenderer;
import nl.nfi.djcyk.io.Tokenizer;
import nl.nfi.djcyk.io.TreeFiles;
import nl.nfi.djcyk.io.TreeFormatter;
import nl.nfi.djcyk.normalize.CnfNormalizer;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Model.CommandSpec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

import static java.nio.charset.StandardCharsets.UTF_8;
import static nl.nfi.djcyk.common.logger.LoggerConfigurator.LOG_DIRECTORY_PROPERTY;
import static picocli.CommandLine.Command;
import static picocli.CommandLine.ExitCode;
import static picocli.CommandLine.Option;
import static picocli.CommandLine.Parameters;
import static picocli.CommandLine.Spec;

@Command(name = "cyk_parser", description = "Converts a CFG to CNF and runs the CYK algorithm on a sentence")
public class CykParserCli implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "The file containing the context-free grammar")
    private String grammarPath;

    @Parameters(index = "1", arity = "0..1", description = "The sentence to parse, read from stdin when omitted")
    private String sentence;

    @Option(names = {"--tokens"}, arity = "0..*", description = "Tokens to parse, instead of tokenizing the sentence (ignores --lowercase)")
    private List<String> tokens;

    @Option(names = {"--lowercase"}, description = "Lower-case the sentence before tokenizing")
    private boolean lowercase = false;

    @Option(names = {"--show_cnf"}, description = "Print the CNF grammar")
    private boolean showCnf = false;

    @Option(names = {"--cnf_output"}, description = "Write the CNF grammar to the given file")
    private String cnfOutputPath = null;

    @Option(names = {"--tree_dot"}, description = "When accepted, export the parse tree as Graphviz DOT")
    private boolean treeDot = false;

    @Option(names = {"--tree_png"}, description = "When accepted, render the parse tree as PNG (requires Graphviz 'dot' on the PATH)")
    private boolean treePng = false;

    @Option(names = {"--no_tree"}, description = "Disable all parse tree file exports")
    private boolean noTree = false;

    @Option(names = {"--no_color"}, description = "Export parse trees in black and white")
    private boolean noColor = false;

    @Option(names = {"--output_directory"}, description = "Directory to write parse tree files to")
    private String outputDirectoryPath = null;

    @Option(names = {"--sentences"}, description = "File with one sentence per line, parsed in batch")
    private String sentencesPath = null;

    @Option(names = {"--thread_count"}, description = "Use <count> threads for batch parsing")
    private int threadCount = 1;

    @Option(names = {"--config"}, description = "INI file with tokenizer, grammar and output settings")
    private String configPath = null;

    @Option(names = {"--log_directory_path"}, description = "Directory where to store live and archived log files")
    private String logPath;

    @Override
    public Integer call() {
        if (logPath != null) {
            System.setProperty(LOG_DIRECTORY_PROPERTY, logPath);
        }

        final PrintWriter out = spec.commandLine().getOut();
        try {
            final ParserSettings settings = configPath == null
                    ? ParserSettings.defaults()
                    : ParserSettings.fromConfig(IniConfig.loadFrom(Paths.get(configPath)));

            final Grammar grammar = GrammarReader.standard()
                    .epsilonAliases(settings.epsilonAliases())
                    .read(Paths.get(grammarPath));
            final CnfGrammar cnf = CnfNormalizer.standard().normalize(grammar);

            if (cnfOutputPath != null) {
                GrammarWriter.write(cnf.grammar(), Paths.get(cnfOutputPath));
                out.printf("CNF grammar written to: %s%n", cnfOutputPath);
            }
            if (showCnf) {
                out.println("CNF grammar:");
                GrammarWriter.toLines(cnf.grammar()).forEach(out::println);
                out.println();
            }

            final CykParser parser = CykParser.forGrammar(cnf);
            final Tokenizer tokenizer = Tokenizer.whitespace().lowercase(lowercase || settings.lowercase());

            if (sentencesPath != null) {
                parseBatch(parser, tokenizer, out);
            } else {
                parseSentence(parser, tokenizer, settings, out);
            }
        } catch (final Throwable t) {
            LoggerFactory.getLogger(CykParserCli.class).error("Fatal error", t);
            spec.commandLine().getErr().println("Fatal error: " + t.getMessage());
            return ExitCode.SOFTWARE;
        } finally {
            out.flush();
        }

        return ExitCode.OK;
    }

    private void parseSentence(final CykParser parser, final Tokenizer tokenizer, final ParserSettings settings, final PrintWriter out) throws IOException, InterruptedException {
        final List<String> tokens = this.tokens != null && !this.tokens.isEmpty()
                ? List.copyOf(this.tokens)
                : tokenizer.tokenize(sentence != null ? sentence : new String(System.in.readAllBytes(), UTF_8));

        final Timed<ParseResult> timed = Timers.time(() -> parser.parse(tokens));
        final ParseResult result = timed.value();

        out.printf("Tokens: %s%n", tokens);
        out.printf("In language: %s%n", result.accepted() ? "YES" : "NO");
        out.printf("CYK time: %.6f s%n", timed.seconds());

        if (result.derivation().isEmpty()) {
            out.println("No parse tree, the sentence is not in the language.");
            return;
        }

        final DerivationNode tree = result.derivation().get();
        out.println("Parse tree:");
        out.println(TreeFormatter.format(tree));

        if (noTree || (!treeDot && !treePng)) {
            return;
        }

        final Path outputDirectory = outputDirectoryPath != null ? Paths.get(outputDirectoryPath) : settings.outputDirectory();
        Files.createDirectories(outputDirectory);
        final DotExporter exporter = !noColor && settings.colorize() ? DotExporter.colored() : DotExporter.plain();
        final String dot = exporter.export(tree);

        if (treeDot) {
            final Path dotPath = outputDirectory.resolve(TreeFiles.fileName(tokens, "dot"));
            Files.writeString(dotPath, dot, UTF_8);
            out.printf("Tree exported as DOT: %s%n", dotPath);
        }
        if (treePng) {
            final Path pngPath = outputDirectory.resolve(TreeFiles.fileName(tokens, "png"));
            GraphvizRenderer.onPath().renderPng(dot, pngPath);
            out.printf("Tree exported as PNG: %s%n", pngPath);
        }
    }

    private void parseBatch(final CykParser parser, final Tokenizer tokenizer, final PrintWriter out) throws IOException, InterruptedException {
        final List<List<String>> sentences;
        try (final var lines = Files.lines(Paths.get(sentencesPath), UTF_8)) {
            sentences = lines.filter(line -> !line.isBlank()).map(tokenizer::tokenize).toList();
        }

        final Timed<List<ParseResult>> timed = Timers.time(() -> BatchParser.using(parser).threadCount(threadCount).parseAll(sentences));

        long accepted = 0;
        for (final ParseResult result : timed.value()) {
            out.printf("%s\t%s%n", result.accepted() ? "YES" : "NO", String.join(" ", result.tokens()));
            if (result.accepted()) {
                accepted++;
            }
        }
        out.printf("Accepted %d of %d sentences, CYK time: %.6f s%n", accepted, sentences.size(), timed.seconds());
    }
}
