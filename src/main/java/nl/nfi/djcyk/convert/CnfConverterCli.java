package nl.nfi.djcyk.convert;

import nl.nfi.djcyk.grammar.CnfGrammar;
import nl.nfi.djcyk.grammar.Grammar;
import nl.nfi.djcyk.io.GrammarReader;
import nl.nfi.djcyk.io.GrammarWriter;
import nl.nfi.djcyk.normalize.CnfNormalizer;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Model.CommandSpec;

import java.nio.file.Paths;
import java.util.concurrent.Callable;

import static picocli.CommandLine.Command;
import static picocli.CommandLine.ExitCode;
import static picocli.CommandLine.Option;
import static picocli.CommandLine.Spec;

@Command(name = "cnf_converter", description = "Converts a CFG to Chomsky Normal Form")
public class CnfConverterCli implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = {"--input"}, description = "The grammar file to convert", required = true)
    private String inputPath;

    @Option(names = {"--output"}, description = "The file to write the CNF grammar to (defaults to [inputPath].cnf)")
    private String outputPath = null;

    @Override
    public Integer call() {
        final String outputPath = this.outputPath == null
                ? inputPath + ".cnf"
                : this.outputPath;

        try {
            final Grammar grammar = GrammarReader.standard().read(Paths.get(inputPath));
            final CnfGrammar cnf = CnfNormalizer.standard().normalize(grammar);
            GrammarWriter.write(cnf.grammar(), Paths.get(outputPath));
            spec.commandLine().getOut().printf("CNF grammar written to: %s%n", outputPath);
        } catch (final Exception e) {
            LoggerFactory.getLogger(CnfConverterCli.class).error("Fatal error", e);
            spec.commandLine().getErr().println("Fatal error: " + e.getMessage());
            return ExitCode.SOFTWARE;
        } finally {
            spec.commandLine().getOut().flush();
        }

        return ExitCode.OK;
    }
}
