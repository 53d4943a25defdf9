package nl.nfi.djcyk.main;

import nl.nfi.djcyk.parse.CykParserCli;
import picocli.CommandLine;

public final class ParserMain {

    public static void main(final String... args) {
        final int exitCode = new CommandLine(new CykParserCli()).execute(args);
        System.exit(exitCode);
    }
}
