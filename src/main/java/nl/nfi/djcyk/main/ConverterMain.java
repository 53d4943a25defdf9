package nl.nfi.djcyk.main;

import nl.nfi.djcyk.convert.CnfConverterCli;
import picocli.CommandLine;

public final class ConverterMain {

    public static void main(final String... args) {
        final int exitCode = new CommandLine(new CnfConverterCli()).execute(args);
        System.exit(exitCode);
    }
}
