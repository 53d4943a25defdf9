package nl.nfi.djcyk.parse;

import nl.nfi.djcyk.common.ini.IniConfig;
import nl.nfi.djcyk.common.ini.IniSection;
import nl.nfi.djcyk.io.GrammarReader;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

// defaults for the parser command, optionally read from an INI file:
//   [TOKENIZER]
//   lowercase = true
//   [GRAMMAR]
//   epsilon_aliases = ["ε", "epsilon", "EPSILON"]
//   [OUTPUT]
//   directory = trees
//   colorize = false
public record ParserSettings(boolean lowercase, List<String> epsilonAliases, Path outputDirectory, boolean colorize) {

    public static ParserSettings defaults() {
        return fromConfig(IniConfig.empty());
    }

    public static ParserSettings fromConfig(final IniConfig config) {
        final IniSection tokenizer = config.getSection("TOKENIZER");
        final IniSection grammar = config.getSection("GRAMMAR");
        final IniSection output = config.getSection("OUTPUT");

        return new ParserSettings(
                tokenizer.getBoolean("lowercase", false),
                grammar.getStringList("epsilon_aliases", GrammarReader.DEFAULT_EPSILON_ALIASES),
                Paths.get(output.getString("directory", ".")),
                output.getBoolean("colorize", true)
        );
    }
}
