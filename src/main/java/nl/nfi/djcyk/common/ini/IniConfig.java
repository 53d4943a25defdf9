package nl.nfi.djcyk.common.ini;

import org.json.JSONArray;
import org.json.JSONException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.Files.readAllLines;

// INI file with [SECTION] headers and 'key = value' entries, lists are JSON arrays, e.g.
//   [GRAMMAR]
//   epsilon_aliases = ["ε", "eps"]
public final class IniConfig {

    private final Map<String, Map<String, String>> sections;

    private IniConfig(final Map<String, Map<String, String>> sections) {
        this.sections = sections;
    }

    public static IniConfig empty() {
        return new IniConfig(Map.of());
    }

    public boolean hasSection(final String section) {
        return sections.containsKey(section);
    }

    public boolean hasKey(final String section, final String key) {
        return sections.containsKey(section) && sections.get(section).containsKey(key);
    }

    public IniSection getSection(final String section) {
        return IniSection.ofConfig(this, section);
    }

    public String getString(final String section, final String key) {
        if (!hasKey(section, key)) {
            throw new IllegalArgumentException("INI config does not contain key in given section: %s -> %s".formatted(section, key));
        }
        return sections.get(section).get(key);
    }

    public boolean getBoolean(final String section, final String key) {
        final String value = getString(section, key);
        if (!value.equalsIgnoreCase("true") && !value.equalsIgnoreCase("false")) {
            throw new IllegalArgumentException("INI config value is not a boolean: %s -> %s = %s".formatted(section, key, value));
        }
        return Boolean.parseBoolean(value);
    }

    public List<String> getStringList(final String section, final String key) {
        final String value = getString(section, key);
        try {
            return new JSONArray(value).toList().stream().map(String::valueOf).toList();
        } catch (final JSONException e) {
            throw new IllegalArgumentException("INI config value is not a JSON array: %s -> %s = %s".formatted(section, key, value), e);
        }
    }

    public static IniConfig loadFrom(final Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("INI config file path does not exist: %s".formatted(path));
        }

        final Map<String, Map<String, String>> sections = new LinkedHashMap<>();
        Map<String, String> section = null;
        int lineNumber = 0;
        for (final String rawLine : readAllLines(path, UTF_8)) {
            lineNumber++;
            final String line = rawLine.strip();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith(";")) {
                continue;
            }
            if (line.startsWith("[") && line.endsWith("]")) {
                section = sections.computeIfAbsent(line.substring(1, line.length() - 1).strip(), s -> new LinkedHashMap<>());
                continue;
            }
            if (section == null) {
                throw new IllegalArgumentException("INI config entry outside of a section at line %d: %s".formatted(lineNumber, path));
            }
            final int separator = line.indexOf('=');
            if (separator < 0) {
                section.put(line, "");
            } else {
                section.put(line.substring(0, separator).strip(), line.substring(separator + 1).strip());
            }
        }
        return new IniConfig(sections);
    }
}
