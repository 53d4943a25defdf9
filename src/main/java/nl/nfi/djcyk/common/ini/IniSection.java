package nl.nfi.djcyk.common.ini;

import java.util.List;

// view on one section of an IniConfig, with fallbacks for absent keys
public final class IniSection {

    private final IniConfig iniConfig;
    private final String section;

    private IniSection(final IniConfig iniConfig, final String section) {
        this.iniConfig = iniConfig;
        this.section = section;
    }

    static IniSection ofConfig(final IniConfig iniConfig, final String section) {
        return new IniSection(iniConfig, section);
    }

    public String getString(final String key, final String fallback) {
        return iniConfig.hasKey(section, key) ? iniConfig.getString(section, key) : fallback;
    }

    public boolean getBoolean(final String key, final boolean fallback) {
        return iniConfig.hasKey(section, key) ? iniConfig.getBoolean(section, key) : fallback;
    }

    public List<String> getStringList(final String key, final List<String> fallback) {
        return iniConfig.hasKey(section, key) ? iniConfig.getStringList(section, key) : fallback;
    }
}
