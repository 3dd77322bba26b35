package fr.lapetina.config.infrastructure.file;

import fr.lapetina.config.domain.exception.ProviderLoadException;
import fr.lapetina.config.domain.model.ConfigurationData;
import fr.lapetina.config.domain.model.ConfigurationPath;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;

/**
 * Provider reading an INI file.
 *
 * <pre>
 * ; comment
 * [Section:SubSection]
 * Key = "value"
 * </pre>
 *
 * Keys are prefixed with the enclosing section. A later key overrides an earlier one.
 */
public final class IniConfigurationProvider extends FileConfigurationProvider {

    public IniConfigurationProvider(FileSource source) {
        super("Ini", source);
    }

    @Override
    protected ConfigurationData parse(Reader reader) throws IOException {
        ConfigurationData.Builder data = ConfigurationData.builder();
        BufferedReader lines = reader instanceof BufferedReader
                ? (BufferedReader) reader
                : new BufferedReader(reader);
        String section = null;
        int lineNumber = 0;
        String line;

        while ((line = lines.readLine()) != null) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith(";") || trimmed.startsWith("#")) {
                continue;
            }

            if (trimmed.startsWith("[")) {
                if (!trimmed.endsWith("]")) {
                    throw new ProviderLoadException("Unterminated section header on line " + lineNumber
                            + ": '" + trimmed + "'");
                }
                section = trimmed.substring(1, trimmed.length() - 1).trim();
                continue;
            }

            int separator = trimmed.indexOf('=');
            if (separator < 0) {
                throw new ProviderLoadException("Unrecognized line format on line " + lineNumber
                        + ": '" + trimmed + "'");
            }

            String key = trimmed.substring(0, separator).trim();
            if (key.isEmpty()) {
                throw new ProviderLoadException("Missing key on line " + lineNumber);
            }
            data.put(ConfigurationPath.child(section, key), unquote(trimmed.substring(separator + 1).trim()));
        }
        return data.build();
    }

    private static String unquote(String value) {
        if (value.length() > 1 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
