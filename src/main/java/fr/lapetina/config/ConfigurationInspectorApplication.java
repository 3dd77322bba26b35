package fr.lapetina.config;

import fr.lapetina.config.binder.ConfigurationBinder;
import fr.lapetina.config.domain.exception.BindException;
import fr.lapetina.config.domain.exception.ConfigurationException;
import fr.lapetina.config.domain.exception.ReloadException;
import fr.lapetina.config.domain.model.PathMode;
import fr.lapetina.config.tree.Configuration;
import fr.lapetina.config.tree.ConfigurationRoot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;

/**
 * Command line tool printing the merged view of configuration files.
 *
 * <pre>
 * inspect -f appsettings.json,appsettings.prod.yaml [-e APP_] [--format flat] [-s Logging] [-- Key=Value ...]
 * </pre>
 *
 * Files are merged in the given order, then environment variables starting with the
 * prefix, then the overrides following {@code --}.
 */
public final class ConfigurationInspectorApplication {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationInspectorApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_LOAD_FAILURE = 2;

    private static final Map<String, String> SWITCH_MAPPINGS = Map.of(
            "-f", "Files",
            "-e", "EnvPrefix",
            "-s", "Section"
    );

    private final Map<String, String> environment;
    private final PrintStream out;
    private final PrintStream err;
    private final ConfigurationBinder binder = new ConfigurationBinder();

    public ConfigurationInspectorApplication(Map<String, String> environment, PrintStream out, PrintStream err) {
        this.environment = environment;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int status = new ConfigurationInspectorApplication(System.getenv(), System.out, System.err).run(args);
        System.exit(status);
    }

    /**
     * Runs the inspector.
     *
     * @return the process exit status
     */
    public int run(String[] args) {
        int separator = Arrays.asList(args).indexOf("--");
        String[] options = separator < 0 ? args : Arrays.copyOfRange(args, 0, separator);
        String[] overrides = separator < 0 ? new String[0] : Arrays.copyOfRange(args, separator + 1, args.length);

        InspectorSettings settings;
        try (ConfigurationRoot commandLine = new ConfigurationBuilder()
                .addCommandLine(options, SWITCH_MAPPINGS)
                .build()) {
            settings = binder.bind(commandLine, new InspectorSettings());
        } catch (BindException | ConfigurationException e) {
            err.println("Invalid options: " + e.getMessage());
            return EXIT_USAGE;
        }

        ConfigurationBuilder builder = new ConfigurationBuilder();
        for (String file : settings.getFileList()) {
            if (!addFile(builder, Path.of(file))) {
                err.println("Unsupported configuration file: " + file);
                return EXIT_USAGE;
            }
        }
        if (settings.getEnvPrefix() != null) {
            builder.addEnvironmentVariables(settings.getEnvPrefix(), environment);
        }
        builder.addCommandLine(overrides);

        try (ConfigurationRoot root = builder.build()) {
            print(root, settings);
            return EXIT_OK;
        } catch (ReloadException e) {
            log.debug("Configuration could not be loaded", e);
            err.println(e.getMessage());
            return EXIT_LOAD_FAILURE;
        }
    }

    private static boolean addFile(ConfigurationBuilder builder, Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".json")) {
            builder.addJsonFile(file);
        } else if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            builder.addYamlFile(file);
        } else if (name.endsWith(".ini")) {
            builder.addIniFile(file);
        } else if (name.endsWith(".xml")) {
            builder.addXmlFile(file);
        } else {
            return false;
        }
        return true;
    }

    private void print(ConfigurationRoot root, InspectorSettings settings) {
        if (settings.getFormat() == InspectorSettings.OutputFormat.TREE && settings.getSection() == null) {
            out.print(root.getDebugView());
            return;
        }

        Configuration scope = settings.getSection() == null ? root : root.getSection(settings.getSection());
        PathMode mode = settings.getSection() == null ? PathMode.ABSOLUTE : PathMode.RELATIVE;
        for (Map.Entry<String, String> entry : scope.iterate(mode)) {
            out.println(entry.getKey() + "=" + entry.getValue());
        }
    }
}
