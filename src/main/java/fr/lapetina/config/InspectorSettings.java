package fr.lapetina.config;

import java.util.Arrays;
import java.util.List;

/**
 * Options of the configuration inspector, bound from its command line.
 */
public class InspectorSettings {

    private String files = "";
    private String envPrefix;
    private OutputFormat format = OutputFormat.TREE;
    private String section;

    /**
     * Returns the comma separated configuration files, lowest priority first.
     */
    public String getFiles() {
        return files;
    }

    public void setFiles(String files) {
        this.files = files;
    }

    public List<String> getFileList() {
        return Arrays.stream(files.split(","))
                .map(String::trim)
                .filter(file -> !file.isEmpty())
                .toList();
    }

    public String getEnvPrefix() {
        return envPrefix;
    }

    public void setEnvPrefix(String envPrefix) {
        this.envPrefix = envPrefix;
    }

    public OutputFormat getFormat() {
        return format;
    }

    public void setFormat(OutputFormat format) {
        this.format = format;
    }

    public String getSection() {
        return section;
    }

    public void setSection(String section) {
        this.section = section;
    }

    public enum OutputFormat {
        /** Indented tree with the provider of every value. */
        TREE,
        /** One {@code key=value} line per value. */
        FLAT
    }
}
