package fr.lapetina.config.tree;

import fr.lapetina.config.domain.provider.ConfigurationProvider;

import java.util.List;
import java.util.Optional;

/**
 * Renders a configuration root as an indented tree.
 *
 * Each line shows a key, followed by {@code =value (provider)} when a provider defines
 * a value for it, or {@code :} when it only groups children.
 */
public final class ConfigurationDebugView {

    private static final String INDENT = "  ";

    private ConfigurationDebugView() {
    }

    public static String format(ConfigurationRoot root) {
        StringBuilder out = new StringBuilder();
        appendChildren(out, root, root.getChildren(), "");
        return out.toString();
    }

    private static void appendChildren(StringBuilder out, ConfigurationRoot root,
                                       List<ConfigurationSection> children, String indent) {
        for (ConfigurationSection child : children) {
            out.append(indent).append(child.getKey());
            List<ConfigurationProvider> providers = root.getProviders();
            boolean found = false;
            for (int i = providers.size() - 1; i >= 0 && !found; i--) {
                ConfigurationProvider provider = providers.get(i);
                Optional<String> value = provider.get(child.getPath());
                if (value.isPresent()) {
                    out.append('=').append(value.get())
                            .append(" (").append(provider.getName()).append(')');
                    found = true;
                }
            }
            if (!found) {
                out.append(':');
            }
            out.append('\n');
            appendChildren(out, root, child.getChildren(), indent + INDENT);
        }
    }
}
