package fr.lapetina.config.infrastructure.file;

import fr.lapetina.config.domain.exception.ProviderLoadException;
import fr.lapetina.config.domain.model.ConfigurationData;
import fr.lapetina.config.domain.model.ConfigurationPath;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.nodes.AnchorNode;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;
import org.yaml.snakeyaml.nodes.Tag;

import java.io.Reader;
import java.util.List;

/**
 * Provider reading a YAML file.
 *
 * The document is composed into a node graph rather than constructed into Java objects,
 * so scalars keep their literal text ({@code 1.10} stays {@code "1.10"}).
 */
public final class YamlConfigurationProvider extends FileConfigurationProvider {

    public YamlConfigurationProvider(FileSource source) {
        super("Yaml", source);
    }

    @Override
    protected ConfigurationData parse(Reader reader) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Node root = yaml.compose(reader);
        if (root == null) {
            return ConfigurationData.empty();
        }
        Node top = unwrap(root);
        if (!(top instanceof MappingNode)) {
            throw new ProviderLoadException("Top-level YAML node must be a mapping. Instead, '"
                    + root.getNodeId() + "' was found.");
        }

        ConfigurationData.Builder data = ConfigurationData.builder();
        visitMapping((MappingNode) top, null, data);
        return data.build();
    }

    private static void visitMapping(MappingNode mapping, String path, ConfigurationData.Builder data) {
        for (NodeTuple tuple : mapping.getValue()) {
            Node key = unwrap(tuple.getKeyNode());
            if (!(key instanceof ScalarNode)) {
                throw new ProviderLoadException("Only scalar mapping keys are supported (line "
                        + (tuple.getKeyNode().getStartMark().getLine() + 1) + ")");
            }
            visit(tuple.getValueNode(), ConfigurationPath.child(path, ((ScalarNode) key).getValue()), data);
        }
    }

    private static void visit(Node node, String path, ConfigurationData.Builder data) {
        Node actual = unwrap(node);
        if (actual instanceof MappingNode && !((MappingNode) actual).getValue().isEmpty()) {
            visitMapping((MappingNode) actual, path, data);
        } else if (actual instanceof SequenceNode && !((SequenceNode) actual).getValue().isEmpty()) {
            List<Node> items = ((SequenceNode) actual).getValue();
            for (int i = 0; i < items.size(); i++) {
                visit(items.get(i), ConfigurationPath.child(path, String.valueOf(i)), data);
            }
        } else {
            String value = actual instanceof ScalarNode && !Tag.NULL.equals(actual.getTag())
                    ? ((ScalarNode) actual).getValue()
                    : "";
            if (!data.putIfAbsent(path, value)) {
                throw new ProviderLoadException("A duplicate key '" + path + "' was found.");
            }
        }
    }

    private static Node unwrap(Node node) {
        return node instanceof AnchorNode ? ((AnchorNode) node).getRealNode() : node;
    }
}
