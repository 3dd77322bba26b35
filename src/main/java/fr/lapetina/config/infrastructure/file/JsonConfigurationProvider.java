package fr.lapetina.config.infrastructure.file;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.config.domain.exception.ProviderLoadException;
import fr.lapetina.config.domain.model.ConfigurationData;
import fr.lapetina.config.domain.model.ConfigurationPath;

import java.io.IOException;
import java.io.Reader;
import java.util.Iterator;
import java.util.Map;

/**
 * Provider reading a JSON file.
 *
 * Object members become key segments and array elements are indexed from 0.
 * {@code null}, empty objects and empty arrays are stored as empty strings.
 */
public final class JsonConfigurationProvider extends FileConfigurationProvider {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public JsonConfigurationProvider(FileSource source) {
        super("Json", source);
    }

    @Override
    protected ConfigurationData parse(Reader reader) throws IOException {
        JsonNode root = MAPPER.readTree(reader);
        if (root == null || root.isMissingNode()) {
            return ConfigurationData.empty();
        }
        if (!root.isObject()) {
            throw new ProviderLoadException("Top-level JSON element must be an object. Instead, '"
                    + root.getNodeType() + "' was found.");
        }

        ConfigurationData.Builder data = ConfigurationData.builder();
        visitObject(root, null, data);
        return data.build();
    }

    private static void visitObject(JsonNode node, String path, ConfigurationData.Builder data) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            visit(field.getValue(), ConfigurationPath.child(path, field.getKey()), data);
        }
    }

    private static void visit(JsonNode node, String path, ConfigurationData.Builder data) {
        if (node.isObject() && !node.isEmpty()) {
            visitObject(node, path, data);
        } else if (node.isArray() && !node.isEmpty()) {
            for (int i = 0; i < node.size(); i++) {
                visit(node.get(i), ConfigurationPath.child(path, String.valueOf(i)), data);
            }
        } else {
            String value = node.isContainerNode() || node.isNull() ? "" : node.asText();
            if (!data.putIfAbsent(path, value)) {
                throw new ProviderLoadException("A duplicate key '" + path + "' was found.");
            }
        }
    }
}
