package fr.lapetina.config.infrastructure.file;

import fr.lapetina.config.domain.exception.ProviderLoadException;
import fr.lapetina.config.domain.model.ConfigurationData;
import fr.lapetina.config.domain.model.ConfigurationPath;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.Reader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Provider reading an XML file.
 *
 * Mapping rules:
 * - The root element name is not part of the keys
 * - Child element names and attribute names become key segments
 * - A {@code name} attribute adds its value as an extra segment
 * - Siblings sharing the same name are indexed from 0
 * - Element text is the value of the element path
 *
 * Namespaces are not supported and a key defined twice is an error.
 */
public final class XmlConfigurationProvider extends FileConfigurationProvider {

    private static final String NAME_ATTRIBUTE = "name";

    public XmlConfigurationProvider(FileSource source) {
        super("Xml", source);
    }

    @Override
    protected ConfigurationData parse(Reader reader) {
        Element root = readDocument(reader);
        ConfigurationData.Builder data = ConfigurationData.builder();
        if (root != null) {
            List<String> prefix = new ArrayList<>();
            String name = root.attribute(NAME_ATTRIBUTE);
            if (name != null) {
                prefix.add(name);
            }
            flatten(root, prefix, data);
        }
        return data.build();
    }

    private static Element readDocument(Reader reader) {
        XMLInputFactory factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, true);

        XMLStreamReader xml = null;
        try {
            xml = factory.createXMLStreamReader(reader);
            Deque<Element> open = new ArrayDeque<>();
            Element root = null;

            while (xml.hasNext()) {
                switch (xml.next()) {
                    case XMLStreamConstants.START_ELEMENT:
                        Element element = startElement(xml);
                        if (open.isEmpty()) {
                            root = element;
                        } else {
                            open.peek().children.add(element);
                        }
                        open.push(element);
                        break;
                    case XMLStreamConstants.END_ELEMENT:
                        open.pop();
                        break;
                    case XMLStreamConstants.CHARACTERS:
                    case XMLStreamConstants.CDATA:
                        if (!open.isEmpty()) {
                            open.peek().text.append(xml.getText());
                        }
                        break;
                    default:
                        // comments, processing instructions and whitespace carry no data
                        break;
                }
            }
            return root;
        } catch (XMLStreamException e) {
            throw new ProviderLoadException("Invalid XML: " + e.getMessage(), e);
        } finally {
            if (xml != null) {
                try {
                    xml.close();
                } catch (XMLStreamException e) {
                    throw new ProviderLoadException("Failed to close XML reader", e);
                }
            }
        }
    }

    private static Element startElement(XMLStreamReader xml) {
        int line = xml.getLocation().getLineNumber();
        String elementPrefix = xml.getPrefix();
        if (xml.getNamespaceCount() > 0 || (elementPrefix != null && !elementPrefix.isEmpty())) {
            throw new ProviderLoadException("XML namespaces are not supported (line " + line + ")");
        }

        Element element = new Element(xml.getLocalName(), line);
        for (int i = 0; i < xml.getAttributeCount(); i++) {
            String prefix = xml.getAttributePrefix(i);
            if (prefix != null && !prefix.isEmpty()) {
                throw new ProviderLoadException("XML namespaces are not supported (line " + line + ")");
            }
            element.attributes.put(xml.getAttributeLocalName(i), xml.getAttributeValue(i));
        }
        return element;
    }

    private static void flatten(Element element, List<String> path, ConfigurationData.Builder data) {
        for (Map.Entry<String, String> attribute : element.attributes.entrySet()) {
            add(data, append(path, attribute.getKey()), attribute.getValue(), element.line);
        }

        String text = element.text.toString();
        if (!path.isEmpty() && !text.isBlank()) {
            add(data, path, text, element.line);
        }

        Map<String, Integer> siblingCounts = new LinkedHashMap<>();
        for (Element child : element.children) {
            siblingCounts.merge(ConfigurationPath.normalize(child.siblingName()), 1, Integer::sum);
        }

        Map<String, Integer> siblingIndexes = new LinkedHashMap<>();
        for (Element child : element.children) {
            List<String> childPath = append(path, child.name);
            String name = child.attribute(NAME_ATTRIBUTE);
            if (name != null) {
                childPath.add(name);
            }
            String siblingKey = ConfigurationPath.normalize(child.siblingName());
            if (siblingCounts.get(siblingKey) > 1) {
                int index = siblingIndexes.merge(siblingKey, 1, Integer::sum) - 1;
                childPath.add(String.valueOf(index));
            }
            flatten(child, childPath, data);
        }
    }

    private static void add(ConfigurationData.Builder data, List<String> path, String value, int line) {
        String key = ConfigurationPath.combine(path);
        if (!data.putIfAbsent(key, value)) {
            throw new ProviderLoadException("A duplicate key '" + key + "' was found (line " + line + ")");
        }
    }

    private static List<String> append(List<String> path, String segment) {
        List<String> result = new ArrayList<>(path.size() + 1);
        result.addAll(path);
        result.add(segment);
        return result;
    }

    private static final class Element {
        private final String name;
        private final int line;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private final List<Element> children = new ArrayList<>();
        private final StringBuilder text = new StringBuilder();

        private Element(String name, int line) {
            this.name = name;
            this.line = line;
        }

        private String attribute(String attributeName) {
            for (Map.Entry<String, String> attribute : attributes.entrySet()) {
                if (attribute.getKey().equalsIgnoreCase(attributeName)) {
                    return attribute.getValue();
                }
            }
            return null;
        }

        private String siblingName() {
            String nameAttribute = attribute(NAME_ATTRIBUTE);
            return nameAttribute == null ? name : name + ConfigurationPath.KEY_DELIMITER + nameAttribute;
        }
    }
}
