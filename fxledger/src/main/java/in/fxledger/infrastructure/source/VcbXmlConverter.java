package in.fxledger.infrastructure.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;

/**
 * Converts the VCB XML rate sheet into the JSON shape stored in snapshots.
 *
 * Mapping:
 * - attributes become {@code "@_name"} fields
 * - text of an element with attributes or children becomes {@code "#text"}
 * - a text-only element becomes a plain string
 * - repeated child elements become an array
 */
public final class VcbXmlConverter {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    static final String ATTRIBUTE_PREFIX = "@_";
    static final String TEXT_FIELD = "#text";

    public JsonNode convert(String xml) throws IOException {
        Document doc;
        try {
            DocumentBuilder builder = newFactory().newDocumentBuilder();
            doc = builder.parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException | SAXException e) {
            throw new IOException("Invalid XML: " + e.getMessage(), e);
        }
        Element root = doc.getDocumentElement();
        ObjectNode result = NODES.objectNode();
        result.set(root.getTagName(), convertElement(root));
        return result;
    }

    private JsonNode convertElement(Element element) {
        ObjectNode node = NODES.objectNode();
        NamedNodeMap attributes = element.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Node attr = attributes.item(i);
            node.put(ATTRIBUTE_PREFIX + attr.getNodeName(), attr.getNodeValue());
        }

        StringBuilder text = new StringBuilder();
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                addChild(node, child.getNodeName(), convertElement((Element) child));
            } else if (child.getNodeType() == Node.TEXT_NODE || child.getNodeType() == Node.CDATA_SECTION_NODE) {
                text.append(child.getNodeValue());
            }
        }

        String trimmed = text.toString().trim();
        if (node.isEmpty()) {
            return NODES.textNode(trimmed);
        }
        if (!trimmed.isEmpty()) {
            node.put(TEXT_FIELD, trimmed);
        }
        return node;
    }

    private static void addChild(ObjectNode parent, String name, JsonNode value) {
        JsonNode existing = parent.get(name);
        if (existing == null) {
            parent.set(name, value);
        } else if (existing.isArray()) {
            ((ArrayNode) existing).add(value);
        } else {
            ArrayNode array = NODES.arrayNode();
            array.add(existing);
            array.add(value);
            parent.set(name, array);
        }
    }

    private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setExpandEntityReferences(false);
        factory.setNamespaceAware(false);
        return factory;
    }
}
