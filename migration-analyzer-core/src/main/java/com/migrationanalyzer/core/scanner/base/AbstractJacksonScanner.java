package com.migrationanalyzer.core.scanner.base;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Abstract base class for scanners that parse XML manifests using Jackson.
 *
 * <p>This class provides a pre-configured {@link XmlMapper} and utility methods for:
 * <ul>
 *   <li>Reading XML into a {@link JsonNode} tree</li>
 *   <li>JsonNode navigation and text extraction</li>
 *   <li>Normalizing repeated XML elements to arrays</li>
 * </ul>
 *
 * @see AbstractScanner
 */
public abstract class AbstractJacksonScanner extends AbstractScanner {

    /**
     * XML mapper for parsing XML files.
     * Thread-safe and reusable across parse operations.
     */
    protected final XmlMapper xmlMapper;

    /**
     * Constructor that initializes the XML mapper.
     */
    protected AbstractJacksonScanner() {
        super();
        this.xmlMapper = new XmlMapper();
    }

    // ==================== XML Parsing ====================

    /**
     * Parses an XML file into a JsonNode tree.
     *
     * @param file path to XML file
     * @return root JsonNode of parsed XML
     * @throws IOException if file cannot be read or parsed
     */
    protected JsonNode parseXml(Path file) throws IOException {
        String content = readFileContent(file);
        return xmlMapper.readTree(content);
    }

    // ==================== JsonNode Navigation Utilities ====================

    /**
     * Extracts a trimmed text value from a child node.
     *
     * @param node parent JsonNode
     * @param childName child element name
     * @return text content of child, or null if not found or blank
     */
    protected String extractText(JsonNode node, String childName) {
        if (node == null) {
            return null;
        }

        JsonNode childNode = node.get(childName);
        if (childNode == null || !childNode.isValueNode()) {
            return null;
        }

        String text = childNode.asText().trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * Safely gets a text value with a default fallback.
     *
     * @param node parent JsonNode
     * @param childName child element name
     * @param defaultValue value to return if the child is missing
     * @return text value or default
     */
    protected String extractText(JsonNode node, String childName, String defaultValue) {
        String text = extractText(node, childName);
        return text != null ? text : defaultValue;
    }

    /**
     * Normalizes a JsonNode to always be an array.
     *
     * <p>If the node is already an array, returns it as-is.
     * If the node is a single object, wraps it in an array.
     * Useful for handling XML elements that can appear once or multiple times.
     *
     * @param node JsonNode to normalize
     * @return array JsonNode
     */
    protected JsonNode normalizeToArray(JsonNode node) {
        if (node == null || node.isMissingNode() || !node.isContainerNode()) {
            return xmlMapper.createArrayNode();
        }
        if (node.isArray()) {
            return node;
        }
        return xmlMapper.createArrayNode().add(node);
    }
}
