package com.ossinfo.core.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Abstract base class for readers of Maven repository XML documents.
 *
 * <p>Documents are parsed into Jackson trees with a shared {@link XmlMapper}; subclasses pick
 * the elements they need with the navigation helpers below. Unknown elements are ignored.
 *
 * @param <T> record produced from a document
 */
public abstract class AbstractXmlReader<T> {

    /**
     * XML mapper, thread-safe and reusable across documents.
     */
    protected static final XmlMapper XML_MAPPER = new XmlMapper();

    protected final Logger log = LoggerFactory.getLogger(getClass());

    /**
     * Reads a document.
     *
     * @param xml document text
     * @return mapped record
     * @throws ArtifactFetchException if the document is not well-formed or lacks required elements
     */
    public T read(String xml) throws ArtifactFetchException {
        JsonNode root;
        try {
            root = XML_MAPPER.readTree(xml);
        } catch (IOException e) {
            throw new ArtifactFetchException("Failed to parse " + documentName() + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ArtifactFetchException("Empty " + documentName());
        }
        return map(root);
    }

    /**
     * Maps the parsed root element.
     *
     * @param root root element
     * @return mapped record
     * @throws ArtifactFetchException if required elements are missing
     */
    protected abstract T map(JsonNode root) throws ArtifactFetchException;

    /**
     * Returns the document name used in error messages, e.g. "pom.xml".
     *
     * @return document name
     */
    protected abstract String documentName();

    /**
     * Extracts a text value from a child node.
     *
     * @param node parent node
     * @param childName child element name
     * @return trimmed text content of the child, or null if absent
     */
    protected String extractText(JsonNode node, String childName) {
        if (node == null) {
            return null;
        }
        JsonNode child = node.get(childName);
        if (child == null || child.isNull() || child.isContainerNode()) {
            return null;
        }
        return child.asText().trim();
    }

    /**
     * Extracts a required text value from a child node.
     *
     * @param node parent node
     * @param childName child element name
     * @return text content of the child
     * @throws ArtifactFetchException if the child is absent or blank
     */
    protected String requireText(JsonNode node, String childName) throws ArtifactFetchException {
        String text = extractText(node, childName);
        if (text == null || text.isEmpty()) {
            throw new ArtifactFetchException("Missing <" + childName + "> in " + documentName());
        }
        return text;
    }

    /**
     * Normalizes a node to always be an array.
     *
     * <p>XML elements that appear once parse as a single object, repeated elements as an
     * array.
     *
     * @param node node to normalize
     * @return array node
     */
    protected JsonNode normalizeToArray(JsonNode node) {
        if (node == null || node.isNull()) {
            return XML_MAPPER.createArrayNode();
        }
        if (node.isArray()) {
            return node;
        }
        return XML_MAPPER.createArrayNode().add(node);
    }
}
