package com.questrail.homeshadow.protocol.isy.codec.impl;

import com.questrail.homeshadow.protocol.isy.codec.EventDecodeException;
import com.questrail.homeshadow.protocol.isy.internal.frame.XmlElement;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses frame text into an {@link XmlElement} tree.
 *
 * <p>DOCTYPE declarations and external entities are rejected. A fresh
 * {@link DocumentBuilder} is used per frame since builders are not
 * thread-safe.</p>
 */
final class XmlFrameParser
{
    // Fail on errors without the parser's default stderr reporting.
    private static final ErrorHandler RETHROW = new ErrorHandler() {
        @Override
        public void warning(SAXParseException e) {
            // warnings do not affect the parse
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    };

    private final DocumentBuilderFactory factory;

    XmlFrameParser() {
        factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setExpandEntityReferences(false);
        factory.setXIncludeAware(false);
        try {
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
    }

    XmlElement parse(String frame) {
        if (frame == null || frame.isBlank()) {
            throw new EventDecodeException("Empty frame");
        }

        Document document;
        try {
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(RETHROW);
            document = builder.parse(new InputSource(new StringReader(frame.trim())));
        } catch (SAXException | IOException e) {
            throw new EventDecodeException("Malformed XML frame: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException(e);
        }

        return toElement(document.getDocumentElement());
    }

    private static XmlElement toElement(Element element) {
        Map<String, String> attributes = new LinkedHashMap<>();
        NamedNodeMap attrs = element.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Node attr = attrs.item(i);
            attributes.put(localName(attr.getNodeName()), attr.getNodeValue());
        }

        StringBuilder text = new StringBuilder();
        List<XmlElement> children = new ArrayList<>();
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            switch (node.getNodeType()) {
                case Node.ELEMENT_NODE:
                    children.add(toElement((Element) node));
                    break;
                case Node.TEXT_NODE:
                case Node.CDATA_SECTION_NODE:
                    text.append(node.getNodeValue());
                    break;
                default:
                    break;
            }
        }

        return new XmlElement(localName(element.getNodeName()), attributes, text.toString().trim(), children);
    }

    private static String localName(String qualified) {
        int colon = qualified.indexOf(':');
        return colon < 0 ? qualified : qualified.substring(colon + 1);
    }
}
