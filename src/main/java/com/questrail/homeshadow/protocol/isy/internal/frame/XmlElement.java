package com.questrail.homeshadow.protocol.isy.internal.frame;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * XmlElement
 * -----------------------------------------------------------------------------
 * Immutable, parser-independent view of one element of an event-stream frame.
 *
 * <p>
 * Names have any namespace prefix removed ({@code s:Envelope} becomes
 * {@code Envelope}). {@code text} is the trimmed concatenation of the element's
 * own text nodes.
 * </p>
 */
public record XmlElement(String name, Map<String, String> attributes, String text, List<XmlElement> children)
{
    public XmlElement {
        Objects.requireNonNull(name, "name");
        attributes = Map.copyOf(Objects.requireNonNull(attributes, "attributes"));
        Objects.requireNonNull(text, "text");
        children = List.copyOf(Objects.requireNonNull(children, "children"));
    }

    public Optional<XmlElement> child(String childName) {
        for (XmlElement c : children) {
            if (c.name.equals(childName)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    public boolean hasChild(String childName) {
        return child(childName).isPresent();
    }

    /**
     * Text of the named child; empty when the child is absent.
     */
    public Optional<String> childText(String childName) {
        return child(childName).map(XmlElement::text);
    }

    public Optional<String> attribute(String attributeName) {
        return Optional.ofNullable(attributes.get(attributeName));
    }

    /**
     * Depth-first search for the first element named {@code elementName},
     * this element included.
     */
    public Optional<XmlElement> find(String elementName) {
        if (name.equals(elementName)) {
            return Optional.of(this);
        }
        for (XmlElement c : children) {
            Optional<XmlElement> found = c.find(elementName);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }
}
