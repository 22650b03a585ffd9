package ai.dictsite.converter.tree;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jsoup.nodes.Element;

/**
 * Replaces an element by a chain of nested tags that holds the element's former content.
 */
public final class Wrappers {

    private Wrappers() {
    }

    /**
     * How the outermost tag of the chain is obtained.
     */
    public enum Strategy {
        /** A fresh element takes the original's place; the original is discarded. */
        REPLACE,
        /** The original element is retagged and stripped of its attributes, keeping its identity. */
        IN_PLACE
    }

    /**
     * Rewrites {@code element} into {@code tags.get(0) > tags.get(1) > ...} with the former content
     * moved into the innermost tag. {@code attributes} are set on every tag of the chain.
     *
     * @return the outermost element of the chain, attached where {@code element} was
     */
    public static Element wrap(Element element, List<String> tags, Map<String, String> attributes, Strategy strategy) {
        Objects.requireNonNull(element, "element");
        Objects.requireNonNull(strategy, "strategy");
        if (tags == null || tags.isEmpty()) {
            throw new IllegalArgumentException("At least one wrapper tag is required");
        }

        Element outermost;
        if (strategy == Strategy.IN_PLACE) {
            Element holder = new Element("span");
            Nodes.moveChildren(element, holder);
            element.clearAttributes();
            element.tagName(tags.get(0));
            applyAttributes(element, attributes);
            outermost = element;
            Element innermost = nest(outermost, tags, attributes);
            Nodes.moveChildren(holder, innermost);
        } else {
            outermost = new Element(tags.get(0));
            applyAttributes(outermost, attributes);
            Element innermost = nest(outermost, tags, attributes);
            Nodes.moveChildren(element, innermost);
            element.replaceWith(outermost);
        }
        return outermost;
    }

    private static Element nest(Element outermost, List<String> tags, Map<String, String> attributes) {
        Element current = outermost;
        for (String tag : tags.subList(1, tags.size())) {
            Element inner = current.appendElement(tag);
            applyAttributes(inner, attributes);
            current = inner;
        }
        return current;
    }

    private static void applyAttributes(Element target, Map<String, String> attributes) {
        if (attributes == null) {
            return;
        }
        attributes.forEach(target::attr);
    }
}
