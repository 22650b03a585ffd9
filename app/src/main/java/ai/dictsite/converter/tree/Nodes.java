package ai.dictsite.converter.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Tree operations shared by the rewrite passes.
 *
 * <p>Every traversal helper returns a list captured before the caller mutates anything, so a pass
 * may detach, rename or replace the returned elements without skipping or revisiting nodes.</p>
 */
public final class Nodes {

    private Nodes() {
    }

    /**
     * Returns the elements under {@code root} (root included) accepted by {@code filter}, in document order.
     */
    public static List<Element> snapshot(Element root, Predicate<Element> filter) {
        Objects.requireNonNull(root, "root");
        List<Element> matched = new ArrayList<>();
        for (Element element : root.getAllElements()) {
            if (filter.test(element)) {
                matched.add(element);
            }
        }
        return matched;
    }

    /**
     * Same as {@link #snapshot(Element, Predicate)} but in reverse document order, so nested matches
     * come before the elements that contain them.
     */
    public static List<Element> innermostFirst(Element root, Predicate<Element> filter) {
        List<Element> matched = snapshot(root, filter);
        Collections.reverse(matched);
        return matched;
    }

    /**
     * Returns every element under {@code root} with children listed before their parent.
     */
    public static List<Element> postOrder(Element root) {
        Objects.requireNonNull(root, "root");
        List<Element> order = new ArrayList<>();
        collectPostOrder(root, order);
        return order;
    }

    private static void collectPostOrder(Element element, List<Element> order) {
        for (Element child : element.children()) {
            collectPostOrder(child, order);
        }
        order.add(element);
    }

    /**
     * Moves all child nodes of {@code from} to the end of {@code to}, keeping their order.
     */
    public static void moveChildren(Element from, Element to) {
        for (Node child : new ArrayList<>(from.childNodes())) {
            to.appendChild(child);
        }
    }

    public static boolean hasAnyClass(Element element, Set<String> classes) {
        return !Collections.disjoint(element.classNames(), classes);
    }

    public static boolean hasAncestorWithAnyClass(Element element, Set<String> classes) {
        Element ancestor = element.parent();
        while (ancestor != null) {
            if (hasAnyClass(ancestor, classes)) {
                return true;
            }
            ancestor = ancestor.parent();
        }
        return false;
    }

    /**
     * An element is effectively empty when it is not protected, holds no visible text and every
     * child element is itself effectively empty.
     */
    public static boolean isEffectivelyEmpty(Element element, Set<String> protectedTags) {
        if (protectedTags.contains(element.normalName())) {
            return false;
        }
        for (Node child : element.childNodes()) {
            if (child instanceof TextNode text) {
                if (!text.isBlank()) {
                    return false;
                }
            } else if (child instanceof DataNode data) {
                if (!data.getWholeData().isBlank()) {
                    return false;
                }
            } else if (child instanceof Element nested) {
                if (!isEffectivelyEmpty(nested, protectedTags)) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Drops whitespace-only text leaves at both edges of {@code element} and strips the outer
     * whitespace of the text leaves left at the edges.
     */
    public static void trimEdgeWhitespace(Element element) {
        while (element.childNodeSize() > 0 && isBlankText(element.childNode(0))) {
            element.childNode(0).remove();
        }
        while (element.childNodeSize() > 0 && isBlankText(element.childNode(element.childNodeSize() - 1))) {
            element.childNode(element.childNodeSize() - 1).remove();
        }
        if (element.childNodeSize() == 0) {
            return;
        }
        if (element.childNode(0) instanceof TextNode first) {
            first.text(first.getWholeText().stripLeading());
        }
        if (element.childNode(element.childNodeSize() - 1) instanceof TextNode last) {
            last.text(last.getWholeText().stripTrailing());
        }
    }

    private static boolean isBlankText(Node node) {
        return node instanceof TextNode text && text.isBlank();
    }
}
