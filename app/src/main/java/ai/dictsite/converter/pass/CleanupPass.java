package ai.dictsite.converter.pass;

import ai.dictsite.converter.rules.CleanupRules;
import ai.dictsite.converter.tree.Nodes;
import java.util.LinkedHashSet;
import java.util.Set;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Final tidy-up: removes leftovers of the source vocabulary and normalises whitespace.
 *
 * <p>Steps run in a fixed order so that a second run finds nothing left to do: marker removal
 * happens before empty pruning, and unwrapping happens after it.</p>
 */
public class CleanupPass implements RewritePass {

    @Override
    public String name() {
        return "cleanup";
    }

    @Override
    public void apply(Element root) {
        removeBullets(root);
        convertHeadings(root);
        dropSourceMarkers(root);
        pruneEmpty(root);
        unwrapGenericWrappers(root);
        stripAttributes(root);
        spaceAfterEmphasis(root);
        trimTitles(root);
    }

    void removeBullets(Element root) {
        for (Element bullet : Nodes.snapshot(root, CleanupRules.BULLET::matches)) {
            if (bullet.childNodeSize() == 1 && bullet.childNode(0) instanceof TextNode text
                    && text.getWholeText().strip().equals(CleanupRules.BULLET_TEXT)) {
                bullet.remove();
            }
        }
    }

    void convertHeadings(Element root) {
        for (Element heading : Nodes.snapshot(root, CleanupRules.HEADING::matches)) {
            Element paragraph = new Element("p");
            Nodes.moveChildren(heading, paragraph);
            heading.replaceWith(paragraph);
        }
    }

    void dropSourceMarkers(Element root) {
        for (Element marker : Nodes.snapshot(root,
                element -> element != root && CleanupRules.DROPPED_TAGS.contains(element.normalName()))) {
            marker.remove();
        }
    }

    /**
     * Bottom-up so that a parent is judged after its children had their chance to go.
     */
    void pruneEmpty(Element root) {
        for (Element element : Nodes.postOrder(root)) {
            if (element == root || element.parent() == null) {
                continue;
            }
            if (Nodes.isEffectivelyEmpty(element, CleanupRules.PROTECTED_TAGS)) {
                element.remove();
            }
        }
    }

    void unwrapGenericWrappers(Element root) {
        for (Element wrapper : Nodes.innermostFirst(root, element -> element != root
                && CleanupRules.UNWRAPPED_TAGS.contains(element.normalName())
                && !Nodes.hasAnyClass(element, CleanupRules.RETAINED_CLASSES))) {
            wrapper.unwrap();
        }
    }

    void stripAttributes(Element root) {
        for (Element element : root.getAllElements()) {
            if (element.hasAttr("class")) {
                Set<String> kept = new LinkedHashSet<>();
                for (String className : element.classNames()) {
                    if (CleanupRules.RETAINED_CLASSES.contains(className)) {
                        kept.add(className);
                    }
                }
                if (kept.isEmpty()) {
                    element.removeAttr("class");
                } else {
                    element.classNames(kept);
                }
            }
            for (String attribute : CleanupRules.DROPPED_ATTRIBUTES) {
                element.removeAttr(attribute);
            }
        }
    }

    void spaceAfterEmphasis(Element root) {
        for (Element element : Nodes.snapshot(root, element -> CleanupRules.SPACED_TAGS.contains(element.normalName()))) {
            Node next = element.nextSibling();
            if (next instanceof TextNode text) {
                String value = text.getWholeText();
                if (!value.isEmpty() && Character.isLetter(value.codePointAt(0))) {
                    text.text(" " + value);
                }
            }
        }
    }

    void trimTitles(Element root) {
        for (String titleClass : CleanupRules.TITLE_CLASSES) {
            for (Element title : root.getElementsByClass(titleClass)) {
                if (title.childNodeSize() == 1 && title.childNode(0) instanceof TextNode text) {
                    String stripped = text.getWholeText().strip();
                    if (!stripped.equals(text.getWholeText())) {
                        text.text(stripped);
                    }
                }
            }
        }
    }
}
