package ai.dictsite.converter.pass;

import ai.dictsite.converter.tree.Nodes;
import java.util.Objects;
import java.util.Set;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;

/**
 * Encloses the content of marked elements (regional labels by default) in square brackets.
 * Elements below an excluded ancestor are left untouched.
 */
public class BracketWrapPass implements RewritePass {

    /**
     * What follows the closing bracket.
     */
    public enum TrailingSpace {
        NONE(""),
        SPACE(" ");

        private final String suffix;

        TrailingSpace(String suffix) {
            this.suffix = suffix;
        }

        public String suffix() {
            return suffix;
        }
    }

    private final Set<String> targetClasses;
    private final Set<String> excludedAncestorClasses;
    private final TrailingSpace trailingSpace;

    public BracketWrapPass(Set<String> targetClasses, Set<String> excludedAncestorClasses, TrailingSpace trailingSpace) {
        this.targetClasses = Set.copyOf(Objects.requireNonNull(targetClasses, "targetClasses"));
        this.excludedAncestorClasses = Set.copyOf(Objects.requireNonNull(excludedAncestorClasses, "excludedAncestorClasses"));
        this.trailingSpace = Objects.requireNonNull(trailingSpace, "trailingSpace");
    }

    @Override
    public String name() {
        return "bracket-wrap";
    }

    @Override
    public void apply(Element root) {
        for (Element target : Nodes.snapshot(root, element -> Nodes.hasAnyClass(element, targetClasses))) {
            if (Nodes.hasAncestorWithAnyClass(target, excludedAncestorClasses)) {
                continue;
            }
            Nodes.trimEdgeWhitespace(target);
            Element wrapper = new Element("span");
            wrapper.appendChild(new TextNode("["));
            Nodes.moveChildren(target, wrapper);
            wrapper.appendChild(new TextNode("]" + trailingSpace.suffix()));
            target.appendChild(wrapper);
        }
    }
}
