package ai.dictsite.converter.pass;

import ai.dictsite.converter.rules.StructureRules;
import ai.dictsite.converter.tree.Nodes;
import java.util.ArrayList;
import java.util.List;
import org.jsoup.nodes.Element;

/**
 * Pulls the element siblings following a group marker (up to the next marker) into the marker
 * and turns the marker into a {@code <section>}. Text between siblings stays where it is.
 */
public class GroupingPass implements RewritePass {

    @Override
    public String name() {
        return "grouping";
    }

    @Override
    public void apply(Element root) {
        for (Element marker : Nodes.snapshot(root, element -> element.hasClass(StructureRules.GROUP_MARKER))) {
            List<Element> followers = new ArrayList<>();
            Element sibling = marker.nextElementSibling();
            while (sibling != null && !sibling.hasClass(StructureRules.GROUP_MARKER)) {
                followers.add(sibling);
                sibling = sibling.nextElementSibling();
            }
            for (Element follower : followers) {
                marker.appendChild(follower);
            }
            marker.tagName(StructureRules.SECTION_TAG);
        }
    }
}
