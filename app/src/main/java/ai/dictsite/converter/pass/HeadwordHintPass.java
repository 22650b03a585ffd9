package ai.dictsite.converter.pass;

import ai.dictsite.converter.rules.StructureRules;
import ai.dictsite.converter.tree.Nodes;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Shows the syllable break hint of a headword, e.g. {@code serendipity [ser|en¦dip|ity]}.
 * The hint is only used when it carries both break markers.
 */
public class HeadwordHintPass implements RewritePass {

    @Override
    public String name() {
        return "headword-hint";
    }

    @Override
    public void apply(Element root) {
        for (Element headword : Nodes.snapshot(root, element -> element.hasClass(StructureRules.HEADWORD))) {
            String hint = headword.attr(StructureRules.HEADWORD_BREAKS_ATTRIBUTE);
            if (!hint.contains("|") || !hint.contains("¦")) {
                continue;
            }
            for (Node child : headword.childNodes()) {
                if (child instanceof TextNode text && !text.isBlank()) {
                    text.after(new TextNode(" [" + hint + "]"));
                    break;
                }
            }
        }
    }
}
