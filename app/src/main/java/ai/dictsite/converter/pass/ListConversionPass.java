package ai.dictsite.converter.pass;

import ai.dictsite.converter.rules.StructureRules;
import ai.dictsite.converter.tree.Nodes;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.jsoup.nodes.Element;

/**
 * Turns flat phrase entries into lists.
 *
 * <p>Inside a sub-entry block every level-one item becomes a {@code <div>} whose level-two
 * children are gathered into a {@code <ul>} placed where the first of them stood. Phrase-level
 * second senses get their numbered subsenses collected into a {@code <ul>} right after the first
 * definition.</p>
 */
public class ListConversionPass implements RewritePass {

    private static final Set<String> SUB_ENTRY = Set.of(StructureRules.SUB_ENTRY_BLOCK);

    @Override
    public String name() {
        return "list-conversion";
    }

    @Override
    public void apply(Element root) {
        convertLevelOneItems(root);
        nestPhraseSubsenses(root);
    }

    void convertLevelOneItems(Element root) {
        List<Element> items = Nodes.snapshot(root, element -> element.hasClass(StructureRules.LEVEL_ONE_ITEM)
                && Nodes.hasAncestorWithAnyClass(element, SUB_ENTRY));
        for (Element item : items) {
            List<Element> entries = new ArrayList<>();
            for (Element child : item.children()) {
                if (!child.hasClass(StructureRules.LEVEL_TWO_ITEM)) {
                    continue;
                }
                if (!child.hasText() && child.childrenSize() == 0) {
                    child.remove();
                    continue;
                }
                entries.add(child);
            }
            if (!entries.isEmpty()) {
                Element list = new Element("ul");
                entries.get(0).before(list);
                for (Element entry : entries) {
                    list.appendElement("li").appendChild(entry);
                }
            }
            item.tagName(StructureRules.LEVEL_ONE_CONTAINER_TAG);
        }
    }

    void nestPhraseSubsenses(Element root) {
        for (Element secondLevel : Nodes.snapshot(root, element -> element.normalName().equals("span")
                && element.hasClass(StructureRules.PHRASE_SECOND_LEVEL))) {
            List<Element> subsenses = new ArrayList<>();
            for (Element child : secondLevel.children()) {
                if (StructureRules.PHRASE_SUBSENSE.matches(child)) {
                    subsenses.add(child);
                }
            }
            if (subsenses.isEmpty()) {
                continue;
            }

            Element list = new Element("ul");
            for (Element subsense : subsenses) {
                Element entry = list.appendElement("li");
                Nodes.moveChildren(subsense, entry);
                subsense.remove();
            }

            Element firstDefinition = null;
            for (Element child : secondLevel.children()) {
                if (StructureRules.PHRASE_FIRST_DEFINITION.matches(child)) {
                    firstDefinition = child;
                    break;
                }
            }
            if (firstDefinition != null) {
                firstDefinition.after(list);
            } else {
                secondLevel.appendChild(list);
            }
        }
    }
}
