package ai.dictsite.converter.pass;

import ai.dictsite.converter.rules.SenseRules;
import ai.dictsite.converter.tree.ClassPattern;
import ai.dictsite.converter.tree.Nodes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Restructures each top-level sense block into a section holding nested sense lists.
 *
 * <p>The direct children are walked in document order. Runs of sense items become list entries
 * sharing one {@code <ul>} placed where the run started; named blocks (notes, etymologies) and any
 * other content flush the current run and keep their position. Sense markup is irregular, so a
 * second stage then collects senses the walk did not reach (nested deeper, or not adjacent) into
 * trailing lists. Elements already turned into {@code <li>}, and senses nested inside one, stay
 * where they are.</p>
 */
public class SensePass implements RewritePass {

    private static final Logger LOGGER = LoggerFactory.getLogger(SensePass.class);

    private static final String SECTION_TAG = "section";
    private static final String PARAGRAPH_TAG = "p";
    private static final String LIST_TAG = "ul";
    private static final String ENTRY_TAG = "li";

    @Override
    public String name() {
        return "sense";
    }

    @Override
    public void apply(Element root) {
        for (Element sense : Nodes.snapshot(root, element -> element.hasClass(SenseRules.SENSE_BLOCK))) {
            renameUnlessLabel(sense, SECTION_TAG);
            markPartsOfSpeech(sense);
            arrangeChildren(sense);
            consolidateSenses(sense);
            consolidateSecondLevel(sense);
        }
    }

    private void renameUnlessLabel(Element element, String tag) {
        if (SenseRules.LABEL.matches(element)) {
            return;
        }
        element.tagName(tag);
    }

    private void markPartsOfSpeech(Element sense) {
        for (Element partOfSpeech : Nodes.snapshot(sense,
                element -> element != sense && element.hasClass(SenseRules.PART_OF_SPEECH))) {
            renameUnlessLabel(partOfSpeech, PARAGRAPH_TAG);
        }
    }

    void arrangeChildren(Element sense) {
        List<Element> pending = new ArrayList<>();
        for (Node child : new ArrayList<>(sense.childNodes())) {
            if (child instanceof TextNode text && text.isBlank()) {
                continue;
            }
            if (child instanceof Element element && isSenseItem(element)) {
                toListEntry(element);
                pending.add(element);
                continue;
            }
            flush(pending);
            if (child instanceof Element element) {
                renameNamedBlock(element);
            }
        }
        flush(pending);
    }

    private boolean isSenseItem(Element element) {
        if (!isUnconverted(element) || SenseRules.LABEL.matches(element)) {
            return false;
        }
        for (ClassPattern pattern : SenseRules.SENSE_ITEMS) {
            if (pattern.matches(element)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isUnconverted(Element element) {
        return !element.normalName().equals(ENTRY_TAG);
    }

    private void flush(List<Element> pending) {
        if (pending.isEmpty()) {
            return;
        }
        Element list = new Element(LIST_TAG);
        pending.get(0).before(list);
        for (Element entry : pending) {
            list.appendChild(entry);
        }
        pending.clear();
    }

    /**
     * Retags a sense item as {@code <li>}, splices its first definition into it and gathers its
     * own subsenses into a nested list.
     */
    private void toListEntry(Element item) {
        item.tagName(ENTRY_TAG);
        for (Element definition : Nodes.snapshot(item, SenseRules.FIRST_DEFINITION::matches)) {
            if (definition != item) {
                definition.unwrap();
                break;
            }
        }
        nestSubsenses(item);
    }

    private void nestSubsenses(Element item) {
        List<Element> subsenses = new ArrayList<>();
        for (Element child : item.children()) {
            if (SenseRules.SECOND_LEVEL_SUBSENSE.matches(child) && isUnconverted(child)) {
                subsenses.add(child);
            }
        }
        if (subsenses.isEmpty()) {
            return;
        }
        Element list = new Element(LIST_TAG);
        subsenses.get(0).before(list);
        for (Element subsense : subsenses) {
            Element entry = list.appendElement(ENTRY_TAG);
            Nodes.moveChildren(subsense, entry);
            subsense.remove();
        }
    }

    private void renameNamedBlock(Element element) {
        for (Map.Entry<String, String> block : SenseRules.NAMED_BLOCKS.entrySet()) {
            if (!element.hasClass(block.getKey())) {
                continue;
            }
            Set<String> renamed = new LinkedHashSet<>();
            for (String className : element.classNames()) {
                renamed.add(className.equals(block.getKey()) ? block.getValue() : className);
            }
            element.tagName(SECTION_TAG);
            element.classNames(renamed);
            return;
        }
    }

    void consolidateSenses(Element sense) {
        List<Element> cores = outermost(Nodes.snapshot(sense, element -> isStray(element, sense)
                && SenseRules.CORE.matches(element)));
        List<Element> subsenses = outermost(Nodes.snapshot(sense, element -> isStray(element, sense)
                && SenseRules.SUBSENSE.matches(element)));
        if (cores.isEmpty() && subsenses.isEmpty()) {
            return;
        }
        LOGGER.debug("Consolidating {} core and {} subsense blocks left outside sense lists", cores.size(), subsenses.size());

        Set<Element> consumed = Collections.newSetFromMap(new IdentityHashMap<>());
        Element list = new Element(LIST_TAG);
        for (Element core : cores) {
            List<Element> followers = new ArrayList<>();
            Element sibling = core.nextElementSibling();
            while (sibling != null && !SenseRules.CORE.matches(sibling)) {
                if (SenseRules.SUBSENSE.matches(sibling) && isUnconverted(sibling)) {
                    followers.add(sibling);
                }
                sibling = sibling.nextElementSibling();
            }

            Element entry = list.appendElement(ENTRY_TAG);
            Nodes.moveChildren(core, entry);
            core.remove();
            if (!followers.isEmpty()) {
                Element nested = entry.appendElement(LIST_TAG);
                for (Element follower : followers) {
                    Nodes.moveChildren(follower, nested.appendElement(ENTRY_TAG));
                    follower.remove();
                    consumed.add(follower);
                }
            }
        }
        for (Element subsense : subsenses) {
            if (consumed.contains(subsense)) {
                continue;
            }
            Nodes.moveChildren(subsense, list.appendElement(ENTRY_TAG));
            subsense.remove();
        }
        sense.appendChild(list);
    }

    void consolidateSecondLevel(Element sense) {
        List<Element> remaining = outermost(Nodes.snapshot(sense, element -> isStray(element, sense)
                && SenseRules.SECOND_LEVEL.matches(element)));
        if (remaining.isEmpty()) {
            return;
        }
        LOGGER.debug("Consolidating {} second-level senses left outside sense lists", remaining.size());
        Element list = new Element(LIST_TAG);
        for (Element secondLevel : remaining) {
            toListEntry(secondLevel);
            list.appendChild(secondLevel);
        }
        sense.appendChild(list);
    }

    /**
     * A sense left for consolidation: not yet an entry, not a label, and not already carried by an
     * entry of this sense block.
     */
    private static boolean isStray(Element element, Element sense) {
        if (element == sense || !isUnconverted(element) || SenseRules.LABEL.matches(element)) {
            return false;
        }
        for (Element ancestor = element.parent(); ancestor != null && ancestor != sense; ancestor = ancestor.parent()) {
            if (ancestor.normalName().equals(ENTRY_TAG)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Keeps only candidates that are not nested inside another candidate.
     */
    private static List<Element> outermost(List<Element> candidates) {
        if (candidates.size() < 2) {
            return candidates;
        }
        Set<Element> all = Collections.newSetFromMap(new IdentityHashMap<>());
        all.addAll(candidates);
        List<Element> result = new ArrayList<>();
        for (Element candidate : candidates) {
            boolean nested = false;
            for (Element ancestor = candidate.parent(); ancestor != null; ancestor = ancestor.parent()) {
                if (all.contains(ancestor)) {
                    nested = true;
                    break;
                }
            }
            if (!nested) {
                result.add(candidate);
            }
        }
        return result;
    }
}
