package ai.dictsite.converter.pass;

import ai.dictsite.converter.rules.BlockRule;
import ai.dictsite.converter.tree.Nodes;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gives grouped blocks (origin, derivatives, usage notes, phrase groups) their semantic container
 * class and turns their labels into titled paragraphs. A block without a title is still renamed.
 */
public class BlockRenamerPass implements RewritePass {

    private static final Logger LOGGER = LoggerFactory.getLogger(BlockRenamerPass.class);

    private final List<BlockRule> rules;

    public BlockRenamerPass(List<BlockRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    @Override
    public String name() {
        return "block-renamer";
    }

    @Override
    public void apply(Element root) {
        for (BlockRule rule : rules) {
            List<Element> containers = Nodes.snapshot(root, rule.container()::matches);
            if (!containers.isEmpty()) {
                LOGGER.debug("Renaming {} {} block(s)", containers.size(), rule.name());
            }
            for (Element container : containers) {
                rename(container, rule);
            }
        }
    }

    private void rename(Element container, BlockRule rule) {
        container.tagName(BlockRule.CONTAINER_TAG);
        container.classNames(new LinkedHashSet<>(rule.containerClasses()));

        for (Element descendant : Nodes.snapshot(container, element -> element != container)) {
            if (rule.title().isPresent() && rule.title().get().matches(descendant)) {
                descendant.tagName(BlockRule.TITLE_TAG);
                descendant.clearAttributes();
                descendant.addClass(rule.titleClass());
            } else if (rule.paragraph().isPresent() && rule.paragraph().get().matches(descendant)) {
                descendant.tagName(BlockRule.TITLE_TAG);
                descendant.clearAttributes();
            }
        }
    }
}
