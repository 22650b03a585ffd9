package ai.dictsite.converter.pass;

import ai.dictsite.converter.rules.InlineStyleRules;
import ai.dictsite.converter.rules.StyleRule;
import ai.dictsite.converter.tree.ClassPattern;
import ai.dictsite.converter.tree.Nodes;
import ai.dictsite.converter.tree.Wrappers;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jsoup.nodes.Element;

/**
 * Converts styled {@code <span>}s into semantic inline tags.
 *
 * <p>Spans are visited innermost first so replacing an outer span never detaches a span that is
 * still waiting to be processed. Composite rules are tried before single-class rules; among
 * single-class rules the first table entry whose class the span carries wins.</p>
 */
public class InlineStylePass implements RewritePass {

    private final String name;
    private final Map<ClassPattern, StyleRule> compositeRules;
    private final Map<String, StyleRule> classRules;
    private final Wrappers.Strategy strategy;
    private final boolean contextual;

    InlineStylePass(String name,
                    Map<ClassPattern, StyleRule> compositeRules,
                    Map<String, StyleRule> classRules,
                    Wrappers.Strategy strategy,
                    boolean contextual) {
        this.name = Objects.requireNonNull(name, "name");
        this.compositeRules = Objects.requireNonNull(compositeRules, "compositeRules");
        this.classRules = Objects.requireNonNull(classRules, "classRules");
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.contextual = contextual;
    }

    /**
     * Presentation classes ({@code bold}, {@code italic}, ...) plus the composite table.
     */
    public static InlineStylePass generic() {
        return new InlineStylePass("inline-style", InlineStyleRules.COMPOSITE, InlineStyleRules.GENERIC,
                Wrappers.Strategy.REPLACE, false);
    }

    /**
     * Dictionary-specific classes, including the example-sensitive grammar code rule.
     */
    public static InlineStylePass source() {
        return new InlineStylePass("source-style", Map.of(), InlineStyleRules.SOURCE,
                Wrappers.Strategy.IN_PLACE, true);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void apply(Element root) {
        for (Element span : Nodes.innermostFirst(root, element -> element.normalName().equals("span"))) {
            resolve(span).ifPresent(rule -> Wrappers.wrap(span, rule.tags(), rule.attributes(), strategy));
        }
    }

    Optional<StyleRule> resolve(Element span) {
        for (Map.Entry<ClassPattern, StyleRule> entry : compositeRules.entrySet()) {
            if (entry.getKey().matches(span)) {
                return Optional.of(entry.getValue());
            }
        }
        for (Map.Entry<String, StyleRule> entry : classRules.entrySet()) {
            if (!span.hasClass(entry.getKey())) {
                continue;
            }
            if (contextual && entry.getKey().equals(InlineStyleRules.CONTEXTUAL_CLASS)
                    && Nodes.hasAncestorWithAnyClass(span, InlineStyleRules.EXAMPLE_CLASSES)) {
                return Optional.of(InlineStyleRules.CONTEXTUAL_IN_EXAMPLE);
            }
            return Optional.of(entry.getValue());
        }
        return Optional.empty();
    }
}
