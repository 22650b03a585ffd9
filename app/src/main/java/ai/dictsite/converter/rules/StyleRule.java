package ai.dictsite.converter.rules;

import java.util.List;
import java.util.Map;

/**
 * What an inline style rule emits: nested tags (outermost first) and the
 * attributes each of them receives.
 */
public record StyleRule(List<String> tags, Map<String, String> attributes) {

    public StyleRule {
        if (tags == null || tags.isEmpty()) {
            throw new IllegalArgumentException("A style rule needs at least one output tag");
        }
        tags = List.copyOf(tags);
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static StyleRule tags(String... tags) {
        return new StyleRule(List.of(tags), Map.of());
    }

    public static StyleRule classed(String tag, String className) {
        return new StyleRule(List.of(tag), Map.of("class", className));
    }
}
