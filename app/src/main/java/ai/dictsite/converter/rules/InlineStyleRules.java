package ai.dictsite.converter.rules;

import ai.dictsite.converter.tree.ClassPattern;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Inline span tables. Iteration order of every map is the order rules are tried in.
 */
public final class InlineStyleRules {

    /** Presentation classes shared by every source. */
    public static final Map<String, StyleRule> GENERIC = ordered(
            "bold", StyleRule.tags("strong"),
            "italic", StyleRule.tags("em"),
            "underline", StyleRule.tags("u"),
            "sup", StyleRule.tags("sup"),
            "sub", StyleRule.tags("sub"),
            "sc", StyleRule.classed("span", "small-caps"),
            "bi", StyleRule.tags("em", "strong"),
            "sui", StyleRule.tags("sup", "em"),
            "ini", StyleRule.tags("sub", "em"));

    /** Class combinations, tried before {@link #GENERIC}. */
    public static final Map<ClassPattern, StyleRule> COMPOSITE;

    /** Dictionary-specific structural classes with an inline meaning. */
    public static final Map<String, StyleRule> SOURCE = ordered(
            "sy_underline", StyleRule.tags("u"),
            "str", StyleRule.classed("span", "stress"),
            "ex", StyleRule.tags("em"),
            "v", StyleRule.tags("strong"),
            "l", StyleRule.tags("strong"),
            "f", StyleRule.tags("strong"),
            "lg", StyleRule.tags("em"),
            "ff", StyleRule.tags("em", "strong"),
            "gg", StyleRule.tags("em"),
            "subEnt", StyleRule.tags("sub"),
            "inf", StyleRule.tags("strong"),
            "sy", StyleRule.tags("em"),
            "nu", StyleRule.tags("sup"),
            "dn", StyleRule.tags("sub"),
            "work", StyleRule.tags("em", "code"));

    /** Grammar-code class whose output depends on being inside an example. */
    public static final String CONTEXTUAL_CLASS = "gg";
    public static final Set<String> EXAMPLE_CLASSES = Set.of("eg");
    public static final StyleRule CONTEXTUAL_IN_EXAMPLE = StyleRule.tags("code");

    static {
        Map<ClassPattern, StyleRule> composite = new LinkedHashMap<>();
        composite.put(ClassPattern.of("gp", "ty_hom", "tg_hw"), StyleRule.tags("sup"));
        composite.put(ClassPattern.of("gp", "ty_hom", "tg_xr"), StyleRule.tags("sup"));
        COMPOSITE = Collections.unmodifiableMap(composite);
    }

    private InlineStyleRules() {
    }

    private static Map<String, StyleRule> ordered(Object... pairs) {
        Map<String, StyleRule> table = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            table.put((String) pairs[i], (StyleRule) pairs[i + 1]);
        }
        return Collections.unmodifiableMap(table);
    }
}
