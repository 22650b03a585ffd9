package ai.dictsite.converter.rules;

import ai.dictsite.converter.tree.ClassPattern;
import java.util.Set;

/**
 * Marker classes driving grouping, phrase lists and bracketing.
 */
public final class StructureRules {

    public static final String GROUP_MARKER = "x_xo0";
    public static final String SECTION_TAG = "section";

    public static final String SUB_ENTRY_BLOCK = "subEntryBlock";
    public static final String LEVEL_ONE_ITEM = "x_xo1";
    public static final String LEVEL_TWO_ITEM = "x_xo2";
    public static final String LEVEL_ONE_CONTAINER_TAG = "div";

    /** Phrase-level second sense carrying {@code x_xo2sub} subsenses. */
    public static final String PHRASE_SECOND_LEVEL = "se2";
    public static final ClassPattern PHRASE_SUBSENSE = ClassPattern.span("msDict", "x_xo2sub", "hasSn", "t_subsense");
    public static final ClassPattern PHRASE_FIRST_DEFINITION = ClassPattern.of("msDict", "x_xo2sub", "t_first");

    public static final Set<String> BRACKET_TARGETS = Set.of("lg");
    public static final Set<String> BRACKET_EXCLUDED_ANCESTORS = Set.of("vg");

    public static final String HEADWORD = "hw";
    public static final String HEADWORD_BREAKS_ATTRIBUTE = "linebreaks";

    private StructureRules() {
    }
}
