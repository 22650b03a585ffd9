package ai.dictsite.converter.rules;

import ai.dictsite.converter.tree.ClassPattern;
import java.util.List;
import java.util.Set;

/**
 * Constants for the final cleanup stage.
 */
public final class CleanupRules {

    /** Index markers carry no text but must survive. */
    public static final Set<String> PROTECTED_TAGS = Set.of("d:index");

    public static final ClassPattern BULLET = ClassPattern.span("gp", "sn", "tg_msDict");
    public static final String BULLET_TEXT = "•";

    public static final ClassPattern HEADING = ClassPattern.span("hg", "x_xh0");

    public static final Set<String> UNWRAPPED_TAGS = Set.of("span", "d:entry");
    public static final Set<String> DROPPED_TAGS = Set.of("d:prn", "d:def", "d:pos");
    public static final List<String> DROPPED_ATTRIBUTES = List.of("id", "linebreaks");

    public static final Set<String> RETAINED_CLASSES = Set.of(
            "phrases_block",
            "phrases_title",
            "phrasalverbs_block",
            "phrasalverbs_title",
            "origin_block",
            "origin_title",
            "derivatives_block",
            "derivatives_title",
            "usage_block",
            "usage_title",
            "note_block",
            "inline",
            "small-caps",
            "stress");

    public static final List<String> SPACED_TAGS = List.of("strong", "em");

    public static final List<String> TITLE_CLASSES = List.of(
            "usage_title",
            "origin_title",
            "derivatives_title",
            "phrases_title",
            "phrasalverbs_title");

    private CleanupRules() {
    }
}
