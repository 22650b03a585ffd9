package ai.dictsite.converter.rules;

import ai.dictsite.converter.tree.ClassPattern;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Patterns recognised inside a top-level sense block.
 */
public final class SenseRules {

    public static final String SENSE_BLOCK = "se1";
    public static final String PART_OF_SPEECH = "x_xdh";

    public static final ClassPattern CORE = ClassPattern.of("msDict", "x_xd1", "t_core");
    public static final ClassPattern SUBSENSE = ClassPattern.of("msDict", "x_xd1", "hasSn", "t_subsense");
    public static final ClassPattern SECOND_LEVEL = ClassPattern.of("se2", "x_xd1", "hasSn");
    public static final ClassPattern FIRST_DEFINITION = ClassPattern.of("msDict", "x_xd1sub", "t_first");
    public static final ClassPattern SECOND_LEVEL_SUBSENSE = ClassPattern.of("msDict", "x_xd1sub", "hasSn", "t_subsense");
    /** Sense numbers and labels: never turned into sections, paragraphs or list entries. */
    public static final ClassPattern LABEL = ClassPattern.of("gp", "x_xdh", "sn", "ty_label", "tg_se2");

    public static final List<ClassPattern> SENSE_ITEMS = List.of(CORE, SUBSENSE, SECOND_LEVEL);

    /** Named blocks that may sit between senses, mapped to their semantic class. */
    public static final Map<String, String> NAMED_BLOCKS;

    static {
        Map<String, String> blocks = new LinkedHashMap<>();
        blocks.put("note", "note_block");
        blocks.put("etym", "origin_block");
        blocks.put("x_xdt", "origin_block");
        NAMED_BLOCKS = Collections.unmodifiableMap(blocks);
    }

    private SenseRules() {
    }
}
