package ai.dictsite.converter.rules;

import ai.dictsite.converter.tree.ClassPattern;
import java.util.List;
import java.util.Optional;

/**
 * Block renamer table, applied in order.
 */
public final class BlockRules {

    private static final ClassPattern LABEL_BLOCK_TITLE = ClassPattern.of("gp", "x_xoLblBlk", "ty_label", "tg_subEntryBlock");

    public static final List<BlockRule> ALL = List.of(
            new BlockRule("origin",
                    ClassPattern.of("etym", "x_xo0"),
                    List.of("origin_block"),
                    Optional.of(ClassPattern.of("gp", "x_xoLblBlk", "ty_label", "tg_etym")),
                    "origin_title",
                    Optional.of(ClassPattern.of("x_xo1"))),
            new BlockRule("derivatives",
                    ClassPattern.of("subEntryBlock", "x_xo0", "t_derivatives"),
                    List.of("derivatives_block"),
                    Optional.of(LABEL_BLOCK_TITLE),
                    "derivatives_title",
                    Optional.of(ClassPattern.of("x_xoh"))),
            new BlockRule("usage note",
                    ClassPattern.of("note", "x_xo0"),
                    List.of("usage_block"),
                    Optional.of(ClassPattern.of("lbl", "x_blk")),
                    "usage_title",
                    Optional.empty()),
            new BlockRule("phrasal verbs",
                    ClassPattern.of("subEntryBlock", "x_xo0", "t_phrasalVerbs"),
                    List.of("phrasalverbs_block"),
                    Optional.of(LABEL_BLOCK_TITLE),
                    "phrasalverbs_title",
                    Optional.empty()),
            new BlockRule("phrases",
                    ClassPattern.of("subEntryBlock", "x_xo0", "t_phrases"),
                    List.of("phrases_block"),
                    Optional.of(LABEL_BLOCK_TITLE),
                    "phrases_title",
                    Optional.empty()),
            // sense-level etymology already renamed by the sense pass
            new BlockRule("inline origin",
                    ClassPattern.of("origin_block", "x_xdt"),
                    List.of("origin_block", "inline"),
                    Optional.of(ClassPattern.of("gp", "ty_label", "tg_etym")),
                    "origin_title",
                    Optional.empty()));

    private BlockRules() {
    }
}
