package ai.dictsite.converter.rules;

import ai.dictsite.converter.tree.ClassPattern;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Class vocabulary used by the audit: classes the rule tables act on, and classes deliberately
 * left alone.
 */
public final class KnownClasses {

    public static final Set<String> KNOWN;

    public static final Set<String> EXCLUDED = Set.of(
            "phrases_block", "phrases_title", "phrasalverbs_block", "phrasalverbs_title",
            "origin_block", "origin_title", "derivatives_block", "derivatives_title",
            "usage_block", "usage_title", "note_block", "note",
            "la", // latin
            "date", "df", "tg_df", "dg", "x_xoLblBlk", "etym",
            "t_derivatives", "t_phrasalVerbs", "t_phrases",
            "eg", // example
            "frac", "fg",
            "ge", // regional language
            "reg", // register
            "hg", "x_xh0", "hw", "pr", "prx", "t_IPA", "ph", "tg_ph", "infg",
            "lbl", // colon after a label
            "subEntryBlock", "tg_subEntryBlock", "subEntry",
            "posg", "pos", "tg_pos", "q", "tg_q", "gp", "sg", "x_blk",
            "se1", "x_xd0", "x_xdt", "tg_msDict", "sj", "tg_eg", "tg_etym", "tx",
            "vg", "tg_vg", "tg_fg", "tg_infg", "trans", "tg_gg", "tg_lg", "tg_reg", "tg_nu", "tg_tr",
            "tg_xrg", "x_xo0", "x_xo1", "x_xo2", "x_xo2sub", "x_xo3", "x_xoh",
            "xrlabelGroup", "xrlabel", "tg_xrlabel", "x_xot", "tg_xr", "xrg", "xr");

    static {
        Set<String> known = new LinkedHashSet<>();
        known.addAll(InlineStyleRules.GENERIC.keySet());
        known.addAll(InlineStyleRules.SOURCE.keySet());
        InlineStyleRules.COMPOSITE.keySet().forEach(pattern -> known.addAll(pattern.requiredClasses()));
        for (ClassPattern pattern : new ClassPattern[] {SenseRules.CORE, SenseRules.SUBSENSE, SenseRules.SECOND_LEVEL,
                SenseRules.FIRST_DEFINITION, SenseRules.SECOND_LEVEL_SUBSENSE, SenseRules.LABEL}) {
            known.addAll(pattern.requiredClasses());
        }
        known.addAll(SenseRules.NAMED_BLOCKS.keySet());
        known.add(SenseRules.SENSE_BLOCK);
        for (BlockRule rule : BlockRules.ALL) {
            known.addAll(rule.container().requiredClasses());
            rule.title().ifPresent(title -> known.addAll(title.requiredClasses()));
            rule.paragraph().ifPresent(paragraph -> known.addAll(paragraph.requiredClasses()));
        }
        known.addAll(CleanupRules.BULLET.requiredClasses());
        known.addAll(CleanupRules.HEADING.requiredClasses());
        known.addAll(StructureRules.PHRASE_SUBSENSE.requiredClasses());
        known.addAll(StructureRules.PHRASE_FIRST_DEFINITION.requiredClasses());
        KNOWN = Collections.unmodifiableSet(known);
    }

    private KnownClasses() {
    }

    public static boolean isRecognised(String className) {
        return KNOWN.contains(className) || EXCLUDED.contains(className);
    }
}
