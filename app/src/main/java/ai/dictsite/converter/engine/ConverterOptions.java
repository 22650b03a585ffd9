package ai.dictsite.converter.engine;

import ai.dictsite.converter.pass.BracketWrapPass;
import java.util.Objects;

/**
 * Output policy knobs of the converter.
 *
 * @param bracketSpace   what follows a closing bracket added around regional labels
 * @param headwordHints  whether headword syllable break hints are shown
 * @param prettyPrint    whether the serialized markup is indented
 */
public record ConverterOptions(BracketWrapPass.TrailingSpace bracketSpace,
                               boolean headwordHints,
                               boolean prettyPrint) {

    public ConverterOptions {
        Objects.requireNonNull(bracketSpace, "bracketSpace");
    }

    public static ConverterOptions defaults() {
        return new ConverterOptions(BracketWrapPass.TrailingSpace.NONE, true, true);
    }
}
