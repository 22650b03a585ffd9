package ai.dictsite.converter.pass;

import static ai.dictsite.converter.pass.PassFixtures.run;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.Set;
import org.junit.jupiter.api.Test;

class BracketWrapPassTest {

    private static BracketWrapPass pass(BracketWrapPass.TrailingSpace trailingSpace) {
        return new BracketWrapPass(Set.of("lg"), Set.of("vg"), trailingSpace);
    }

    @Test
    void contentIsTrimmedAndBracketed() {
        assertThat(run(pass(BracketWrapPass.TrailingSpace.NONE), "<span class=\"lg\"> US </span>"))
                .isEqualTo("<span class=\"lg\"><span>[US]</span></span>");
    }

    @Test
    void trailingSpacePolicyAddsSpaceAfterClosingBracket() {
        assertThat(run(pass(BracketWrapPass.TrailingSpace.SPACE), "<span class=\"lg\">US</span>"))
                .isEqualTo("<span class=\"lg\"><span>[US] </span></span>");
    }

    @Test
    void targetsBelowExcludedAncestorAreSkipped() {
        String html = "<span class=\"vg\"><span class=\"lg\">US</span></span>";

        assertThat(run(pass(BracketWrapPass.TrailingSpace.NONE), html)).isEqualTo(html);
    }

    @Test
    void nestedMarkupIsKeptInsideTheBrackets() {
        assertThat(run(pass(BracketWrapPass.TrailingSpace.NONE), "<span class=\"lg\"><b>N.</b> Amer.</span>"))
                .isEqualTo("<span class=\"lg\"><span>[<b>N.</b> Amer.]</span></span>");
    }
}
