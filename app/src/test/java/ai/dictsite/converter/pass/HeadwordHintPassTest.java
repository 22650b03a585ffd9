package ai.dictsite.converter.pass;

import static ai.dictsite.converter.pass.PassFixtures.run;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class HeadwordHintPassTest {

    private final HeadwordHintPass pass = new HeadwordHintPass();

    @Test
    void hintFollowsTheHeadwordText() {
        assertThat(run(pass, "<span class=\"hw\" linebreaks=\"ser|en¦dip|ity\">serendipity<span class=\"gp\">1</span></span>"))
                .isEqualTo("<span class=\"hw\" linebreaks=\"ser|en¦dip|ity\">serendipity [ser|en¦dip|ity]<span class=\"gp\">1</span></span>");
    }

    @Test
    void hintWithOnlyOneKindOfBreakIsIgnored() {
        String html = "<span class=\"hw\" linebreaks=\"ser|en|dip\">serendip</span>";

        assertThat(run(pass, html)).isEqualTo(html);
    }

    @Test
    void headwordWithoutHintIsIgnored() {
        String html = "<span class=\"hw\">word</span>";

        assertThat(run(pass, html)).isEqualTo(html);
    }
}
