package ai.dictsite.converter.pass;

import static ai.dictsite.converter.pass.PassFixtures.body;
import static org.assertj.core.api.Assertions.assertThat;

import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

class SensePassTest {

    private static final String CORE = "msDict x_xd1 t_core";
    private static final String SUBSENSE = "msDict x_xd1 hasSn t_subsense";

    private final SensePass pass = new SensePass();

    @Test
    void senseRunsBecomeListsAndNamedBlocksKeepTheirPlace() {
        Element body = body("<span class=\"se1\">"
                + "<span class=\"x_xdh\">noun</span>"
                + "<span class=\"" + CORE + "\">first</span>"
                + "<span class=\"" + CORE + "\">second</span>"
                + "<span class=\"note\">a note</span>"
                + "<span class=\"" + CORE + "\">third</span>"
                + "</span>");
        String textBefore = body.wholeText();

        pass.apply(body);

        Element sense = body.child(0);
        assertThat(sense.normalName()).isEqualTo("section");
        assertThat(sense.children()).extracting(Element::normalName).containsExactly("p", "ul", "section", "ul");
        assertThat(sense.child(1).children()).extracting(Element::text).containsExactly("first", "second");
        assertThat(sense.child(2).classNames()).containsExactly("note_block");
        assertThat(sense.child(3).children()).extracting(Element::text).containsExactly("third");
        assertThat(body.wholeText()).isEqualTo(textBefore);
    }

    @Test
    void whitespaceBetweenSensesDoesNotSplitTheList() {
        Element body = body("<span class=\"se1\"><span class=\"" + CORE + "\">a</span> \n "
                + "<span class=\"" + CORE + "\">b</span></span>");

        pass.apply(body);

        Element sense = body.child(0);
        assertThat(sense.children()).hasSize(1);
        assertThat(sense.child(0).children()).extracting(Element::text).containsExactly("a", "b");
    }

    @Test
    void labelIsNeitherRenamedNorListed() {
        Element body = body("<span class=\"se1\">"
                + "<span class=\"gp x_xdh sn ty_label tg_se2\">1</span>"
                + "<span class=\"" + CORE + "\">x</span>"
                + "</span>");

        pass.apply(body);

        Element sense = body.child(0);
        assertThat(sense.children()).extracting(Element::normalName).containsExactly("span", "ul");
        assertThat(sense.child(0).text()).isEqualTo("1");
    }

    @Test
    void secondLevelSenseGetsItsDefinitionAndNestedSubsenses() {
        Element body = body("<span class=\"se1\"><span class=\"se2 x_xd1 hasSn\">"
                + "<span class=\"msDict x_xd1sub t_first\">def</span>"
                + "<span class=\"msDict x_xd1sub hasSn t_subsense\">a</span>"
                + "<span class=\"msDict x_xd1sub hasSn t_subsense\">b</span>"
                + "</span></span>");

        pass.apply(body);

        Element list = body.child(0).child(0);
        assertThat(list.normalName()).isEqualTo("ul");
        Element entry = list.child(0);
        assertThat(entry.normalName()).isEqualTo("li");
        assertThat(entry.ownText()).isEqualTo("def");
        assertThat(entry.children()).extracting(Element::normalName).containsExactly("ul");
        assertThat(entry.child(0).children()).extracting(Element::text).containsExactly("a", "b");
    }

    @Test
    void strayCoresCollectTheirFollowingSubsenses() {
        Element body = body("<span class=\"se1\"><span class=\"wrapper\">"
                + "<span class=\"" + CORE + "\">core</span>"
                + "<span class=\"" + SUBSENSE + "\">sub</span>"
                + "</span></span>");

        pass.apply(body);

        Element sense = body.child(0);
        Element trailing = sense.children().last();
        assertThat(trailing.normalName()).isEqualTo("ul");
        assertThat(trailing.children()).hasSize(1);
        Element core = trailing.child(0);
        assertThat(core.ownText()).isEqualTo("core");
        assertThat(core.select("ul > li")).extracting(Element::text).containsExactly("sub");
        assertThat(sense.select("span.wrapper").first().children()).isEmpty();
    }

    @Test
    void runningTwiceChangesNothing() {
        Element body = body("<span class=\"se1\">"
                + "<span class=\"x_xdh\">verb</span>"
                + "<span class=\"" + CORE + "\">core<span class=\"" + SUBSENSE + "\">nested</span></span>"
                + "<span class=\"etym\">from Latin</span>"
                + "<span class=\"se2 x_xd1 hasSn\">second</span>"
                + "</span>");

        pass.apply(body);
        String once = body.html();
        pass.apply(body);

        assertThat(body.html()).isEqualTo(once);
        Element coreEntry = body.selectFirst("li:contains(core)");
        assertThat(coreEntry).isNotNull();
        assertThat(coreEntry.text()).isEqualTo("corenested");
        assertThat(body.select("section > ul")).hasSize(2);
    }

    @Test
    void nestedSubsenseStaysWithItsEntry() {
        Element body = body("<span class=\"se1\">"
                + "<span class=\"" + CORE + "\">first<span class=\"" + SUBSENSE + "\">first-sub</span></span>"
                + "<span class=\"etym\">ORIGIN</span>"
                + "<span class=\"" + CORE + "\">second</span>"
                + "</span>");

        pass.apply(body);

        Element sense = body.child(0);
        assertThat(sense.wholeText()).isEqualTo("firstfirst-subORIGINsecond");
        assertThat(sense.children()).extracting(Element::normalName).containsExactly("ul", "section", "ul");
        assertThat(sense.child(0).select("li")).hasSize(1);
        assertThat(sense.child(0).child(0).text()).isEqualTo("firstfirst-sub");
        assertThat(sense.child(1).hasClass("origin_block")).isTrue();
        assertThat(sense.child(2).text()).isEqualTo("second");
    }
}
