package ai.dictsite.converter.pass;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

final class PassFixtures {

    private PassFixtures() {
    }

    static Element body(String html) {
        Document document = Jsoup.parseBodyFragment(html);
        document.outputSettings().prettyPrint(false);
        return document.body();
    }

    static String run(RewritePass pass, String html) {
        Element body = body(html);
        pass.apply(body);
        return body.html();
    }
}
