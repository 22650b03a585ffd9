package ai.dictsite.converter.pass;

import org.jsoup.nodes.Element;

/**
 * One step of the rewrite pipeline. Implementations mutate the tree below {@code root} in place
 * and keep no state between invocations.
 */
public interface RewritePass {

    String name();

    void apply(Element root);
}
