package ai.dictsite.converter.engine;

import ai.dictsite.converter.pass.BlockRenamerPass;
import ai.dictsite.converter.pass.BracketWrapPass;
import ai.dictsite.converter.pass.CleanupPass;
import ai.dictsite.converter.pass.GroupingPass;
import ai.dictsite.converter.pass.HeadwordHintPass;
import ai.dictsite.converter.pass.InlineStylePass;
import ai.dictsite.converter.pass.ListConversionPass;
import ai.dictsite.converter.pass.RewritePass;
import ai.dictsite.converter.pass.SensePass;
import ai.dictsite.converter.rules.BlockRules;
import ai.dictsite.converter.rules.StructureRules;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites one dictionary document into semantic HTML.
 *
 * <p>The passes run in a fixed order over a single tree; later passes rely on the shape earlier
 * ones leave behind. Instances hold no per-document state and can be shared between threads.</p>
 */
public class SemanticConverter {

    private static final Logger LOGGER = LoggerFactory.getLogger(SemanticConverter.class);
    private static final Pattern DOCUMENT_PATTERN = Pattern.compile("<html[\\s>]", Pattern.CASE_INSENSITIVE);

    private final ConverterOptions options;
    private final List<RewritePass> passes;

    public SemanticConverter() {
        this(ConverterOptions.defaults());
    }

    public SemanticConverter(ConverterOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.passes = List.copyOf(defaultPasses(options));
    }

    SemanticConverter(ConverterOptions options, List<RewritePass> passes) {
        this.options = Objects.requireNonNull(options, "options");
        this.passes = List.copyOf(Objects.requireNonNull(passes, "passes"));
    }

    static List<RewritePass> defaultPasses(ConverterOptions options) {
        List<RewritePass> passes = new ArrayList<>();
        passes.add(new GroupingPass());
        passes.add(new ListConversionPass());
        passes.add(InlineStylePass.generic());
        passes.add(new BracketWrapPass(StructureRules.BRACKET_TARGETS, StructureRules.BRACKET_EXCLUDED_ANCESTORS,
                options.bracketSpace()));
        passes.add(InlineStylePass.source());
        passes.add(new SensePass());
        passes.add(new BlockRenamerPass(BlockRules.ALL));
        if (options.headwordHints()) {
            passes.add(new HeadwordHintPass());
        }
        passes.add(new CleanupPass());
        return passes;
    }

    public List<RewritePass> passes() {
        return passes;
    }

    /**
     * Converts markup text. Complete documents are returned whole; fragments come back as fragments.
     *
     * @throws ConversionException if any pass fails on this document
     */
    public String convert(String markup) {
        Objects.requireNonNull(markup, "markup");
        boolean fullDocument = DOCUMENT_PATTERN.matcher(markup).find();
        Document document = fullDocument ? Jsoup.parse(markup) : Jsoup.parseBodyFragment(markup);
        document.outputSettings().prettyPrint(options.prettyPrint());
        rewrite(document.body());
        return fullDocument ? document.outerHtml() : document.body().html();
    }

    /**
     * Runs every pass over the subtree below {@code root}.
     *
     * @throws ConversionException if any pass fails
     */
    public void rewrite(Element root) {
        Objects.requireNonNull(root, "root");
        for (RewritePass pass : passes) {
            LOGGER.debug("Running {} pass", pass.name());
            try {
                pass.apply(root);
            } catch (RuntimeException ex) {
                throw new ConversionException("Pass '" + pass.name() + "' failed: " + ex.getMessage(), ex);
            }
        }
    }
}
