package ai.dictsite.converter.tree;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.jsoup.nodes.Element;

/**
 * Structural predicate over an element: an optional tag name plus a set of classes that must all
 * be present on the element. Extra classes on the element never block a match.
 */
public record ClassPattern(Optional<String> tag, Set<String> requiredClasses) {

    public ClassPattern {
        tag = tag == null ? Optional.empty() : tag;
        Objects.requireNonNull(requiredClasses, "requiredClasses");
        if (tag.isEmpty() && requiredClasses.isEmpty()) {
            throw new IllegalArgumentException("pattern must name a tag or at least one class");
        }
        requiredClasses = Set.copyOf(requiredClasses);
    }

    /**
     * Pattern matching any tag that carries all of {@code classes}.
     */
    public static ClassPattern of(String... classes) {
        return new ClassPattern(Optional.empty(), new LinkedHashSet<>(Arrays.asList(classes)));
    }

    /**
     * Pattern restricted to {@code <span>} elements carrying all of {@code classes}.
     */
    public static ClassPattern span(String... classes) {
        return new ClassPattern(Optional.of("span"), new LinkedHashSet<>(Arrays.asList(classes)));
    }

    public boolean matches(Element element) {
        if (element == null) {
            return false;
        }
        if (tag.isPresent() && !tag.get().equals(element.normalName())) {
            return false;
        }
        return element.classNames().containsAll(requiredClasses);
    }
}
