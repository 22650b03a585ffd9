package ai.dictsite.converter.rules;

import ai.dictsite.converter.tree.ClassPattern;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Renames a structural container and its title child to semantic classes.
 *
 * @param name           short label used in logs
 * @param container      pattern selecting the container
 * @param containerClasses classes that replace the container's class list
 * @param title          pattern selecting title descendants, if the block has one
 * @param titleClass     class given to matched titles
 * @param paragraph      pattern of descendants turned into plain paragraphs, if any
 */
public record BlockRule(String name,
                        ClassPattern container,
                        List<String> containerClasses,
                        Optional<ClassPattern> title,
                        String titleClass,
                        Optional<ClassPattern> paragraph) {

    public static final String CONTAINER_TAG = "section";
    public static final String TITLE_TAG = "p";

    public BlockRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(container, "container");
        if (containerClasses == null || containerClasses.isEmpty()) {
            throw new IllegalArgumentException("containerClasses must not be empty");
        }
        containerClasses = List.copyOf(containerClasses);
        title = title == null ? Optional.empty() : title;
        paragraph = paragraph == null ? Optional.empty() : paragraph;
        if (title.isPresent() && (titleClass == null || titleClass.isBlank())) {
            throw new IllegalArgumentException("titleClass is required when a title pattern is set");
        }
    }
}
