package ai.dictsite.converter.audit;

import ai.dictsite.converter.rules.KnownClasses;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds classes on visible content that no rule table knows about, to spot markup the converter
 * would silently drop.
 */
public class ClassAuditor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClassAuditor.class);

    public AuditReport audit(List<Path> files) {
        SortedMap<String, SortedSet<Path>> found = new TreeMap<>();
        for (Path file : files) {
            try {
                String html = Files.readString(file, StandardCharsets.UTF_8);
                for (String className : unknownClasses(html)) {
                    found.computeIfAbsent(className, ignored -> new TreeSet<>()).add(file);
                }
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to read " + file, ex);
            }
        }
        LOGGER.info("Audited {} files, {} unknown classes", files.size(), found.size());
        return new AuditReport(found);
    }

    SortedSet<String> unknownClasses(String html) {
        Document document = Jsoup.parse(html);
        SortedSet<String> unknown = new TreeSet<>();
        for (Element element : document.body().getAllElements()) {
            if (!element.hasText()) {
                continue;
            }
            for (String className : element.classNames()) {
                if (!KnownClasses.isRecognised(className)) {
                    unknown.add(className);
                }
            }
        }
        return unknown;
    }
}
