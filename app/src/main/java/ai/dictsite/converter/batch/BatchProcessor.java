package ai.dictsite.converter.batch;

import ai.dictsite.converter.engine.ConversionException;
import ai.dictsite.converter.engine.SemanticConverter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Converts a set of files on a fixed pool of worker threads. A failing file is logged and
 * reported in the outcome; it never stops the other files.
 */
public class BatchProcessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchProcessor.class);
    static final String MDC_DOCUMENT = "document";

    private final SemanticConverter converter;
    private final DocumentWriter writer;
    private final int threads;

    public BatchProcessor(SemanticConverter converter, DocumentWriter writer, int threads) {
        this.converter = Objects.requireNonNull(converter, "converter");
        this.writer = Objects.requireNonNull(writer, "writer");
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1");
        }
        this.threads = threads;
    }

    public BatchOutcome process(List<ConversionTask> tasks) {
        if (tasks == null || tasks.isEmpty()) {
            return new BatchOutcome(List.of(), List.of());
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, tasks.size()));
        try {
            List<Future<Boolean>> futures = new ArrayList<>();
            for (ConversionTask task : tasks) {
                futures.add(executor.submit(() -> convert(task)));
            }
            List<Path> converted = new ArrayList<>();
            List<Path> failed = new ArrayList<>();
            for (int i = 0; i < tasks.size(); i++) {
                if (await(futures.get(i), tasks.get(i))) {
                    converted.add(tasks.get(i).output());
                } else {
                    failed.add(tasks.get(i).input());
                }
            }
            LOGGER.info("Converted {} of {} files", converted.size(), tasks.size());
            return new BatchOutcome(converted, failed);
        } finally {
            executor.shutdown();
        }
    }

    /**
     * Runs one task on the calling thread.
     *
     * @return {@code true} when the output was written
     */
    public boolean convert(ConversionTask task) {
        MDC.put(MDC_DOCUMENT, task.input().getFileName().toString());
        try {
            String source = Files.readString(task.input(), StandardCharsets.UTF_8);
            writer.write(task.output(), converter.convert(source));
            if (task.inPlace()) {
                LOGGER.info("{} rewritten in place", task.input());
            } else {
                LOGGER.info("{} -> {}", task.input(), task.output());
            }
            return true;
        } catch (IOException ex) {
            LOGGER.error("Failed to read {}: {}", task.input(), ex.getMessage(), ex);
        } catch (UncheckedIOException | ConversionException ex) {
            LOGGER.error("Failed to convert {}: {}", task.input(), ex.getMessage(), ex);
        } finally {
            MDC.remove(MDC_DOCUMENT);
        }
        return false;
    }

    private boolean await(Future<Boolean> future, ConversionTask task) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for {}", task.input());
            return false;
        } catch (ExecutionException ex) {
            LOGGER.error("Unexpected failure converting {}", task.input(), ex.getCause());
            return false;
        }
    }
}
