package com.jml.weaver.processor;

import com.github.javaparser.ast.CompilationUnit;
import com.jml.weaver.evaluation.WeavingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Weaves an entire Java codebase, writing the woven sources to an output directory.
 */
public class CodebaseProcessor {

    private static final Logger logger = LoggerFactory.getLogger(CodebaseProcessor.class);

    public static final String METRICS_FILE = "jml-weaving-metrics.json";

    private final SourceWeaver sourceWeaver;
    private final WeavingMetrics metricsCollector;
    private final boolean collectMetrics;

    public CodebaseProcessor() {
        this(true); // Enable metrics by default
    }

    public CodebaseProcessor(boolean collectMetrics) {
        this.collectMetrics = collectMetrics;
        this.metricsCollector = collectMetrics ? new WeavingMetrics() : null;
        this.sourceWeaver = new SourceWeaver(metricsCollector);
    }

    /**
     * Weaves all Java files under the source root into the output root, mirroring the
     * directory layout. A file that cannot be read, parsed, woven or written is logged,
     * counted as a failure and left out of the output; the remaining files are still woven.
     *
     * @param sourceRoot Root directory of the Java sources
     * @param outputRoot Root directory for woven sources; may equal the source root to weave in place
     * @return Number of files written
     * @throws IOException If the source root does not exist or cannot be walked
     */
    public int processCodebase(Path sourceRoot, Path outputRoot) throws IOException {
        if (!Files.exists(sourceRoot)) {
            throw new IOException("Path does not exist: " + sourceRoot);
        }

        if (collectMetrics) {
            metricsCollector.startWeaving();
        }

        List<Path> javaFiles = new ArrayList<>();
        try (Stream<Path> paths = Files.walk(sourceRoot)) {
            paths.filter(Files::isRegularFile)
                 .filter(path -> path.toString().endsWith(".java"))
                 .forEach(javaFiles::add);
        }
        logger.info("Found {} Java files under {}", javaFiles.size(), sourceRoot);

        int written = 0;
        for (Path javaFile : javaFiles) {
            try {
                String source = Files.readString(javaFile);
                CompilationUnit cu = sourceWeaver.weave(source);

                Path target = outputRoot.resolve(sourceRoot.relativize(javaFile));
                Files.createDirectories(target.getParent());
                Files.writeString(target, cu.toString());
                written++;

                if (collectMetrics) {
                    metricsCollector.recordFile();
                }
                logger.info("Wrote woven file: {}", target);
            } catch (Exception e) {
                logger.error("Error weaving file: {}", javaFile, e);
                if (collectMetrics) {
                    metricsCollector.recordFailure(javaFile);
                }
            }
        }

        if (collectMetrics) {
            metricsCollector.endWeaving();
            metricsCollector.printReport();

            try {
                Files.createDirectories(outputRoot);
                metricsCollector.exportJSON(outputRoot.resolve(METRICS_FILE));
            } catch (IOException e) {
                logger.error("Failed to export metrics to JSON", e);
            }
        }

        return written;
    }

    /**
     * Get the metrics collector for external access.
     */
    public WeavingMetrics getMetricsCollector() {
        return metricsCollector;
    }
}
