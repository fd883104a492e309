package com.jml.weaver.evaluation;

import com.jml.weaver.model.WeavingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects metrics about a weaving run: what was woven, how many checks were emitted,
 * and which files could not be woven.
 */
public class WeavingMetrics {

    private static final Logger logger = LoggerFactory.getLogger(WeavingMetrics.class);

    // Timing metrics
    private Instant startTime;
    private long totalWeavingTimeMs = 0;

    // File and code metrics
    private int totalFiles = 0;
    private int totalClasses = 0;
    private int totalMethods = 0;

    // Contract metrics
    private int contractedMethods = 0;
    private int uninstrumentedMethods = 0;
    private int requirementChecks = 0;
    private int ensureChecks = 0;
    private int exitPoints = 0;

    // Loop invariant metrics
    private int instrumentedLoopBodies = 0;
    private int loopInvariantChecks = 0;

    // Failures
    private final List<String> failedFiles = new ArrayList<>();

    /**
     * Start timing the weaving run.
     */
    public void startWeaving() {
        this.startTime = Instant.now();
        logger.info("Metrics collection started");
    }

    /**
     * End timing the weaving run.
     */
    public void endWeaving() {
        Instant endTime = Instant.now();
        this.totalWeavingTimeMs = startTime != null ? Duration.between(startTime, endTime).toMillis() : 0;
        logger.info("Metrics collection completed in {}ms", totalWeavingTimeMs);
    }

    public void recordFile() {
        totalFiles++;
    }

    public void recordClass() {
        totalClasses++;
    }

    public void recordMethod() {
        totalMethods++;
    }

    /**
     * Record the outcome of weaving one contracted method.
     */
    public void recordContract(WeavingResult result) {
        contractedMethods++;
        if (!result.isInstrumented()) {
            uninstrumentedMethods++;
        }
        requirementChecks += result.getRequirementChecks();
        ensureChecks += result.getEnsureChecks();
        exitPoints += result.getExitPoints();
    }

    /**
     * Record the checks injected into the loops of one method or constructor.
     */
    public void recordLoopInvariantChecks(int checks) {
        instrumentedLoopBodies++;
        loopInvariantChecks += checks;
    }

    public void recordFailure(Path file) {
        failedFiles.add(file.toString());
    }

    /**
     * Generate a snapshot of the collected metrics.
     */
    public MetricsReport generateReport() {
        MetricsReport report = new MetricsReport();

        report.totalWeavingTimeMs = totalWeavingTimeMs;
        report.averageTimePerFile = totalFiles > 0 ? (double) totalWeavingTimeMs / totalFiles : 0;

        report.totalFiles = totalFiles;
        report.totalClasses = totalClasses;
        report.totalMethods = totalMethods;

        report.contractedMethods = contractedMethods;
        report.uninstrumentedMethods = uninstrumentedMethods;
        report.contractCoverage = calculatePercentage(contractedMethods, totalMethods);
        report.requirementChecks = requirementChecks;
        report.ensureChecks = ensureChecks;
        report.exitPoints = exitPoints;

        report.instrumentedLoopBodies = instrumentedLoopBodies;
        report.loopInvariantChecks = loopInvariantChecks;

        report.failedFiles = new ArrayList<>(failedFiles);
        report.totalChecks = requirementChecks + ensureChecks + loopInvariantChecks;
        return report;
    }

    /**
     * Export metrics to JSON for further analysis.
     */
    public void exportJSON(Path outputPath) throws IOException {
        MetricsReport report = generateReport();

        try (FileWriter writer = new FileWriter(outputPath.toFile())) {
            writer.write("{\n");
            writer.write("  \"timing\": {\n");
            writer.write(String.format("    \"totalWeavingTimeMs\": %d,\n", report.totalWeavingTimeMs));
            writer.write(String.format(java.util.Locale.ROOT, "    \"averageTimePerFile\": %.2f\n", report.averageTimePerFile));
            writer.write("  },\n");

            writer.write("  \"codeMetrics\": {\n");
            writer.write(String.format("    \"totalFiles\": %d,\n", report.totalFiles));
            writer.write(String.format("    \"totalClasses\": %d,\n", report.totalClasses));
            writer.write(String.format("    \"totalMethods\": %d\n", report.totalMethods));
            writer.write("  },\n");

            writer.write("  \"contracts\": {\n");
            writer.write(String.format("    \"contractedMethods\": %d,\n", report.contractedMethods));
            writer.write(String.format("    \"uninstrumentedMethods\": %d,\n", report.uninstrumentedMethods));
            writer.write(String.format(java.util.Locale.ROOT, "    \"contractCoverage\": %.2f,\n", report.contractCoverage));
            writer.write(String.format("    \"requirementChecks\": %d,\n", report.requirementChecks));
            writer.write(String.format("    \"ensureChecks\": %d,\n", report.ensureChecks));
            writer.write(String.format("    \"exitPoints\": %d\n", report.exitPoints));
            writer.write("  },\n");

            writer.write("  \"loopInvariants\": {\n");
            writer.write(String.format("    \"instrumentedLoopBodies\": %d,\n", report.instrumentedLoopBodies));
            writer.write(String.format("    \"loopInvariantChecks\": %d\n", report.loopInvariantChecks));
            writer.write("  },\n");

            writer.write("  \"failedFiles\": [");
            for (int i = 0; i < report.failedFiles.size(); i++) {
                if (i > 0) writer.write(", ");
                writer.write("\"" + report.failedFiles.get(i).replace("\\", "\\\\").replace("\"", "\\\"") + "\"");
            }
            writer.write("],\n");

            writer.write(String.format("  \"totalChecks\": %d\n", report.totalChecks));
            writer.write("}\n");
        }

        logger.info("Metrics exported to: {}", outputPath);
    }

    /**
     * Print a human-readable report to console.
     */
    public void printReport() {
        MetricsReport report = generateReport();

        System.out.println("\n" + "=".repeat(80));
        System.out.println("JML CONTRACT WEAVING - METRICS REPORT");
        System.out.println("=".repeat(80));

        System.out.println("\n[TIMING METRICS]");
        System.out.printf("  Total Weaving Time: %.2f seconds\n", report.totalWeavingTimeMs / 1000.0);
        System.out.printf("  Average Time per File: %.2f ms\n", report.averageTimePerFile);

        System.out.println("\n[CODE METRICS]");
        System.out.printf("  Total Files Woven: %d\n", report.totalFiles);
        System.out.printf("  Total Classes: %d\n", report.totalClasses);
        System.out.printf("  Total Methods: %d\n", report.totalMethods);

        System.out.println("\n[CONTRACTS]");
        System.out.printf("  Contracted Methods: %.1f%% (%d/%d)\n",
                report.contractCoverage, report.contractedMethods, report.totalMethods);
        System.out.printf("  Woven Without Checks: %,6d\n", report.uninstrumentedMethods);
        System.out.printf("  Requirement Checks:   %,6d\n", report.requirementChecks);
        System.out.printf("  Ensure Checks:        %,6d (over %d exit points)\n", report.ensureChecks, report.exitPoints);

        System.out.println("\n[LOOP INVARIANTS]");
        System.out.printf("  Instrumented Bodies:  %,6d\n", report.instrumentedLoopBodies);
        System.out.printf("  Invariant Checks:     %,6d\n", report.loopInvariantChecks);

        if (!report.failedFiles.isEmpty()) {
            System.out.println("\n[FAILED FILES]");
            report.failedFiles.forEach(file -> System.out.println("  " + file));
        }

        System.out.println("\n" + "=".repeat(80));
        System.out.printf("TOTAL CHECKS GENERATED: %,d\n", report.totalChecks);
        System.out.println("=".repeat(80) + "\n");
    }

    private double calculatePercentage(int part, int total) {
        return total > 0 ? (100.0 * part / total) : 0.0;
    }

    /**
     * Data class holding all metrics for reporting.
     */
    public static class MetricsReport {
        // Timing
        public long totalWeavingTimeMs;
        public double averageTimePerFile;

        // Code metrics
        public int totalFiles;
        public int totalClasses;
        public int totalMethods;

        // Contracts
        public int contractedMethods;
        public int uninstrumentedMethods;
        public double contractCoverage;
        public int requirementChecks;
        public int ensureChecks;
        public int exitPoints;

        // Loop invariants
        public int instrumentedLoopBodies;
        public int loopInvariantChecks;

        public List<String> failedFiles;
        public int totalChecks;
    }
}
