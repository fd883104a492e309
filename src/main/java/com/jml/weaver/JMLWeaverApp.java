package com.jml.weaver;

import com.jml.weaver.processor.CodebaseProcessor;
import com.jml.weaver.weaving.InstrumentationToggle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Main application entry point for the JML Contract Weaver.
 * Weaves the contracts and loop invariants of a Java codebase into its method bodies.
 */
public class JMLWeaverApp {

    private static final Logger logger = LoggerFactory.getLogger(JMLWeaverApp.class);

    public static void main(String[] args) {
        List<String> positional = new ArrayList<>();
        boolean contracts = true;
        boolean metrics = true;
        for (String arg : args) {
            switch (arg) {
                case "--no-contracts" -> contracts = false;
                case "--no-metrics" -> metrics = false;
                default -> positional.add(arg);
            }
        }

        if (positional.isEmpty() || positional.size() > 2) {
            System.err.println("Usage: java -jar jml-weaver.jar <source-dir> [output-dir] [--no-contracts] [--no-metrics]");
            System.err.println("Example: java -jar jml-weaver.jar /path/to/project/src /path/to/woven-src");
            System.exit(1);
        }

        Path sourceRoot = Paths.get(positional.get(0));
        Path outputRoot = positional.size() > 1 ? Paths.get(positional.get(1)) : sourceRoot;
        logger.info("Starting JML Contract Weaver");
        logger.info("Source root: {}, output root: {}", sourceRoot, outputRoot);

        try {
            InstrumentationToggle.setInstrumentationEnabled(contracts);
            CodebaseProcessor processor = new CodebaseProcessor(metrics);

            logger.info("Weaving codebase...");
            int wovenFiles = processor.processCodebase(sourceRoot, outputRoot);

            logger.info("Weaving complete!");
            logger.info("Total files written: {}", wovenFiles);

        } catch (Exception e) {
            logger.error("Error weaving codebase", e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }
}
