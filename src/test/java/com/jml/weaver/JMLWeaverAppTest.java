package com.jml.weaver;

import com.jml.weaver.processor.CodebaseProcessor;
import com.jml.weaver.weaving.InstrumentationToggle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class JMLWeaverAppTest {

    private static final String COUNTER = String.join("\n",
            "public class Counter {",
            "    @com.jml.weaver.annotations.Requires(\"step > 0\")",
            "    public int next(int current, int step) {",
            "        return current + step;",
            "    }",
            "}");

    @TempDir
    Path workDir;

    @AfterEach
    void restoreToggle() {
        InstrumentationToggle.setInstrumentationEnabled(true);
    }

    @Test
    void noContractsFlag_disablesChecksAndMetrics() throws IOException {
        Path sourceRoot = Files.createDirectories(workDir.resolve("src"));
        Path outputRoot = workDir.resolve("out");
        Files.writeString(sourceRoot.resolve("Counter.java"), COUNTER);

        JMLWeaverApp.main(new String[]{sourceRoot.toString(), outputRoot.toString(), "--no-contracts", "--no-metrics"});

        String woven = Files.readString(outputRoot.resolve("Counter.java"));
        assertThat(woven).doesNotContain("ViolationReporter").contains("contracts = false");
        assertThat(outputRoot.resolve(CodebaseProcessor.METRICS_FILE)).doesNotExist();
        assertThat(InstrumentationToggle.isInstrumentationEnabled()).isFalse();
    }

    @Test
    void singleArgument_weavesInPlace() throws IOException {
        Path sourceRoot = Files.createDirectories(workDir.resolve("src"));
        Files.writeString(sourceRoot.resolve("Counter.java"), COUNTER);

        JMLWeaverApp.main(new String[]{sourceRoot.toString()});

        assertThat(Files.readString(sourceRoot.resolve("Counter.java"))).contains("ViolationReporter.raise");
        assertThat(sourceRoot.resolve(CodebaseProcessor.METRICS_FILE)).exists();
    }
}
