package com.jml.weaver.processor;

import com.jml.weaver.SourceParseException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceWeaverTest {

    private final SourceWeaver sourceWeaver = new SourceWeaver();

    @Test
    void invalidSource_carriesParserProblems() {
        assertThatThrownBy(() -> sourceWeaver.weave("public class {"))
                .isInstanceOf(SourceParseException.class)
                .satisfies(e -> assertThat(((SourceParseException) e).getProblems()).isNotEmpty());
    }

    @Test
    void modernSyntax_isAccepted() {
        String woven = sourceWeaver.weave(String.join("\n",
                "record Range(int low, int high) {",
                "    @com.jml.weaver.annotations.Ensures(\"result >= 0\")",
                "    int width() {",
                "        return switch (low) {",
                "            case 0 -> high;",
                "            default -> high - low;",
                "        };",
                "    }",
                "}")).toString();

        assertThat(woven).contains("final int result = switch");
    }

    @Test
    void sourceWithoutContracts_isUnchangedStructurally() {
        String source = "class Plain { int twice(int x) { return 2 * x; } }";

        assertThat(sourceWeaver.weave(source)).isEqualTo(sourceWeaver.parse(source));
    }
}
