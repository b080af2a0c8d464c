package com.calor.compiler.codegen;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CodeWriter and IdCounter.
 */
class CodeWriterTest {

    @Test
    void testLinesCarryTheirOwnDepth() {
        CodeWriter writer = new CodeWriter("  ");
        writer.line(0, "a").line(2, "b").line(1, "c");

        assertThat(writer.render()).isEqualTo("a\n    b\n  c");
    }

    @Test
    void testBlankCollapsesAndSkipsLeading() {
        CodeWriter writer = new CodeWriter("    ");
        writer.blank();
        writer.line(0, "first");
        writer.blank();
        writer.blank();
        writer.line(0, "second");
        writer.blank();

        assertThat(writer.render()).isEqualTo("first\n\nsecond");
    }

    @Test
    void testIsEmpty() {
        CodeWriter writer = new CodeWriter("\t");
        assertThat(writer.isEmpty()).isTrue();

        writer.blank();
        assertThat(writer.isEmpty()).isTrue();

        writer.line(1, "x");
        assertThat(writer.isEmpty()).isFalse();
        assertThat(writer.render()).isEqualTo("\tx");
    }

    @Test
    void testIdCounterNumbersPerPrefix() {
        IdCounter ids = new IdCounter();

        assertThat(ids.next("__result_")).isEqualTo("__result_1");
        assertThat(ids.next("__result_")).isEqualTo("__result_2");
        assertThat(ids.next("__tmp")).isEqualTo("__tmp1");
        assertThat(new IdCounter().next("__result_")).isEqualTo("__result_1");
    }
}
