package com.calor.compiler.codegen.template;

import static org.assertj.core.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for CompilationUnitRenderer.
 */
class CompilationUnitRendererTest {

    private final CompilationUnitRenderer renderer = new CompilationUnitRenderer();

    @Test
    void testUsingsRenderedInOrderBeforeNamespace() {
        String csharp = renderer.renderCompilationUnit("Demo",
                List.of("System", "System.Collections.Generic"), "    public static class DemoModule\n    {\n    }");

        assertThat(csharp).startsWith("// <auto-generated>");
        assertThat(csharp).contains("using System;\nusing System.Collections.Generic;\n");
        assertThat(csharp.indexOf("using System;")).isLessThan(csharp.indexOf("namespace Demo"));
        assertThat(csharp).contains("namespace Demo\n{\n    public static class DemoModule");
        assertThat(csharp.trim()).endsWith("}");
    }

    @Test
    void testNoUsings() {
        String csharp = renderer.renderCompilationUnit("Empty", List.of(), "");

        assertThat(csharp).doesNotContain("using ");
        assertThat(csharp).contains("namespace Empty");
    }

    @Test
    void testContractRuntimeRenders() {
        assertThatCode(renderer::renderContractRuntime).doesNotThrowAnyException();
        assertThat(renderer.renderContractRuntime()).contains("ContractViolationException");
    }
}
