package com.calor.compiler.codegen.csharp;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CSharpTypeMapper and UsingManager.
 */
class CSharpTypeMapperTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "i32             | int",
        "i64             | long",
        "u8              | byte",
        "f64             | double",
        "dec             | decimal",
        "str             | string",
        "bool            | bool",
        "obj             | object",
        "?str            | Calor.Runtime.Option<string>",
        "i32!str         | Calor.Runtime.Result<int, string>",
        "i32[]           | int[]",
        "List<str>       | List<string>",
        "Dict<str,i32>   | Dictionary<string, int>",
        "Customer        | Customer",
    })
    void testMapShorthand(String calorType, String expected) {
        CSharpTypeMapper mapper = new CSharpTypeMapper(new UsingManager("Demo"));

        assertThat(mapper.map(calorType)).isEqualTo(expected);
    }

    @Test
    void testMissingTypeMapsToVar() {
        CSharpTypeMapper mapper = new CSharpTypeMapper(new UsingManager("Demo"));

        assertThat(mapper.map((String) null)).isEqualTo("var");
        assertThat(mapper.map(" ")).isEqualTo("var");
    }

    @Test
    void testCollectionsPullInTheirNamespace() {
        UsingManager usings = new UsingManager("Demo");
        CSharpTypeMapper mapper = new CSharpTypeMapper(usings);

        mapper.map("List<i32>");
        mapper.map("Task<i32>");

        assertThat(usings.getUsings()).containsExactly("System.Collections.Generic", "System.Threading.Tasks");
    }

    @Test
    void testUnionCasesAreQualified() {
        CSharpTypeMapper mapper = new CSharpTypeMapper(new UsingManager("Demo"));
        mapper.registerQualifiedName("Circle", "Shape.Circle");

        assertThat(mapper.map("Circle")).isEqualTo("Shape.Circle");
        assertThat(mapper.qualify("Square")).isEqualTo("Square");
    }

    @Test
    void testUsingsAreSortedAndSkipOwnNamespace() {
        UsingManager usings = new UsingManager("Demo");
        usings.addUsing("System.Linq");
        usings.addUsing("Demo");
        usings.addUsing("System");
        usings.addUsing("System");
        usings.addAlias("Json", "System.Text.Json");
        usings.addStatic("System.Math");

        assertThat(usings.getUsings())
                .containsExactly("Json = System.Text.Json", "System", "System.Linq", "static System.Math");
    }
}
