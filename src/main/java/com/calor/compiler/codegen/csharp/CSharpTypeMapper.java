package com.calor.compiler.codegen.csharp;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

import com.calor.compiler.semantic.CalorType;
import com.calor.compiler.semantic.TypeResolver;

/**
 * Maps Calor type shorthand onto C# type syntax.
 */
public class CSharpTypeMapper {

    private static final String RUNTIME = "Calor.Runtime.";

    private static final Map<String, String> PRIMITIVES = Map.ofEntries(
        Map.entry("i8", "sbyte"),
        Map.entry("i16", "short"),
        Map.entry("i32", "int"),
        Map.entry("i64", "long"),
        Map.entry("u8", "byte"),
        Map.entry("u16", "ushort"),
        Map.entry("u32", "uint"),
        Map.entry("u64", "ulong"),
        Map.entry("f32", "float"),
        Map.entry("f64", "double"),
        Map.entry("dec", "decimal"),
        Map.entry("str", "string"),
        Map.entry("bool", "bool"),
        Map.entry("char", "char"),
        Map.entry("void", "void"),
        Map.entry("obj", "object")
    );

    private final TypeResolver resolver = new TypeResolver();
    private final UsingManager usings;

    /** Simple names that must be written qualified, such as union cases nested in their union. */
    private final Map<String, String> qualifiedNames = new HashMap<>();

    public CSharpTypeMapper(UsingManager usings) {
        this.usings = usings;
    }

    public void registerQualifiedName(String simpleName, String qualifiedName) {
        qualifiedNames.put(simpleName, qualifiedName);
    }

    /**
     * Name as it must appear in expressions and patterns: union cases come back qualified.
     */
    public String qualify(String name) {
        return qualifiedNames.getOrDefault(name, name);
    }

    /**
     * C# spelling of a Calor type. Null or blank text maps to {@code var}.
     */
    public String map(String calorType) {
        if (calorType == null || calorType.isBlank()) {
            return "var";
        }
        return map(resolver.resolve(calorType));
    }

    public String map(CalorType type) {
        return switch (type.getKind()) {
            case INT, FLOAT, DECIMAL, STRING, BOOL, CHAR, VOID, OBJECT -> PRIMITIVES.get(type.getName());
            case NULL, UNKNOWN -> "object";
            case OPTION -> RUNTIME + "Option<" + map(type.getArguments().get(0)) + ">";
            case RESULT -> RUNTIME + "Result<" + map(type.getArguments().get(0)) + ", "
                    + map(type.getArguments().get(1)) + ">";
            case LIST -> {
                usings.addUsing("System.Collections.Generic");
                yield "List<" + map(type.getArguments().get(0)) + ">";
            }
            case DICT -> {
                usings.addUsing("System.Collections.Generic");
                yield "Dictionary<" + map(type.getArguments().get(0)) + ", " + map(type.getArguments().get(1)) + ">";
            }
            case ARRAY -> map(type.getArguments().get(0)) + "[]";
            case NAMED -> named(type);
        };
    }

    private String named(CalorType type) {
        String name = qualify(type.getName());
        if (name.equals("Task") || name.equals("ValueTask")) {
            usings.addUsing("System.Threading.Tasks");
        }
        if (name.equals("HashSet") || name.equals("Queue") || name.equals("Stack")) {
            usings.addUsing("System.Collections.Generic");
        }
        if (type.getArguments().isEmpty()) {
            return name;
        }
        return name + type.getArguments().stream().map(this::map).collect(Collectors.joining(", ", "<", ">"));
    }
}
