package com.calor.compiler.semantic;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Resolves Calor type shorthand ({@code i32}, {@code ?str}, {@code i32!str}, {@code List<T>},
 * {@code T[]}) into {@link CalorType}. Unrecognised names resolve to NAMED types; user and
 * host types are not validated here.
 */
public class TypeResolver {

    private static final Map<String, CalorType> PRIMITIVES = Map.ofEntries(
        Map.entry("i8", CalorType.I8),
        Map.entry("i16", CalorType.I16),
        Map.entry("i32", CalorType.I32),
        Map.entry("i64", CalorType.I64),
        Map.entry("u8", CalorType.U8),
        Map.entry("u16", CalorType.U16),
        Map.entry("u32", CalorType.U32),
        Map.entry("u64", CalorType.U64),
        Map.entry("f32", CalorType.F32),
        Map.entry("f64", CalorType.F64),
        Map.entry("dec", CalorType.DEC),
        Map.entry("str", CalorType.STR),
        Map.entry("bool", CalorType.BOOL),
        Map.entry("char", CalorType.CHAR),
        Map.entry("void", CalorType.VOID),
        Map.entry("obj", CalorType.OBJ),
        // host spellings
        Map.entry("int", CalorType.I32),
        Map.entry("long", CalorType.I64),
        Map.entry("short", CalorType.I16),
        Map.entry("byte", CalorType.U8),
        Map.entry("float", CalorType.F32),
        Map.entry("double", CalorType.F64),
        Map.entry("decimal", CalorType.DEC),
        Map.entry("string", CalorType.STR),
        Map.entry("object", CalorType.OBJ)
    );

    /**
     * Resolve a shorthand type. Null or blank resolves to {@link CalorType#UNKNOWN}.
     */
    public CalorType resolve(String text) {
        if (text == null || text.isBlank()) {
            return CalorType.UNKNOWN;
        }
        String type = text.trim();

        if (type.startsWith("?")) {
            return CalorType.option(resolve(type.substring(1)));
        }

        int bang = topLevelIndexOf(type, '!');
        if (bang > 0) {
            return CalorType.result(resolve(type.substring(0, bang)), resolve(type.substring(bang + 1)));
        }

        if (type.endsWith("[]")) {
            return CalorType.array(resolve(type.substring(0, type.length() - 2)));
        }

        int lt = type.indexOf('<');
        if (lt > 0 && type.endsWith(">")) {
            String base = type.substring(0, lt);
            List<CalorType> arguments = new ArrayList<>();
            for (String argument : splitTopLevel(type.substring(lt + 1, type.length() - 1))) {
                arguments.add(resolve(argument));
            }
            if (base.equals("List") && arguments.size() == 1) {
                return CalorType.list(arguments.get(0));
            }
            if ((base.equals("Dict") || base.equals("Dictionary")) && arguments.size() == 2) {
                return CalorType.dict(arguments.get(0), arguments.get(1));
            }
            return CalorType.named(base, arguments);
        }

        CalorType primitive = PRIMITIVES.get(type);
        return primitive != null ? primitive : CalorType.named(type);
    }

    private static int topLevelIndexOf(String text, char target) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth--;
            } else if (c == target && depth == 0) {
                return i;
            }
        }
        return -1;
    }

    private static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(text.substring(start));
        return parts;
    }
}
