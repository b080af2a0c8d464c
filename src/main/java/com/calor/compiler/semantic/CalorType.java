package com.calor.compiler.semantic;

import java.util.List;
import java.util.stream.Collectors;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Resolved type of a name or expression. {@link #toString()} gives the Calor shorthand.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CalorType {

    public enum Kind {
        INT,
        FLOAT,
        DECIMAL,
        STRING,
        BOOL,
        CHAR,
        VOID,
        OBJECT,
        NULL,
        OPTION,
        RESULT,
        LIST,
        DICT,
        ARRAY,
        NAMED,
        UNKNOWN
    }

    public static final CalorType I8 = integral("i8", 8, true);
    public static final CalorType I16 = integral("i16", 16, true);
    public static final CalorType I32 = integral("i32", 32, true);
    public static final CalorType I64 = integral("i64", 64, true);
    public static final CalorType U8 = integral("u8", 8, false);
    public static final CalorType U16 = integral("u16", 16, false);
    public static final CalorType U32 = integral("u32", 32, false);
    public static final CalorType U64 = integral("u64", 64, false);
    public static final CalorType F32 = new CalorType(Kind.FLOAT, "f32", 32, true, List.of());
    public static final CalorType F64 = new CalorType(Kind.FLOAT, "f64", 64, true, List.of());
    public static final CalorType DEC = new CalorType(Kind.DECIMAL, "dec", 128, true, List.of());
    public static final CalorType STR = simple(Kind.STRING, "str");
    public static final CalorType BOOL = simple(Kind.BOOL, "bool");
    public static final CalorType CHAR = simple(Kind.CHAR, "char");
    public static final CalorType VOID = simple(Kind.VOID, "void");
    public static final CalorType OBJ = simple(Kind.OBJECT, "obj");
    public static final CalorType NULL = simple(Kind.NULL, "null");
    public static final CalorType UNKNOWN = simple(Kind.UNKNOWN, "?unknown");

    Kind kind;

    /** Shorthand name for primitives, type name for NAMED, empty for constructed types. */
    String name;

    /** Width in bits for numeric kinds, otherwise 0. */
    int bits;

    boolean signed;

    List<CalorType> arguments;

    private static CalorType integral(String name, int bits, boolean signed) {
        return new CalorType(Kind.INT, name, bits, signed, List.of());
    }

    private static CalorType simple(Kind kind, String name) {
        return new CalorType(kind, name, 0, false, List.of());
    }

    public static CalorType option(CalorType payload) {
        return new CalorType(Kind.OPTION, "", 0, false, List.of(payload));
    }

    public static CalorType result(CalorType value, CalorType error) {
        return new CalorType(Kind.RESULT, "", 0, false, List.of(value, error));
    }

    public static CalorType list(CalorType element) {
        return new CalorType(Kind.LIST, "List", 0, false, List.of(element));
    }

    public static CalorType dict(CalorType key, CalorType value) {
        return new CalorType(Kind.DICT, "Dict", 0, false, List.of(key, value));
    }

    public static CalorType array(CalorType element) {
        return new CalorType(Kind.ARRAY, "", 0, false, List.of(element));
    }

    public static CalorType named(String name, List<CalorType> arguments) {
        return new CalorType(Kind.NAMED, name, 0, false, List.copyOf(arguments));
    }

    public static CalorType named(String name) {
        return named(name, List.of());
    }

    public boolean isUnknown() {
        return kind == Kind.UNKNOWN;
    }

    public boolean isIntegral() {
        return kind == Kind.INT;
    }

    public boolean isNumeric() {
        return kind == Kind.INT || kind == Kind.FLOAT || kind == Kind.DECIMAL;
    }

    public boolean isBool() {
        return kind == Kind.BOOL;
    }

    public boolean isString() {
        return kind == Kind.STRING;
    }

    /**
     * Option and Result values must be unwrapped before their payload is used.
     */
    public boolean isWrapper() {
        return kind == Kind.OPTION || kind == Kind.RESULT;
    }

    /**
     * Payload of an Option, success type of a Result, element of a List or array.
     */
    public CalorType payload() {
        return switch (kind) {
            case OPTION, RESULT, LIST, ARRAY -> arguments.get(0);
            case DICT -> arguments.get(1);
            default -> UNKNOWN;
        };
    }

    /**
     * Whether a value of type {@code source} may be stored here without an explicit conversion.
     */
    public boolean isAssignableFrom(CalorType source) {
        if (isUnknown() || source.isUnknown() || equals(source)) {
            return true;
        }
        if (kind == Kind.OBJECT) {
            return source.kind != Kind.VOID;
        }
        if (source.kind == Kind.NULL) {
            return kind != Kind.VOID && !isNumeric() && kind != Kind.BOOL && kind != Kind.CHAR;
        }
        if (kind == Kind.OPTION) {
            return payload().isAssignableFrom(source) || (source.kind == Kind.OPTION
                    && payload().isAssignableFrom(source.payload()));
        }
        if (kind == Kind.RESULT && source.kind == Kind.RESULT) {
            return arguments.get(0).isAssignableFrom(source.arguments.get(0))
                    && arguments.get(1).isAssignableFrom(source.arguments.get(1));
        }
        if (kind == Kind.NAMED || source.kind == Kind.NAMED) {
            // User and host types are not tracked structurally
            return kind != Kind.VOID && source.kind != Kind.VOID;
        }
        if (kind == source.kind && !arguments.isEmpty()) {
            for (int i = 0; i < arguments.size(); i++) {
                if (!arguments.get(i).isAssignableFrom(source.arguments.get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (isNumeric() && source.isNumeric()) {
            return isWideningFrom(source);
        }
        if (isNumeric() && source.kind == Kind.CHAR) {
            return kind != Kind.INT || bits >= 16 && (bits > 16 || !signed);
        }
        return false;
    }

    /**
     * True when both are numeric and the conversion would lose range or precision.
     */
    public boolean isNarrowingFrom(CalorType source) {
        return isNumeric() && source.isNumeric() && !isWideningFrom(source);
    }

    private boolean isWideningFrom(CalorType source) {
        if (kind == Kind.DECIMAL) {
            return source.kind == Kind.INT || source.kind == Kind.DECIMAL;
        }
        if (kind == Kind.FLOAT) {
            return source.kind == Kind.INT || source.kind == Kind.FLOAT && bits >= source.bits;
        }
        if (kind == Kind.INT && source.kind == Kind.INT) {
            if (signed == source.signed) {
                return bits >= source.bits;
            }
            return signed && bits > source.bits;
        }
        return false;
    }

    /**
     * Whether the integer constant {@code value} fits this integral type.
     */
    public boolean fits(long value) {
        if (kind != Kind.INT) {
            return isNumeric();
        }
        if (!signed) {
            return value >= 0 && (bits == 64 || value < (1L << bits));
        }
        if (bits == 64) {
            return true;
        }
        long limit = 1L << (bits - 1);
        return value >= -limit && value < limit;
    }

    /**
     * Result type of an arithmetic operator applied to two numeric operands.
     */
    public static CalorType promote(CalorType a, CalorType b) {
        if (a.kind == Kind.DECIMAL || b.kind == Kind.DECIMAL) {
            return DEC;
        }
        if (a.kind == Kind.FLOAT || b.kind == Kind.FLOAT) {
            return a.kind == Kind.FLOAT && a.bits == 64 || b.kind == Kind.FLOAT && b.bits == 64 ? F64 : F32;
        }
        int width = Math.max(32, Math.max(a.bits, b.bits));
        if (a.signed && b.signed) {
            return width == 64 ? I64 : I32;
        }
        if (!a.signed && !b.signed) {
            if (width == 64) {
                return U64;
            }
            return Math.max(a.bits, b.bits) == 32 ? U32 : I32;
        }
        CalorType unsigned = a.signed ? b : a;
        return unsigned.bits >= 32 || width == 64 ? I64 : I32;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case OPTION -> "?" + arguments.get(0);
            case RESULT -> arguments.get(0) + "!" + arguments.get(1);
            case ARRAY -> arguments.get(0) + "[]";
            case LIST, DICT, NAMED -> arguments.isEmpty() ? name
                    : name + "<" + arguments.stream().map(CalorType::toString).collect(Collectors.joining(",")) + ">";
            default -> name;
        };
    }
}
