package com.calor.compiler.semantic;

import java.util.List;

import com.calor.compiler.model.Span;

import lombok.NonNull;
import lombok.Value;

/**
 * A named entity visible in a {@link Scope}.
 */
@Value
public class Symbol {

    public enum Kind {
        LOCAL,
        PARAMETER,
        FIELD,
        FUNCTION,
        TYPE,
        CONTRACT_RESULT
    }

    @NonNull
    String name;

    @NonNull
    Kind kind;

    @NonNull
    CalorType type;

    boolean mutable;

    /** Parameter types, for FUNCTION symbols only. */
    @NonNull
    List<CalorType> parameterTypes;

    Span span;

    public static Symbol variable(String name, Kind kind, CalorType type, boolean mutable, Span span) {
        return new Symbol(name, kind, type, mutable, List.of(), span);
    }

    public static Symbol function(String name, List<CalorType> parameterTypes, CalorType returnType, Span span) {
        return new Symbol(name, Kind.FUNCTION, returnType, false, List.copyOf(parameterTypes), span);
    }
}
