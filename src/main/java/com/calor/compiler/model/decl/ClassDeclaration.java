package com.calor.compiler.model.decl;

import java.util.List;

import com.calor.compiler.model.ContractClause;
import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

@Value
public class ClassDeclaration implements Declaration {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    String id;

    @NonNull
    String name;

    /** Class modifiers: {@code abstract}, {@code sealed}, {@code static}, {@code partial}. */
    @NonNull
    List<String> modifiers;

    String baseClass;

    @NonNull
    List<String> interfaces;

    /** Fields, properties, constructors, methods and events in source order. */
    @NonNull
    List<Declaration> members;

    @NonNull
    List<ContractClause> invariants;

    @Override
    public DeclarationKind kind() {
        return DeclarationKind.CLASS;
    }
}
