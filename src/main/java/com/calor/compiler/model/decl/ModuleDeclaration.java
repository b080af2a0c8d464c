package com.calor.compiler.model.decl;

import java.util.List;

import com.calor.compiler.model.ContractClause;
import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * AST root. Owns every declaration of one compilation unit.
 */
@Value
public class ModuleDeclaration implements Declaration {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    String id;

    @NonNull
    String name;

    @NonNull
    List<UsingDirective> usings;

    /** Top-level declarations in source order. */
    @NonNull
    List<Declaration> members;

    @NonNull
    List<ContractClause> invariants;

    @Override
    public DeclarationKind kind() {
        return DeclarationKind.MODULE;
    }
}
