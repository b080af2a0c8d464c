package com.calor.compiler.model.decl;

import java.util.List;

import com.calor.compiler.model.ContractClause;
import com.calor.compiler.model.EffectSet;
import com.calor.compiler.model.Parameter;
import com.calor.compiler.model.Visibility;
import com.calor.compiler.model.stmt.Statement;
import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * Module function, class method or interface method signature (empty body).
 */
@Value
public class FunctionDeclaration implements Declaration {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    String id;

    @NonNull
    String name;

    @NonNull
    Visibility visibility;

    boolean async;

    /** True for class and interface members ({@code §MT}) rather than module functions ({@code §F}). */
    boolean method;

    /** Method modifiers such as {@code static}, {@code virtual}, {@code override}, {@code abstract}. */
    @NonNull
    List<String> modifiers;

    @NonNull
    List<Parameter> parameters;

    /** Null for void. */
    String returnType;

    @NonNull
    EffectSet effects;

    @NonNull
    List<ContractClause> preconditions;

    @NonNull
    List<ContractClause> postconditions;

    @NonNull
    List<Statement> body;

    @Override
    public DeclarationKind kind() {
        return DeclarationKind.FUNCTION;
    }
}
