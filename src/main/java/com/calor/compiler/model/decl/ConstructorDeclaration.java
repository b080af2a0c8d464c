package com.calor.compiler.model.decl;

import java.util.List;

import com.calor.compiler.model.ContractClause;
import com.calor.compiler.model.Parameter;
import com.calor.compiler.model.Visibility;
import com.calor.compiler.model.stmt.Statement;
import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

@Value
public class ConstructorDeclaration implements Declaration {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    String id;

    /** Name of the declaring class, filled in by the parser. */
    @NonNull
    String name;

    @NonNull
    Visibility visibility;

    @NonNull
    List<Parameter> parameters;

    @NonNull
    List<ContractClause> preconditions;

    ConstructorInitializer initializer;

    @NonNull
    List<Statement> body;

    @Override
    public DeclarationKind kind() {
        return DeclarationKind.CONSTRUCTOR;
    }
}
