package com.calor.compiler.model.decl;

import java.util.List;

import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

@Value
public class EnumExtensionDeclaration implements Declaration {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    String id;

    @NonNull
    String enumName;

    @NonNull
    List<FunctionDeclaration> methods;

    @Override
    public String getName() {
        return enumName + "Extensions";
    }

    @Override
    public DeclarationKind kind() {
        return DeclarationKind.ENUM_EXTENSION;
    }
}
