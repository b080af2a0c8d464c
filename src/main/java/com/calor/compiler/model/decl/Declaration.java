package com.calor.compiler.model.decl;

import com.calor.compiler.model.Node;

/**
 * Closed family of declaration nodes.
 */
public sealed interface Declaration extends Node
        permits ModuleDeclaration, FunctionDeclaration, ClassDeclaration, InterfaceDeclaration,
        EnumDeclaration, EnumExtensionDeclaration, RecordDeclaration, UnionTypeDeclaration,
        FieldDeclaration, PropertyDeclaration, ConstructorDeclaration, DelegateDeclaration,
        EventDeclaration {

    DeclarationKind kind();

    /**
     * Source ID of the declaration, or null for kinds that carry none (fields).
     */
    String getId();

    String getName();
}
