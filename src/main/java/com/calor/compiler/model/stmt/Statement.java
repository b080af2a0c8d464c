package com.calor.compiler.model.stmt;

import com.calor.compiler.model.Node;

/**
 * Closed family of statement nodes.
 */
public sealed interface Statement extends Node
        permits BindStatement, AssignStatement, ReturnStatement, IfStatement, ForStatement,
        WhileStatement, DoWhileStatement, ForeachStatement, TryStatement, ThrowStatement,
        RethrowStatement, BreakStatement, ContinueStatement, PrintStatement,
        CollectionOpStatement, MatchStatement, ExpressionStatement, UsingStatement {

    StatementKind kind();
}
