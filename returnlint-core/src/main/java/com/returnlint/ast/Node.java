package com.returnlint.ast;

import java.util.List;

/**
 * Base interface for all nodes of a parsed function body.
 *
 * <p>Trees are built once by an external parser and never mutated afterwards.</p>
 */
public sealed interface Node permits
    Block,
    Conditional,
    Call,
    PipeStage,
    OtherExpression,
    FunctionDefinition {

    NodeKind kind();
    SourceLocation loc();

    /**
     * Direct children in source order. Absent optional parts are omitted.
     */
    List<Node> children();
}
