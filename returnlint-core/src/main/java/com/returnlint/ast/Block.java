package com.returnlint.ast;

import java.util.List;

/**
 * A braced sequence of statements, e.g. {@code { a; b }}. Comments are not statements.
 */
public record Block(
    SourceLocation loc,
    List<Node> statements
) implements Node {
    public Block {
        loc = loc == null ? SourceLocation.NONE : loc;
        statements = Nodes.compact(statements);
    }

    public Node lastStatement() {
        return statements.isEmpty() ? null : statements.get(statements.size() - 1);
    }

    @Override
    public List<Node> children() {
        return statements;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BLOCK;
    }
}
