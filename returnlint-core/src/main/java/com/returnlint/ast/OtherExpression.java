package com.returnlint.ast;

import java.util.List;

/**
 * Any expression the analysis does not look inside: literals, symbols, operators,
 * assignments, loops. {@code description} is informational only (e.g. {@code "x + 1"}).
 */
public record OtherExpression(
    SourceLocation loc,
    String description,
    List<Node> operands
) implements Node {
    public OtherExpression {
        loc = loc == null ? SourceLocation.NONE : loc;
        operands = Nodes.compact(operands);
    }

    @Override
    public List<Node> children() {
        return operands;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OTHER_EXPRESSION;
    }
}
