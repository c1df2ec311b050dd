package com.returnlint.ast;

import java.util.ArrayList;
import java.util.List;

public record Conditional(
    SourceLocation loc,
    Node condition,
    Node thenBranch,
    Node elseBranch  // Can be null
) implements Node {
    public Conditional {
        loc = loc == null ? SourceLocation.NONE : loc;
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public List<Node> children() {
        List<Node> children = new ArrayList<>(3);
        if (condition != null) children.add(condition);
        if (thenBranch != null) children.add(thenBranch);
        if (elseBranch != null) children.add(elseBranch);
        return List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CONDITIONAL;
    }
}
