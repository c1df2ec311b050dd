package com.returnlint.ast;

import java.util.List;

/**
 * A function call. {@code callee} is the called symbol, or null when the callee
 * is itself an expression such as {@code f()()} or {@code fns[[1]]()}.
 */
public record Call(
    SourceLocation loc,
    String callee,
    List<Node> arguments
) implements Node {
    public Call {
        loc = loc == null ? SourceLocation.NONE : loc;
        arguments = Nodes.compact(arguments);
    }

    public boolean calls(String name) {
        return callee != null && callee.equals(name);
    }

    @Override
    public List<Node> children() {
        return arguments;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CALL;
    }
}
