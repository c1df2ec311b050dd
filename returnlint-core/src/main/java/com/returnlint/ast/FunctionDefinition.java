package com.returnlint.ast;

import java.util.List;

/**
 * A {@code function(...)} or {@code \(...)} literal.
 *
 * <p>{@code name} is the symbol the function is assigned to ({@code f <- function(x) ...}),
 * or null for anonymous functions.</p>
 */
public record FunctionDefinition(
    SourceLocation loc,
    String name,  // Can be null
    boolean lambda,
    List<String> parameters,
    Node body
) implements Node {
    public FunctionDefinition {
        loc = loc == null ? SourceLocation.NONE : loc;
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    @Override
    public List<Node> children() {
        return body == null ? List.of() : List.of(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FUNCTION_DEFINITION;
    }
}
