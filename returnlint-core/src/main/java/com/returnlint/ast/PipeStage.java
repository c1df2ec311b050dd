package com.returnlint.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * One application of a pipe operator: {@code lhs %>% rhs}.
 *
 * <p>Chains are usually left-nested ({@code (a %>% b) %>% c}) but a right-nested
 * shape ({@code a %>% (b %>% c)}) is also accepted; in both cases the final stage
 * is reached by following {@code rhs}.</p>
 */
public record PipeStage(
    SourceLocation loc,
    String operator,
    Node lhs,
    Node rhs
) implements Node {

    public static final String MAGRITTR = "%>%";
    public static final String NATIVE = "|>";

    public PipeStage {
        loc = loc == null ? SourceLocation.NONE : loc;
    }

    public boolean usesMagrittr() {
        return MAGRITTR.equals(operator);
    }

    @Override
    public List<Node> children() {
        List<Node> children = new ArrayList<>(2);
        if (lhs != null) children.add(lhs);
        if (rhs != null) children.add(rhs);
        return List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PIPE_STAGE;
    }
}
