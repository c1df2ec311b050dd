package com.returnlint;

import com.returnlint.ast.Call;
import com.returnlint.ast.Node;
import com.returnlint.ast.PipeStage;

import java.util.Optional;

/**
 * Finds the call that actually produces a terminal's value.
 *
 * <p>For {@code x %>% f() %>% return()} the statement's top node is a pipe stage,
 * but the value comes from the last stage, {@code return()}.</p>
 */
public final class PipeChainResolver {

    private PipeChainResolver() {
        // Utility class
    }

    /**
     * The final stage of a pipe chain, or {@code node} itself when it is not a pipe.
     * Returns null if the chain's last stage is missing.
     */
    public static Node finalStage(Node node) {
        Node current = node;
        while (current instanceof PipeStage stage) {
            current = stage.rhs();
        }
        return current;
    }

    /**
     * The call evaluated last by {@code terminal}, if it is a call at all.
     */
    public static Optional<Call> resolveCallTarget(Node terminal) {
        return finalStage(terminal) instanceof Call call ? Optional.of(call) : Optional.empty();
    }

    /**
     * True for a {@code %>%} chain. Native {@code |>} chains are plain calls once parsed.
     */
    public static boolean isMagrittrChain(Node node) {
        return node instanceof PipeStage stage && stage.usesMagrittr();
    }
}
