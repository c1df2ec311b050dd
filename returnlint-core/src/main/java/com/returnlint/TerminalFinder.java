package com.returnlint;

import com.returnlint.ast.Block;
import com.returnlint.ast.Conditional;
import com.returnlint.ast.FunctionDefinition;
import com.returnlint.ast.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Enumerates the terminal positions of a function body: the nodes whose value can
 * become the function's result when control falls off the end.
 *
 * <ul>
 *   <li>Block: the last statement, or the block itself when it is empty.</li>
 *   <li>Conditional: the terminals of each branch. A conditional without an
 *       {@code else} is recorded too, before its branches.</li>
 *   <li>Anything else is terminal as a whole.</li>
 * </ul>
 *
 * <p>Malformed input degrades by omission: a missing branch or body yields no terminals.</p>
 */
public class TerminalFinder {

    private final Policy policy;

    public TerminalFinder(Policy policy) {
        this.policy = policy;
    }

    /**
     * Terminal positions of {@code function}, in pre-order. Empty when the function
     * is exempted by name, or when the explicit style meets an unbraced body such as
     * {@code function(x) x + 1}. Functions nested in the body are not entered.
     */
    public List<TerminalPosition> findTerminals(FunctionDefinition function) {
        if (policy.isExempt(function.name())) {
            return List.of();
        }
        if (policy.style() == ReturnStyle.EXPLICIT && !(function.body() instanceof Block)) {
            return List.of();
        }
        return findTerminals(function.body(), !policy.allowImplicitElse());
    }

    /**
     * Terminal positions of an arbitrary body node.
     */
    public List<TerminalPosition> findTerminals(Node body, boolean enforceElse) {
        List<TerminalPosition> terminals = new ArrayList<>();
        collect(body, enforceElse, terminals);
        return terminals;
    }

    private void collect(Node node, boolean enforceElse, List<TerminalPosition> out) {
        if (node == null) {
            return;
        }
        if (node instanceof Block block) {
            Node last = block.lastStatement();
            if (last == null) {
                out.add(new TerminalPosition(block, enforceElse));
            } else {
                collect(last, enforceElse, out);
            }
        } else if (node instanceof Conditional conditional) {
            if (!conditional.hasElse()) {
                out.add(new TerminalPosition(conditional, enforceElse));
            }
            collect(conditional.thenBranch(), enforceElse, out);
            collect(conditional.elseBranch(), enforceElse, out);
        } else {
            // Call, PipeStage, OtherExpression, FunctionDefinition
            out.add(new TerminalPosition(node, enforceElse));
        }
    }
}
