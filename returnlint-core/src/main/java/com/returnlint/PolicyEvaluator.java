package com.returnlint;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs every {@link TerminalCheck} over each terminal position. The checks do not
 * suppress each other, so one position can yield several diagnostics.
 */
public class PolicyEvaluator {

    private final List<TerminalCheck> checks;

    public PolicyEvaluator(Policy policy, DiagnosticEmitter emitter) {
        this(List.of(new ReturnStyleCheck(policy, emitter), new ImplicitElseCheck(emitter)));
    }

    public PolicyEvaluator(List<TerminalCheck> checks) {
        this.checks = List.copyOf(checks);
    }

    public List<Diagnostic> evaluate(TerminalPosition position) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (TerminalCheck check : checks) {
            diagnostics.addAll(check.check(position));
        }
        return diagnostics;
    }

    /**
     * Evaluates positions in the order given; output follows the same order.
     */
    public List<Diagnostic> evaluate(List<TerminalPosition> positions) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (TerminalPosition position : positions) {
            diagnostics.addAll(evaluate(position));
        }
        return diagnostics;
    }
}
