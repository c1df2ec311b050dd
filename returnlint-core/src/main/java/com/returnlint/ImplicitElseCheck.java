package com.returnlint;

import com.returnlint.ast.Conditional;

import java.util.List;

/**
 * Flags a terminal {@code if} without an {@code else} when implicit else is disallowed.
 */
public class ImplicitElseCheck implements TerminalCheck {

    private final DiagnosticEmitter emitter;

    public ImplicitElseCheck(DiagnosticEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public List<Diagnostic> check(TerminalPosition position) {
        if (position.enforceElse()
                && position.node() instanceof Conditional conditional
                && !conditional.hasElse()) {
            return List.of(emitter.emit(conditional, Messages.IMPLICIT_ELSE, Severity.WARNING));
        }
        return List.of();
    }
}
