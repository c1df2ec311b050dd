package com.returnlint;

import com.returnlint.ast.Block;
import com.returnlint.ast.Call;
import com.returnlint.ast.Conditional;
import com.returnlint.ast.Node;

import java.util.List;
import java.util.Optional;

/**
 * Checks a terminal against the configured return style.
 *
 * <p>Implicit style flags a terminal {@code return()} call, including one that is the
 * last stage of a pipe chain. Explicit style flags any terminal whose final call is
 * not one of the policy's return functions; empty bodies and plain values included.</p>
 */
public class ReturnStyleCheck implements TerminalCheck {

    private final Policy policy;
    private final DiagnosticEmitter emitter;

    public ReturnStyleCheck(Policy policy, DiagnosticEmitter emitter) {
        this.policy = policy;
        this.emitter = emitter;
    }

    @Override
    public List<Diagnostic> check(TerminalPosition position) {
        Node node = position.node();
        // A conditional is recorded only for the else check; its branches carry the values
        if (node instanceof Conditional) {
            return List.of();
        }
        return switch (policy.style()) {
            case IMPLICIT -> checkImplicit(node);
            case EXPLICIT -> checkExplicit(node);
        };
    }

    private List<Diagnostic> checkImplicit(Node node) {
        if (node instanceof Block) {
            return List.of();
        }
        Optional<Call> target = PipeChainResolver.resolveCallTarget(node);
        if (target.isEmpty() || !target.get().calls("return")) {
            return List.of();
        }
        String message = PipeChainResolver.isMagrittrChain(node) ? Messages.PIPE_RETURN : Messages.IMPLICIT_RETURN;
        return List.of(emitter.emit(target.get(), message, Severity.STYLE));
    }

    private List<Diagnostic> checkExplicit(Node node) {
        Optional<Call> target = PipeChainResolver.resolveCallTarget(node);
        if (target.isPresent() && policy.isReturnFunction(target.get().callee())) {
            return List.of();
        }
        return List.of(emitter.emit(node, Messages.EXPLICIT_RETURN, Severity.WARNING));
    }
}
