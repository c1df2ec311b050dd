package com.returnlint;

import com.returnlint.ast.Call;
import com.returnlint.ast.Node;
import com.returnlint.ast.Nodes;
import com.returnlint.ast.PipeStage;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags magrittr pipelines that end in {@code return()} anywhere in a tree, not only
 * in terminal position. Independent of the return-style policy.
 */
public class PipeReturnLinter implements Linter {

    public static final String NAME = "pipe_return_linter";

    private final DiagnosticEmitter emitter = new DiagnosticEmitter(NAME);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Diagnostic> lint(Node root) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        // Inner stages of an already reported chain
        Map<Node, Boolean> covered = new IdentityHashMap<>();
        for (Node node : Nodes.preOrder(root)) {
            if (!(node instanceof PipeStage stage) || !stage.usesMagrittr() || covered.containsKey(stage)) {
                continue;
            }
            markChain(stage, covered);
            Node last = PipeChainResolver.finalStage(stage);
            if (last instanceof Call call && call.calls("return")) {
                diagnostics.add(emitter.emit(call, Messages.PIPE_RETURN, Severity.WARNING));
            }
        }
        return diagnostics;
    }

    private static void markChain(PipeStage stage, Map<Node, Boolean> covered) {
        covered.put(stage, Boolean.TRUE);
        if (stage.lhs() instanceof PipeStage left) {
            markChain(left, covered);
        }
        if (stage.rhs() instanceof PipeStage right) {
            markChain(right, covered);
        }
    }
}
