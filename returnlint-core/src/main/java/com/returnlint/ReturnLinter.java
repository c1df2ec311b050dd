package com.returnlint;

import com.returnlint.ast.FunctionDefinition;
import com.returnlint.ast.Node;
import com.returnlint.ast.Nodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks the terminal positions of every function in a tree against a {@link Policy}.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Policy policy = Policy.builder().style(ReturnStyle.EXPLICIT).build();
 * List<Diagnostic> lints = new ReturnLinter(policy).lint(tree);
 * }</pre>
 *
 * <p>Each function is analysed on its own: exempting a function by name never
 * exempts the functions defined inside it.</p>
 */
public class ReturnLinter implements Linter {

    public static final String NAME = "return_linter";

    private static final Logger LOG = LoggerFactory.getLogger(ReturnLinter.class);

    private final Policy policy;
    private final TerminalFinder finder;
    private final PolicyEvaluator evaluator;

    public ReturnLinter(Policy policy) {
        this.policy = policy;
        this.finder = new TerminalFinder(policy);
        this.evaluator = new PolicyEvaluator(policy, new DiagnosticEmitter(NAME));
    }

    public ReturnLinter() {
        this(Policy.defaults());
    }

    @Override
    public String name() {
        return NAME;
    }

    public Policy policy() {
        return policy;
    }

    /**
     * Lints every function definition found in {@code root}, outer functions first.
     */
    @Override
    public List<Diagnostic> lint(Node root) {
        List<FunctionDefinition> functions = Nodes.functions(root);
        LOG.debug("Found {} function definition(s) under {}", functions.size(), root == null ? null : root.loc());
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (FunctionDefinition function : functions) {
            diagnostics.addAll(lintFunction(function));
        }
        return diagnostics;
    }

    /**
     * Lints the body of a single function. Nested functions are not visited.
     */
    public List<Diagnostic> lintFunction(FunctionDefinition function) {
        if (policy.isExempt(function.name())) {
            LOG.debug("Skipping exempt function '{}' at {}", function.name(), function.loc());
        }
        return evaluator.evaluate(finder.findTerminals(function));
    }
}
