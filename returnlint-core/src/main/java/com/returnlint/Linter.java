package com.returnlint;

import com.returnlint.ast.Node;

import java.util.List;

/**
 * A rule that inspects a tree and reports diagnostics. Implementations are stateless
 * and safe to share between threads.
 */
public interface Linter {

    /**
     * Name reported in {@link Diagnostic#linter()}.
     */
    String name();

    List<Diagnostic> lint(Node root);
}
