package com.returnlint;

import com.returnlint.ast.Node;

/**
 * Maps a flagged node to a {@link Diagnostic}. Does no filtering of its own.
 */
public final class DiagnosticEmitter {

    private final String linter;

    public DiagnosticEmitter(String linter) {
        this.linter = linter;
    }

    public Diagnostic emit(Node node, String message, Severity severity) {
        return new Diagnostic(node.loc(), message, severity, linter);
    }
}
