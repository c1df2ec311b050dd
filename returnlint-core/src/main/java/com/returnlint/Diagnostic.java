package com.returnlint;

import com.returnlint.ast.SourceLocation;

/**
 * A positioned lint, handed to whatever aggregates and prints results.
 */
public record Diagnostic(
    SourceLocation loc,
    String message,
    Severity severity,
    String linter
) {
    @Override
    public String toString() {
        return loc + " [" + severity.label() + "] " + message + " (" + linter + ")";
    }
}
