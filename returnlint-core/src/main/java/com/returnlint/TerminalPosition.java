package com.returnlint;

import com.returnlint.ast.Node;

/**
 * A node in terminal position, together with whether a missing {@code else}
 * should be reported for it.
 */
public record TerminalPosition(Node node, boolean enforceElse) {
}
