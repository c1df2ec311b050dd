package com.returnlint;

import java.util.List;

/**
 * One independent rule applied to each terminal position.
 */
@FunctionalInterface
public interface TerminalCheck {

    /**
     * Returns the diagnostics for {@code position}, possibly none.
     */
    List<Diagnostic> check(TerminalPosition position);
}
