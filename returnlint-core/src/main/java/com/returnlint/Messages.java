package com.returnlint;

/**
 * Lint messages. Kept verbatim so existing suppressions and tooling keep matching.
 */
public final class Messages {

    public static final String IMPLICIT_RETURN =
        "Use implicit return behavior; explicit return() is not needed.";

    public static final String EXPLICIT_RETURN =
        "All functions must have an explicit return().";

    public static final String IMPLICIT_ELSE =
        "All functions with terminal if statements must have a corresponding terminal else clause";

    public static final String PIPE_RETURN =
        "Avoid return() as the final step of a magrittr pipeline. " +
        "Instead, assign the output of the pipeline to a well-named object and return that.";

    private Messages() {
    }
}
