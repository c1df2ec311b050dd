package com.returnlint;

import com.returnlint.ast.*;

import java.util.Arrays;
import java.util.List;

/**
 * Shorthand for building trees in tests. Spans are given explicitly so assertions
 * can check where a lint lands.
 */
final class Trees {

    private Trees() {
    }

    static SourceLocation loc(int startLine, int startCol, int endLine, int endCol) {
        return SourceLocation.of(startLine, startCol, endLine, endCol);
    }

    static Block block(SourceLocation loc, Node... statements) {
        return new Block(loc, Arrays.asList(statements));
    }

    static Call call(SourceLocation loc, String callee, Node... arguments) {
        return new Call(loc, callee, Arrays.asList(arguments));
    }

    static OtherExpression expr(SourceLocation loc, String description, Node... operands) {
        return new OtherExpression(loc, description, Arrays.asList(operands));
    }

    static Conditional ifThen(SourceLocation loc, Node condition, Node thenBranch) {
        return new Conditional(loc, condition, thenBranch, null);
    }

    static Conditional ifElse(SourceLocation loc, Node condition, Node thenBranch, Node elseBranch) {
        return new Conditional(loc, condition, thenBranch, elseBranch);
    }

    static PipeStage pipe(SourceLocation loc, Node lhs, Node rhs) {
        return new PipeStage(loc, PipeStage.MAGRITTR, lhs, rhs);
    }

    static FunctionDefinition function(SourceLocation loc, String name, Node body) {
        return new FunctionDefinition(loc, name, false, List.of("x"), body);
    }

    /**
     * {@code name <- function(x) body}, the way the parser hands over named functions.
     */
    static OtherExpression assign(SourceLocation loc, String name, FunctionDefinition function) {
        return expr(loc, name + " <- function", expr(loc(loc.start().line(), loc.start().column(),
            loc.start().line(), loc.start().column() + name.length() - 1), name), function);
    }

    static OtherExpression symbol(SourceLocation loc, String name) {
        return expr(loc, name);
    }

    /** {@code function(x) {\n  return(x + 1)\n}} */
    static FunctionDefinition explicitReturnFunction(String name) {
        Call ret = call(loc(2, 3, 2, 15), "return", expr(loc(2, 10, 2, 14), "x + 1"));
        return function(loc(1, 1, 3, 1), name, block(loc(1, 13, 3, 1), ret));
    }

    /** {@code function(x) {\n  x + 1\n}} */
    static FunctionDefinition implicitReturnFunction(String name) {
        return function(loc(1, 1, 3, 1), name, block(loc(1, 13, 3, 1), expr(loc(2, 3, 2, 7), "x + 1")));
    }
}
