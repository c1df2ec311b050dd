package com.returnlint.ast;

public enum NodeKind {
    BLOCK,
    CONDITIONAL,
    CALL,
    PIPE_STAGE,
    OTHER_EXPRESSION,
    FUNCTION_DEFINITION
}
