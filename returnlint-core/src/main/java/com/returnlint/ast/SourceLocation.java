package com.returnlint.ast;

/**
 * Source span of a node: 1-based lines, 1-based columns, end inclusive.
 */
public record SourceLocation(Position start, Position end) {

    public static final SourceLocation NONE = new SourceLocation(new Position(0, 0), new Position(0, 0));

    public record Position(int line, int column) {
    }

    public static SourceLocation of(int startLine, int startCol, int endLine, int endCol) {
        return new SourceLocation(new Position(startLine, startCol), new Position(endLine, endCol));
    }

    @Override
    public String toString() {
        return start.line + ":" + start.column + "-" + end.line + ":" + end.column;
    }
}
