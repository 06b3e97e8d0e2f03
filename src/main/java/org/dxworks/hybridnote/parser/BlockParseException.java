package org.dxworks.hybridnote.parser;

public class BlockParseException extends Exception {

    private final int line; // 1-indexed document line, 0 when unknown

    public BlockParseException(String message, int line) {
        super(line > 0 ? "Syntax error at line " + line + ": " + message : message);
        this.line = line;
    }

    public BlockParseException(String message, int line, Throwable cause) {
        super(line > 0 ? "Syntax error at line " + line + ": " + message : message, cause);
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}
