package org.dxworks.hybridnote.model;

public final class LineRange {

    private final int startLine;
    private final int endLine;

    public LineRange(int startLine, int endLine) {
        if (startLine < 1) {
            throw new IllegalArgumentException("startLine must be >= 1, was " + startLine);
        }
        if (endLine < startLine) {
            throw new IllegalArgumentException("endLine " + endLine + " is before startLine " + startLine);
        }
        this.startLine = startLine;
        this.endLine = endLine;
    }

    public static LineRange of(int startLine, int endLine) {
        return new LineRange(startLine, endLine);
    }

    /**
     * Range of {@code lineCount} lines beginning at {@code startLine}.
     */
    public static LineRange starting(int startLine, int lineCount) {
        return new LineRange(startLine, startLine + lineCount - 1);
    }

    public int getStartLine() {
        return startLine;
    }

    public int getEndLine() {
        return endLine;
    }

    public int lineCount() {
        return endLine - startLine + 1;
    }

    public LineRange shift(int delta) {
        return new LineRange(startLine + delta, endLine + delta);
    }

    public boolean contains(int line) {
        return line >= startLine && line <= endLine;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LineRange other)) return false;
        return startLine == other.startLine && endLine == other.endLine;
    }

    @Override
    public int hashCode() {
        return 31 * startLine + endLine;
    }

    @Override
    public String toString() {
        return startLine + ".." + endLine;
    }
}
