package org.dxworks.hybridnote.detector;

import org.dxworks.hybridnote.SyntaxKind;

import java.util.Objects;

public final class DetectionRecoveryNotice {

    private final SyntaxKind syntaxKind;
    private final int openingLine;
    private final int lastLine;
    private final String expectedClosingMarker;

    public DetectionRecoveryNotice(SyntaxKind syntaxKind, int openingLine, int lastLine, String expectedClosingMarker) {
        this.syntaxKind = Objects.requireNonNull(syntaxKind, "syntaxKind");
        this.openingLine = openingLine;
        this.lastLine = lastLine;
        this.expectedClosingMarker = Objects.requireNonNull(expectedClosingMarker, "expectedClosingMarker");
    }

    public SyntaxKind getSyntaxKind() {
        return syntaxKind;
    }

    public int getOpeningLine() {
        return openingLine;
    }

    public int getLastLine() {
        return lastLine;
    }

    public String getExpectedClosingMarker() {
        return expectedClosingMarker;
    }

    /**
     * Same notice for a block that moved by {@code delta} lines.
     */
    public DetectionRecoveryNotice shift(int delta) {
        return new DetectionRecoveryNotice(syntaxKind, openingLine + delta, lastLine + delta, expectedClosingMarker);
    }

    public String getMessage() {
        return "Unterminated " + syntaxKind.displayName() + " block opened at line " + openingLine
                + " (expected " + expectedClosingMarker + "); closed at end of document, line " + lastLine;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DetectionRecoveryNotice other)) return false;
        return openingLine == other.openingLine
                && lastLine == other.lastLine
                && syntaxKind.equals(other.syntaxKind)
                && expectedClosingMarker.equals(other.expectedClosingMarker);
    }

    @Override
    public int hashCode() {
        return Objects.hash(syntaxKind, openingLine, lastLine, expectedClosingMarker);
    }

    @Override
    public String toString() {
        return getMessage();
    }
}
