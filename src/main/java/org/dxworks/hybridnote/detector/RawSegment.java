package org.dxworks.hybridnote.detector;

import org.dxworks.hybridnote.SyntaxKind;
import org.dxworks.hybridnote.model.LineRange;

import java.util.Objects;

public final class RawSegment {

    private final SyntaxKind syntaxKind;
    private final LineRange lineRange;
    private final String rawText;
    private final DetectionRecoveryNotice notice; // nullable

    public RawSegment(SyntaxKind syntaxKind, LineRange lineRange, String rawText, DetectionRecoveryNotice notice) {
        this.syntaxKind = Objects.requireNonNull(syntaxKind, "syntaxKind");
        this.lineRange = Objects.requireNonNull(lineRange, "lineRange");
        this.rawText = Objects.requireNonNull(rawText, "rawText");
        this.notice = notice;
    }

    public SyntaxKind getSyntaxKind() {
        return syntaxKind;
    }

    public LineRange getLineRange() {
        return lineRange;
    }

    public int getStartLine() {
        return lineRange.getStartLine();
    }

    public int getEndLine() {
        return lineRange.getEndLine();
    }

    public String getRawText() {
        return rawText;
    }

    public DetectionRecoveryNotice getNotice() {
        return notice;
    }

    public boolean isRecovered() {
        return notice != null;
    }

    @Override
    public String toString() {
        return syntaxKind + "[" + lineRange + "]" + (notice != null ? " (recovered)" : "");
    }
}
