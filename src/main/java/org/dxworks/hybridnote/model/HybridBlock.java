package org.dxworks.hybridnote.model;

import org.dxworks.hybridnote.SyntaxKind;
import org.dxworks.hybridnote.detector.DetectionRecoveryNotice;
import org.dxworks.hybridnote.detector.Lines;
import org.dxworks.hybridnote.parser.BlockParseException;
import org.dxworks.hybridnote.parser.BlockParser;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * One typed unit of a hybrid document.
 *
 * The raw text is authoritative. The AST and metadata are derived from it by the block's parser and
 * go stale when the text or metadata is edited; the block is then dirty until it is parsed again.
 * A block whose parser rejected its text keeps the text, has no AST and carries the parse error.
 */
public class HybridBlock {

    private final SyntaxKind syntaxKind;
    private String rawText;
    private BlockAst ast; // null until parsed, or after a parse failure
    private BlockParser parser; // renders ast
    private BlockMetadata metadata;
    private LineRange lineRange;
    private boolean dirty;
    private BlockParseException parseError;
    private DetectionRecoveryNotice notice;

    public HybridBlock(SyntaxKind syntaxKind, String rawText, BlockAst ast, BlockMetadata metadata, LineRange lineRange) {
        this.syntaxKind = Objects.requireNonNull(syntaxKind, "syntaxKind");
        this.rawText = requireText(rawText);
        this.ast = ast;
        this.metadata = metadata == null ? BlockMetadata.empty() : metadata;
        this.lineRange = lineRange == null ? LineRange.starting(1, Lines.count(rawText)) : lineRange;
        requireMatchingRange(this.rawText, this.lineRange);
        this.dirty = ast == null;
    }

    /**
     * A block that has not been parsed yet; it starts dirty.
     */
    public static HybridBlock unparsed(SyntaxKind syntaxKind, String rawText, LineRange lineRange) {
        return new HybridBlock(syntaxKind, rawText, null, BlockMetadata.empty(), lineRange);
    }

    public SyntaxKind getSyntaxKind() {
        return syntaxKind;
    }

    public String getRawText() {
        return rawText;
    }

    /**
     * The parsed structure, or {@code null} when the block was never parsed or its parser failed.
     * May be stale while the block is dirty.
     */
    public BlockAst getAst() {
        return ast;
    }

    public BlockMetadata getMetadata() {
        return metadata;
    }

    public LineRange getLineRange() {
        return lineRange;
    }

    public boolean isDirty() {
        return dirty;
    }

    /**
     * The parser whose output {@link #getAst()} is; {@code null} when the AST was supplied directly.
     */
    public BlockParser getParser() {
        return parser;
    }

    public BlockParseException getParseError() {
        return parseError;
    }

    public boolean hasParseError() {
        return parseError != null;
    }

    public DetectionRecoveryNotice getNotice() {
        return notice;
    }

    public void setNotice(DetectionRecoveryNotice notice) {
        this.notice = notice;
    }

    public boolean isHeading() {
        return metadata.getHeadingLevel() != null;
    }

    public Integer headingLevel() {
        return metadata.getHeadingLevel();
    }

    public String todoState() {
        return metadata.getTodoState();
    }

    public boolean isTodo() {
        return "TODO".equals(metadata.getTodoState());
    }

    public boolean isDone() {
        return "DONE".equals(metadata.getTodoState());
    }

    public String id() {
        return metadata.getId();
    }

    public String property(String key) {
        return metadata.getProperty(key);
    }

    public boolean hasProperties() {
        return !metadata.getProperties().isEmpty();
    }

    public int lineCount() {
        return lineRange.lineCount();
    }

    public boolean isSyntax(SyntaxKind kind) {
        return syntaxKind.equals(kind);
    }

    public void clearDirty() {
        this.dirty = false;
    }

    public void markDirty() {
        this.dirty = true;
    }

    /**
     * Stores a successful parse of the current raw text by {@code owner}, which also renders it.
     */
    public void applyParseResult(BlockParser owner, BlockAst parsedAst, BlockMetadata parsedMetadata) {
        this.parser = Objects.requireNonNull(owner, "owner");
        this.ast = Objects.requireNonNull(parsedAst, "parsedAst");
        this.metadata = Objects.requireNonNull(parsedMetadata, "parsedMetadata");
        this.parseError = null;
        this.dirty = false;
    }

    /**
     * Records that the parser rejected the current raw text. The text and line range stay as they are.
     */
    public void applyParseFailure(BlockParseException error) {
        this.parseError = Objects.requireNonNull(error, "error");
        this.ast = null;
        this.parser = null;
        this.metadata = BlockMetadata.empty();
        this.dirty = false;
    }

    /**
     * Replaces the metadata by hand; the block is dirty afterwards.
     */
    public void patchMetadata(UnaryOperator<BlockMetadata> patch) {
        BlockMetadata patched = patch.apply(metadata);
        this.metadata = Objects.requireNonNull(patched, "patched metadata");
        this.dirty = true;
    }

    void updateRawText(String text, LineRange range) {
        requireMatchingRange(requireText(text), range);
        this.rawText = text;
        this.lineRange = range;
        this.dirty = true;
        // the detected segment and any failure describe the old text
        this.notice = null;
        this.parseError = null;
    }

    void relocate(LineRange range) {
        requireMatchingRange(rawText, range);
        int delta = range.getStartLine() - lineRange.getStartLine();
        this.lineRange = range;
        if (notice != null && delta != 0) {
            this.notice = notice.shift(delta);
        }
    }

    private static String requireText(String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Block text must not be empty");
        }
        return text;
    }

    private static void requireMatchingRange(String text, LineRange range) {
        if (range.lineCount() != Lines.count(text)) {
            throw new IllegalArgumentException("Line range " + range + " does not match "
                    + Lines.count(text) + " line(s) of text");
        }
    }

    @Override
    public String toString() {
        return syntaxKind + "[" + lineRange + "]" + (dirty ? " dirty" : "") + (parseError != null ? " failed" : "");
    }
}
