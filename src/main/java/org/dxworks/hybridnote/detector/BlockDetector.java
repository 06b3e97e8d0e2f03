package org.dxworks.hybridnote.detector;

import org.dxworks.hybridnote.HybridConfig;
import org.dxworks.hybridnote.SyntaxKind;
import org.dxworks.hybridnote.model.LineRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a document into contiguous raw segments by block markers, without looking inside blocks.
 *
 * Recognised markers (matched on the trimmed line):
 * - {@code #+BEGIN_<name>} ... {@code #+END_<name>} (case-insensitive) as Org
 * - {@code ```lang} ... {@code ```} as Code
 * - {@code $$} ... {@code $$} or {@code \[} ... {@code \]} as LaTeX; a line holding two {@code $$} is a
 *   complete one-line block
 *
 * Everything else is prose, tagged with the configured prose syntax. Markers inside an open special
 * block are content of that block. Segments cover every input line exactly once, in order.
 */
public class BlockDetector {

    private static final Logger logger = LoggerFactory.getLogger(BlockDetector.class);

    private static final Pattern ORG_BEGIN = Pattern.compile("^#\\+BEGIN_(\\S+).*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ORG_END = Pattern.compile("^#\\+END_(\\S+).*$", Pattern.CASE_INSENSITIVE);
    private static final String CODE_FENCE = "```";
    private static final String DISPLAY_MATH = "$$";
    private static final String BRACKET_OPEN = "\\[";
    private static final String BRACKET_CLOSE = "\\]";

    private final boolean strict;
    private final boolean splitOnBlankLines;
    private final SyntaxKind proseSyntax;

    public BlockDetector() {
        this(HybridConfig.defaults());
    }

    public BlockDetector(HybridConfig config) {
        this.strict = config.isStrictDetection();
        this.splitOnBlankLines = config.isSplitMarkdownOnBlankLines();
        this.proseSyntax = config.getProseSyntax();
    }

    public SyntaxKind getProseSyntax() {
        return proseSyntax;
    }

    /**
     * Scans a whole document. Empty text gives no segments.
     *
     * @throws UnterminatedBlockException only in strict mode, when a special block is never closed
     */
    public List<RawSegment> scan(String documentText) {
        return scanBlock(documentText, 1);
    }

    /**
     * Scans text that starts at document line {@code firstLine}; used to re-detect a single block in place.
     */
    public List<RawSegment> scanBlock(String text, int firstLine) {
        if (firstLine < 1) {
            throw new IllegalArgumentException("firstLine must be >= 1, was " + firstLine);
        }
        Scan scan = new Scan(firstLine);
        List<String> lines = Lines.split(text);
        for (int i = 0; i < lines.size(); i++) {
            scan.accept(lines.get(i), firstLine + i);
        }
        scan.finish(firstLine + lines.size() - 1);
        return scan.segments;
    }

    private static boolean isFenceOpen(String trimmed) {
        return trimmed.startsWith(CODE_FENCE);
    }

    private static String fenceLanguage(String trimmed) {
        String rest = trimmed.substring(CODE_FENCE.length()).trim();
        if (rest.isEmpty()) {
            return "";
        }
        return rest.split("\\s+", 2)[0];
    }

    /**
     * Mutable state of one left-to-right pass.
     */
    private final class Scan {
        private final List<RawSegment> segments = new ArrayList<>();
        private final StringBuilder buffer = new StringBuilder();

        private DetectorState state = DetectorState.DEFAULT;
        private int bufferStart;
        private int bufferEnd;

        // special block
        private SyntaxKind openKind;
        private String closingMarker;
        private String orgBlockName;

        // prose run
        private boolean proseHasContent;
        private boolean proseFinished;

        Scan(int firstLine) {
            this.bufferStart = firstLine;
        }

        void accept(String line, int lineNo) {
            String content = Lines.content(line);
            String trimmed = content.trim();

            switch (state) {
                case DEFAULT -> acceptDefault(line, content, trimmed, lineNo);
                case IN_ORG_BLOCK -> {
                    append(line, lineNo);
                    if (closesOrgBlock(trimmed)) {
                        flushSpecial(null);
                    }
                }
                case IN_CODE_FENCE -> {
                    append(line, lineNo);
                    if (trimmed.equals(CODE_FENCE)) {
                        flushSpecial(null);
                    }
                }
                case IN_LATEX_BRACKET -> {
                    append(line, lineNo);
                    boolean closed = DISPLAY_MATH.equals(closingMarker)
                            ? content.contains(DISPLAY_MATH)
                            : trimmed.equals(BRACKET_CLOSE);
                    if (closed) {
                        flushSpecial(null);
                    }
                }
            }
        }

        private void acceptDefault(String line, String content, String trimmed, int lineNo) {
            Matcher orgBegin = ORG_BEGIN.matcher(trimmed);
            if (orgBegin.matches()) {
                orgBlockName = orgBegin.group(1);
                openSpecial(DetectorState.IN_ORG_BLOCK, SyntaxKind.ORG, "#+END_" + orgBlockName, line, lineNo);
                return;
            }
            if (isFenceOpen(trimmed)) {
                openSpecial(DetectorState.IN_CODE_FENCE, SyntaxKind.code(fenceLanguage(trimmed)), CODE_FENCE, line, lineNo);
                return;
            }
            int dollarPairs = Lines.countOccurrences(content, DISPLAY_MATH);
            if (dollarPairs >= 2) {
                flushProse();
                bufferStart = lineNo;
                append(line, lineNo);
                emit(SyntaxKind.LATEX, null);
                return;
            }
            if (dollarPairs == 1) {
                openSpecial(DetectorState.IN_LATEX_BRACKET, SyntaxKind.LATEX, DISPLAY_MATH, line, lineNo);
                return;
            }
            if (trimmed.equals(BRACKET_OPEN)) {
                openSpecial(DetectorState.IN_LATEX_BRACKET, SyntaxKind.LATEX, BRACKET_CLOSE, line, lineNo);
                return;
            }
            appendProse(line, trimmed.isEmpty(), lineNo);
        }

        private void appendProse(String line, boolean blank, int lineNo) {
            if (!blank && proseFinished) {
                flushProse();
            }
            if (buffer.length() == 0) {
                bufferStart = lineNo;
            }
            append(line, lineNo);
            if (blank) {
                if (proseHasContent && splitOnBlankLines) {
                    proseFinished = true;
                }
            } else {
                proseHasContent = true;
            }
        }

        private boolean closesOrgBlock(String trimmed) {
            Matcher end = ORG_END.matcher(trimmed);
            return end.matches() && end.group(1).toUpperCase(Locale.ROOT).equals(orgBlockName.toUpperCase(Locale.ROOT));
        }

        private void openSpecial(DetectorState next, SyntaxKind kind, String closer, String line, int lineNo) {
            flushProse();
            state = next;
            openKind = kind;
            closingMarker = closer;
            bufferStart = lineNo;
            append(line, lineNo);
        }

        private void append(String line, int lineNo) {
            buffer.append(line);
            bufferEnd = lineNo;
        }

        private void flushProse() {
            if (buffer.length() > 0) {
                emit(proseSyntax, null);
            }
            proseHasContent = false;
            proseFinished = false;
        }

        private void flushSpecial(DetectionRecoveryNotice notice) {
            emit(openKind, notice);
            state = DetectorState.DEFAULT;
            openKind = null;
            closingMarker = null;
            orgBlockName = null;
        }

        private void emit(SyntaxKind kind, DetectionRecoveryNotice notice) {
            segments.add(new RawSegment(kind, LineRange.of(bufferStart, bufferEnd), buffer.toString(), notice));
            buffer.setLength(0);
        }

        void finish(int lastLine) {
            if (state == DetectorState.DEFAULT) {
                flushProse();
                return;
            }
            DetectionRecoveryNotice notice = new DetectionRecoveryNotice(openKind, bufferStart, lastLine, closingMarker);
            if (strict) {
                throw new UnterminatedBlockException(notice);
            }
            logger.warn(notice.getMessage());
            flushSpecial(notice);
        }
    }
}
