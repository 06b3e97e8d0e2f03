package org.dxworks.hybridnote;

import org.dxworks.hybridnote.detector.BlockDetector;
import org.dxworks.hybridnote.detector.DetectionRecoveryNotice;
import org.dxworks.hybridnote.detector.Lines;
import org.dxworks.hybridnote.detector.RawSegment;
import org.dxworks.hybridnote.model.BlockMetadata;
import org.dxworks.hybridnote.model.BlockSummary;
import org.dxworks.hybridnote.model.DocumentSummary;
import org.dxworks.hybridnote.model.HybridBlock;
import org.dxworks.hybridnote.model.HybridNote;
import org.dxworks.hybridnote.parser.BlockParseException;
import org.dxworks.hybridnote.parser.BlockParser;
import org.dxworks.hybridnote.parser.ParsedBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Keeps a {@link HybridNote} in sync with its text: detection, per-block parsing, dirty tracking
 * and incremental edits.
 *
 * Editing a block's text or metadata marks only that block dirty; nothing is reparsed until
 * {@link #reparseBlock} or {@link #reparseDirty} is called, and queries read whatever metadata the
 * blocks currently hold. A parser failure is recorded on the block and never fails the call. An
 * invalid index throws {@link IndexOutOfBoundsException} before anything is changed.
 *
 * Not thread-safe; one caller owns a manager at a time.
 */
public class BlockManager {

    private static final Logger logger = LoggerFactory.getLogger(BlockManager.class);

    private final HybridConfig config;
    private final BlockDetector detector;
    private final ParserRegistry registry;
    private final HybridNote note;

    public BlockManager() {
        this(HybridConfig.defaults());
    }

    public BlockManager(HybridConfig config) {
        this(config, ParserRegistry.withDefaults());
    }

    public BlockManager(HybridConfig config, ParserRegistry registry) {
        this(new HybridNote("untitled", ""), config, registry);
    }

    public BlockManager(HybridNote note, HybridConfig config, ParserRegistry registry) {
        this.note = Objects.requireNonNull(note, "note");
        this.config = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.detector = new BlockDetector(config);
    }

    public HybridNote getNote() {
        return note;
    }

    public ParserRegistry getRegistry() {
        return registry;
    }

    public BlockDetector getDetector() {
        return detector;
    }

    public List<HybridBlock> getBlocks() {
        return note.getBlocks();
    }

    public int blockCount() {
        return note.blockCount();
    }

    public HybridBlock block(int index) {
        return note.blockAt(index);
    }

    /**
     * Detects and parses the whole text, then replaces the note's blocks in one step.
     *
     * @throws org.dxworks.hybridnote.detector.UnterminatedBlockException in strict detection mode only;
     *                                                                    the note is left unchanged
     */
    public HybridNote parseDocument(String text) {
        Objects.requireNonNull(text, "text");
        List<RawSegment> segments = detector.scan(text);
        List<HybridBlock> blocks = buildBlocks(segments);
        note.replaceAll(blocks);

        long failed = blocks.stream().filter(HybridBlock::hasParseError).count();
        logger.debug("Parsed {} block(s) over {} line(s), {} failed", blocks.size(), note.totalLines(), failed);
        return note;
    }

    /**
     * Parses one block again from its raw text with the parser resolved for it.
     *
     * @return true if the parser accepted the text
     */
    public boolean reparseBlock(int index) {
        HybridBlock block = note.blockAt(index);
        parseInto(block, index);
        return !block.hasParseError();
    }

    /**
     * Reparses every dirty block.
     *
     * @return the indices that were reparsed
     */
    public List<Integer> reparseDirty() {
        List<Integer> dirty = dirtyBlocks();
        dirty.forEach(this::reparseBlock);
        return dirty;
    }

    public void markDirty(int index) {
        note.blockAt(index).markDirty();
    }

    /**
     * Replaces a block's raw text without reparsing it. The block becomes dirty and the blocks after it
     * move by the change in line count. A line terminator is added when another block follows.
     */
    public void updateBlockText(int index, String text) {
        Objects.checkIndex(index, note.blockCount());
        requireText(text);
        note.replaceBlockText(index, terminatedIfFollowed(text, index + 1));
    }

    public void patchMetadata(int index, UnaryOperator<BlockMetadata> patch) {
        Objects.requireNonNull(patch, "patch");
        note.blockAt(index).patchMetadata(patch);
    }

    /**
     * Inserts a new block at {@code index} (the block count appends) and parses it right away. The text
     * gets a line terminator when a block follows it. Other blocks keep their AST, with one exception:
     * appending after a last block without a line terminator adds {@code "\n"} to that block and
     * reparses it, so its AST is replaced.
     *
     * @return the inserted block
     */
    public HybridBlock insertBlock(int index, SyntaxKind syntaxKind, String text) {
        Objects.checkIndex(index, note.blockCount() + 1);
        Objects.requireNonNull(syntaxKind, "syntaxKind");
        requireText(text);

        int count = note.blockCount();
        if (index == count && count > 0) {
            HybridBlock last = note.blockAt(count - 1);
            if (!Lines.endsWithTerminator(last.getRawText())) {
                boolean wasDirty = last.isDirty();
                note.replaceBlockText(count - 1, last.getRawText() + "\n");
                if (!wasDirty) {
                    parseInto(last, count - 1);
                }
            }
        }

        String blockText = terminatedIfFollowed(text, index);
        HybridBlock block = HybridBlock.unparsed(syntaxKind, blockText, null);
        note.insertBlock(index, block);
        parseInto(block, index);
        return block;
    }

    public HybridBlock removeBlock(int index) {
        return note.removeBlock(index);
    }

    /**
     * Runs detection over one block's text and replaces the block with the parsed result. Use it
     * after an edit that changes block markers; {@link #reparseBlock} keeps the block's syntax.
     *
     * @return how many blocks replaced the old one
     */
    public int redetectBlock(int index) {
        HybridBlock block = note.blockAt(index);
        List<RawSegment> segments = detector.scanBlock(block.getRawText(), block.getLineRange().getStartLine());
        List<HybridBlock> replacements = buildBlocks(segments);
        note.replaceBlock(index, replacements);
        return replacements.size();
    }

    public List<Integer> dirtyBlocks() {
        return findBlocks(HybridBlock::isDirty);
    }

    public void clearDirty() {
        note.getBlocks().forEach(HybridBlock::clearDirty);
    }

    public List<Integer> failedBlocks() {
        return findBlocks(HybridBlock::hasParseError);
    }

    public Optional<BlockParseException> parseError(int index) {
        return Optional.ofNullable(note.blockAt(index).getParseError());
    }

    public List<DetectionRecoveryNotice> notices() {
        return note.getBlocks().stream()
                .map(HybridBlock::getNotice)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    public List<Integer> findHeadings() {
        return indices(note.findHeadings());
    }

    public List<Integer> findHeadingsAtLevel(int level) {
        return indices(note.findHeadingsAtLevel(level));
    }

    public List<Integer> findTodoItems() {
        return indices(note.findTodos());
    }

    public List<Integer> findBlocks(Predicate<HybridBlock> predicate) {
        return indices(note.find(predicate));
    }

    /**
     * Text of one block: rendered by the parser that produced its AST when clean, the raw text when
     * dirty or unparsed.
     */
    public String renderBlock(int index) {
        return render(note.blockAt(index));
    }

    /**
     * Blocks joined in order. Equals the parsed text when no parser normalizes it.
     */
    public String renderDocument() {
        StringBuilder sb = new StringBuilder();
        note.getBlocks().forEach(block -> sb.append(render(block)));
        return sb.toString();
    }

    public DocumentSummary summarize(String filePath) {
        DocumentSummary summary = new DocumentSummary();
        summary.filePath = filePath;
        summary.id = note.getId();
        summary.title = note.getTitle();
        summary.proseSyntax = detector.getProseSyntax().getName();
        summary.totalLines = note.totalLines();
        summary.blockCount = note.blockCount();
        summary.headings = findHeadings();
        summary.todos = findTodoItems();
        summary.failedBlocks = failedBlocks();
        summary.notices = notices().stream().map(DetectionRecoveryNotice::getMessage).collect(Collectors.toList());

        List<HybridBlock> blocks = note.getBlocks();
        for (int i = 0; i < blocks.size(); i++) {
            HybridBlock block = blocks.get(i);
            BlockSummary blockSummary = new BlockSummary();
            blockSummary.index = i;
            blockSummary.syntax = block.getSyntaxKind().getName();
            blockSummary.startLine = block.getLineRange().getStartLine();
            blockSummary.endLine = block.getLineRange().getEndLine();
            blockSummary.headingLevel = block.headingLevel();
            blockSummary.id = block.id();
            blockSummary.todoState = block.todoState();
            blockSummary.properties = block.hasProperties() ? block.getMetadata().getProperties() : null;
            blockSummary.dirty = block.isDirty();
            blockSummary.error = block.hasParseError() ? block.getParseError().getMessage() : null;
            summary.blocks.add(blockSummary);
        }
        return summary;
    }

    private List<HybridBlock> buildBlocks(List<RawSegment> segments) {
        Stream<RawSegment> stream = config.isParallelParsing() ? segments.parallelStream() : segments.stream();
        return stream.map(this::buildBlock).collect(Collectors.toList());
    }

    private HybridBlock buildBlock(RawSegment segment) {
        HybridBlock block = HybridBlock.unparsed(segment.getSyntaxKind(), segment.getRawText(), segment.getLineRange());
        block.setNotice(segment.getNotice());
        parseInto(block, -1);
        return block;
    }

    private void parseInto(HybridBlock block, int index) {
        BlockParser parser = registry.resolve(block.getSyntaxKind(), block.getRawText());
        try {
            ParsedBlock parsed = parser.parse(block.getRawText(), block.getLineRange().getStartLine());
            block.applyParseResult(parser, parsed.getAst(), parsed.getMetadata());
        } catch (BlockParseException e) {
            if (index >= 0) {
                logger.warn("Block {} ({} at lines {}) could not be parsed: {}",
                        index, block.getSyntaxKind(), block.getLineRange(), e.getMessage());
            } else {
                logger.warn("{} block at lines {} could not be parsed: {}",
                        block.getSyntaxKind(), block.getLineRange(), e.getMessage());
            }
            block.applyParseFailure(e);
        }
    }

    private String render(HybridBlock block) {
        if (block.isDirty() || block.getAst() == null) {
            return block.getRawText();
        }
        BlockParser parser = block.getParser() != null
                ? block.getParser()
                : registry.resolve(block.getSyntaxKind(), block.getRawText());
        return parser.render(block.getAst(), block.getMetadata());
    }

    private String terminatedIfFollowed(String text, int nextIndex) {
        if (nextIndex < note.blockCount() && !Lines.endsWithTerminator(text)) {
            return text + "\n";
        }
        return text;
    }

    private static void requireText(String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Block text must not be empty");
        }
    }

    private static List<Integer> indices(List<Map.Entry<Integer, HybridBlock>> entries) {
        return entries.stream().map(Map.Entry::getKey).collect(Collectors.toList());
    }
}
