package org.dxworks.hybridnote.model;

import org.dxworks.hybridnote.detector.Lines;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * A document made of typed blocks. Block line ranges, in order, are contiguous from line 1 with no
 * gaps or overlaps; every structural operation here shifts the later blocks to keep it that way.
 * An invalid index throws {@link IndexOutOfBoundsException} and leaves the note unchanged.
 */
public class HybridNote {

    private final String id;
    private String title;
    private final List<HybridBlock> blocks = new ArrayList<>();

    public HybridNote(String id, String title) {
        this.id = Objects.requireNonNull(id, "id");
        this.title = title == null ? "" : title;
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title == null ? "" : title;
    }

    public List<HybridBlock> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    public int blockCount() {
        return blocks.size();
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    public HybridBlock blockAt(int index) {
        Objects.checkIndex(index, blocks.size());
        return blocks.get(index);
    }

    public int totalLines() {
        return blocks.isEmpty() ? 0 : blocks.get(blocks.size() - 1).getLineRange().getEndLine();
    }

    /**
     * Appends a block, placing its line range right after the last block.
     */
    public void addBlock(HybridBlock block) {
        insertBlock(blocks.size(), block);
    }

    /**
     * Inserts a block at {@code index} (equal to the block count to append). The block takes the
     * lines where the block previously at {@code index} started; that block and all later ones move
     * down by the new block's line count.
     */
    public void insertBlock(int index, HybridBlock block) {
        Objects.checkIndex(index, blocks.size() + 1);
        Objects.requireNonNull(block, "block");
        int start = index < blocks.size() ? blocks.get(index).getLineRange().getStartLine() : totalLines() + 1;
        int count = Lines.count(block.getRawText());
        block.relocate(LineRange.starting(start, count));
        blocks.add(index, block);
        shiftFrom(index + 1, count);
    }

    /**
     * Removes the block at {@code index}; later blocks move up by its line count.
     */
    public HybridBlock removeBlock(int index) {
        Objects.checkIndex(index, blocks.size());
        HybridBlock removed = blocks.remove(index);
        shiftFrom(index, -removed.lineCount());
        return removed;
    }

    /**
     * Replaces the raw text of a block, marking it dirty; later blocks move by the line-count delta.
     */
    public void replaceBlockText(int index, String text) {
        Objects.checkIndex(index, blocks.size());
        HybridBlock block = blocks.get(index);
        int oldCount = block.lineCount();
        LineRange range = LineRange.starting(block.getLineRange().getStartLine(), Lines.count(text));
        block.updateRawText(text, range);
        shiftFrom(index + 1, range.lineCount() - oldCount);
    }

    /**
     * Replaces one block with several, laid out from the replaced block's first line.
     */
    public void replaceBlock(int index, List<HybridBlock> replacements) {
        Objects.checkIndex(index, blocks.size());
        if (replacements.isEmpty()) {
            throw new IllegalArgumentException("Replacement must contain at least one block");
        }
        HybridBlock old = blocks.remove(index);
        int line = old.getLineRange().getStartLine();
        int added = 0;
        for (int i = 0; i < replacements.size(); i++) {
            HybridBlock block = replacements.get(i);
            int count = Lines.count(block.getRawText());
            block.relocate(LineRange.starting(line, count));
            blocks.add(index + i, block);
            line += count;
            added += count;
        }
        shiftFrom(index + replacements.size(), added - old.lineCount());
    }

    /**
     * Swaps in a whole new block sequence, laid out from line 1.
     */
    public void replaceAll(List<HybridBlock> newBlocks) {
        List<HybridBlock> laidOut = new ArrayList<>(newBlocks.size());
        int line = 1;
        for (HybridBlock block : newBlocks) {
            int count = Lines.count(block.getRawText());
            block.relocate(LineRange.starting(line, count));
            laidOut.add(block);
            line += count;
        }
        blocks.clear();
        blocks.addAll(laidOut);
    }

    public List<Map.Entry<Integer, HybridBlock>> findHeadings() {
        return find(HybridBlock::isHeading);
    }

    public List<Map.Entry<Integer, HybridBlock>> findHeadingsAtLevel(int level) {
        return find(block -> Integer.valueOf(level).equals(block.headingLevel()));
    }

    /**
     * Blocks with any TODO state, done ones included.
     */
    public List<Map.Entry<Integer, HybridBlock>> findTodos() {
        return find(block -> block.todoState() != null);
    }

    public List<Map.Entry<Integer, HybridBlock>> find(Predicate<HybridBlock> predicate) {
        List<Map.Entry<Integer, HybridBlock>> found = new ArrayList<>();
        for (int i = 0; i < blocks.size(); i++) {
            if (predicate.test(blocks.get(i))) {
                found.add(Map.entry(i, blocks.get(i)));
            }
        }
        return found;
    }

    /**
     * Raw text of all blocks joined in order.
     */
    public String rawText() {
        StringBuilder sb = new StringBuilder();
        blocks.forEach(block -> sb.append(block.getRawText()));
        return sb.toString();
    }

    private void shiftFrom(int fromIndex, int delta) {
        if (delta == 0) {
            return;
        }
        for (int i = fromIndex; i < blocks.size(); i++) {
            HybridBlock block = blocks.get(i);
            block.relocate(block.getLineRange().shift(delta));
        }
    }
}
