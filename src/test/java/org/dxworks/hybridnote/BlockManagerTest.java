package org.dxworks.hybridnote;

import org.dxworks.hybridnote.detector.DetectionRecoveryNotice;
import org.dxworks.hybridnote.detector.UnterminatedBlockException;
import org.dxworks.hybridnote.model.BlockAst;
import org.dxworks.hybridnote.model.BlockMetadata;
import org.dxworks.hybridnote.model.HybridBlock;
import org.dxworks.hybridnote.model.LineRange;
import org.dxworks.hybridnote.model.RawAst;
import org.dxworks.hybridnote.parser.BlockParseException;
import org.dxworks.hybridnote.parser.BlockParser;
import org.dxworks.hybridnote.parser.ParsedBlock;
import org.dxworks.hybridnote.parser.code.CodeFenceParser;
import org.dxworks.hybridnote.parser.latex.LatexParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class BlockManagerTest {

    private static final String MIXED = "# Title\n\nBody text\n\n```js\nx\n```\n";

    private BlockManager manager;

    @BeforeEach
    void setUp() {
        manager = new BlockManager();
    }

    @Test
    void testParseDocumentBuildsCleanBlocks() {
        manager.parseDocument(MIXED);

        assertEquals(3, manager.blockCount());
        assertEquals(List.of(LineRange.of(1, 2), LineRange.of(3, 4), LineRange.of(5, 7)), ranges());
        assertEquals(SyntaxKind.code("js"), manager.block(2).getSyntaxKind());
        assertEquals("js", manager.block(2).property("language"));
        assertTrue(manager.dirtyBlocks().isEmpty());
        assertTrue(manager.failedBlocks().isEmpty());
    }

    @Test
    void testRoundTripIsExact() {
        String text = """
                ---
                id: journal
                ---
                # Journal

                Some *prose* here.
                #+BEGIN_QUOTE
                A quote
                #+END_QUOTE
                $$ a^2 + b^2 = c^2 $$
                \\[
                \\int_0^1 x\\,dx
                \\]

                ```python
                print("hi")
                ```
                last line without newline""";

        manager.parseDocument(text);

        assertEquals(text, manager.renderDocument());
        assertEquals(manager.getNote().rawText(), manager.renderDocument());
    }

    @Test
    void testRemovingMiddleBlockShiftsTheNextOne() {
        manager.parseDocument("l1\nl2\nl3\nl4\n\nm1\nm2\n\nn1\nn2\nn3\nn4\n");
        assertEquals(List.of(LineRange.of(1, 5), LineRange.of(6, 8), LineRange.of(9, 12)), ranges());

        HybridBlock removed = manager.removeBlock(1);

        assertEquals("m1\nm2\n\n", removed.getRawText());
        assertEquals(List.of(LineRange.of(1, 5), LineRange.of(6, 9)), ranges());
    }

    @Test
    void testEditingTextDirtiesOnlyThatBlock() {
        manager.parseDocument(MIXED);
        BlockAst firstAst = manager.block(0).getAst();
        BlockMetadata firstMetadata = manager.block(0).getMetadata();
        BlockAst lastAst = manager.block(2).getAst();

        manager.updateBlockText(1, "Body\nmore body\n\n");

        assertEquals(List.of(1), manager.dirtyBlocks());
        assertSame(firstAst, manager.block(0).getAst());
        assertSame(firstMetadata, manager.block(0).getMetadata());
        assertSame(lastAst, manager.block(2).getAst());
        assertEquals(List.of(LineRange.of(1, 2), LineRange.of(3, 5), LineRange.of(6, 8)), ranges());
    }

    @Test
    void testQueriesSeeStaleMetadataUntilReparse() {
        manager.parseDocument(MIXED);

        manager.updateBlockText(0, "## New title\n\n");

        assertEquals(List.of(0), manager.findHeadingsAtLevel(1));
        assertTrue(manager.reparseBlock(0));
        assertFalse(manager.block(0).isDirty());
        assertEquals(2, manager.block(0).headingLevel());
        assertEquals(List.of(0), manager.findHeadingsAtLevel(2));
    }

    @Test
    void testUpdatedTextIsTerminatedWhenABlockFollows() {
        manager.parseDocument(MIXED);

        manager.updateBlockText(0, "# Title");

        assertEquals("# Title\n", manager.block(0).getRawText());
        assertEquals("# Title\nBody text\n\n```js\nx\n```\n", manager.renderDocument());
    }

    @Test
    void testInsertShiftsLaterBlocksAndParsesImmediately() {
        manager.parseDocument(MIXED);

        HybridBlock inserted = manager.insertBlock(1, SyntaxKind.LATEX, "$$\ny\n$$");

        assertSame(inserted, manager.block(1));
        assertFalse(inserted.isDirty());
        assertEquals("$$", inserted.property("delimiter"));
        assertEquals(List.of(LineRange.of(1, 2), LineRange.of(3, 5), LineRange.of(6, 7), LineRange.of(8, 10)),
                ranges());
        assertEquals("# Title\n\n$$\ny\n$$\nBody text\n\n```js\nx\n```\n", manager.renderDocument());
    }

    @Test
    void testAppendAfterUnterminatedLastBlock() {
        manager.parseDocument("para");

        manager.insertBlock(1, SyntaxKind.MARKDOWN, "more");

        assertEquals("para\nmore", manager.renderDocument());
        assertEquals(List.of(LineRange.of(1, 1), LineRange.of(2, 2)), ranges());
        assertTrue(manager.dirtyBlocks().isEmpty());
    }

    @Test
    void testAppendAfterUnterminatedBlockReparsesOnlyThatBlock() {
        manager.parseDocument("a\n\nb");
        BlockAst firstAst = manager.block(0).getAst();
        BlockAst lastAst = manager.block(1).getAst();

        manager.insertBlock(2, SyntaxKind.MARKDOWN, "c\n");

        assertSame(firstAst, manager.block(0).getAst());
        assertNotSame(lastAst, manager.block(1).getAst());
        assertEquals("b\n", manager.block(1).getRawText());
        assertEquals("a\n\nb\nc\n", manager.renderDocument());
    }

    @Test
    void testInsertIntoEmptyDocument() {
        manager.insertBlock(0, SyntaxKind.ORG, "* TODO Start\n");

        assertEquals(1, manager.blockCount());
        assertEquals(List.of(0), manager.findTodoItems());
    }

    @Test
    void testInvalidArgumentsLeaveDocumentUntouched() {
        manager.parseDocument(MIXED);

        assertThrows(IndexOutOfBoundsException.class, () -> manager.insertBlock(4, SyntaxKind.MARKDOWN, "x\n"));
        assertThrows(IndexOutOfBoundsException.class, () -> manager.insertBlock(-1, SyntaxKind.MARKDOWN, "x\n"));
        assertThrows(IndexOutOfBoundsException.class, () -> manager.removeBlock(3));
        assertThrows(IndexOutOfBoundsException.class, () -> manager.reparseBlock(3));
        assertThrows(IndexOutOfBoundsException.class, () -> manager.updateBlockText(5, "x\n"));
        assertThrows(IllegalArgumentException.class, () -> manager.insertBlock(0, SyntaxKind.MARKDOWN, ""));
        assertThrows(IllegalArgumentException.class, () -> manager.updateBlockText(0, ""));

        assertEquals(3, manager.blockCount());
        assertEquals(MIXED, manager.renderDocument());
        assertTrue(manager.dirtyBlocks().isEmpty());
    }

    @Test
    void testParseFailureIsRecordedOnTheBlock() {
        String text = "intro\n\n#+BEGIN_SRC python\nx = 1\n";

        manager.parseDocument(text);

        assertEquals(2, manager.blockCount());
        assertEquals(List.of(1), manager.failedBlocks());
        BlockParseException error = manager.parseError(1).orElseThrow();
        assertEquals(3, error.getLine());
        assertNull(manager.block(1).getAst());
        assertEquals(LineRange.of(3, 4), manager.block(1).getLineRange());
        assertTrue(manager.parseError(0).isEmpty());

        List<DetectionRecoveryNotice> notices = manager.notices();
        assertEquals(1, notices.size());
        assertEquals(3, notices.get(0).getOpeningLine());
        assertSame(notices.get(0), manager.block(1).getNotice());

        assertEquals(text, manager.renderDocument());
    }

    @Test
    void testRepairedBlockDropsRecoveryNotice() {
        manager.parseDocument("#+BEGIN_SRC\nx=1\n");
        assertEquals(1, manager.notices().size());

        manager.updateBlockText(0, "#+BEGIN_SRC\nx=1\n#+END_SRC\n");

        assertTrue(manager.notices().isEmpty());
        assertNull(manager.block(0).getNotice());
        assertTrue(manager.reparseBlock(0));
        assertTrue(manager.notices().isEmpty());
        assertEquals(LineRange.of(1, 3), manager.block(0).getLineRange());
        assertTrue(manager.summarize("note.org").notices.isEmpty());
    }

    @Test
    void testEditingFailedBlockClearsItsError() {
        manager.parseDocument("$$\nx\n");
        assertEquals(List.of(0), manager.failedBlocks());

        manager.updateBlockText(0, "$$\nx\n$$\n");

        assertTrue(manager.failedBlocks().isEmpty());
        assertTrue(manager.parseError(0).isEmpty());
        assertEquals(List.of(0), manager.dirtyBlocks());
        assertTrue(manager.reparseBlock(0));
    }

    @Test
    void testRenderUsesParserThatBuiltTheAst() {
        ParserRegistry registry = ParserRegistry.withDefaults();
        BlockManager late = new BlockManager(HybridConfig.defaults(), registry);
        String text = "```python\nprint(1)\n```\n";
        late.parseDocument(text);
        BlockParser codeParser = late.block(0).getParser();

        registry.register(new PythonEchoParser());

        assertInstanceOf(CodeFenceParser.class, codeParser);
        assertEquals(text, late.renderDocument());

        assertTrue(late.reparseBlock(0));
        assertInstanceOf(PythonEchoParser.class, late.block(0).getParser());
        assertEquals(text, late.renderDocument());
    }

    @Test
    void testFailedReparseKeepsTextAndRange() {
        manager.parseDocument("$$\nx\n$$\n");
        manager.updateBlockText(0, "$$\nx\n");

        assertFalse(manager.reparseBlock(0));

        assertEquals("$$\nx\n", manager.block(0).getRawText());
        assertEquals(LineRange.of(1, 2), manager.block(0).getLineRange());
        assertEquals(List.of(0), manager.failedBlocks());
        assertEquals("$$\nx\n", manager.renderDocument());
    }

    @Test
    void testUnknownContentFallsBackToIdentity() {
        BlockManager latexOnly = new BlockManager(HybridConfig.defaults(), new ParserRegistry().register(new LatexParser()));
        String text = "hello\nworld\n";

        latexOnly.parseDocument(text);

        assertEquals(1, latexOnly.blockCount());
        assertInstanceOf(RawAst.class, latexOnly.block(0).getAst());
        assertTrue(latexOnly.failedBlocks().isEmpty());
        assertEquals(text, latexOnly.renderDocument());
    }

    @Test
    void testRedetectSplitsBlockAfterStructuralEdit() {
        manager.parseDocument("intro\n\ntail\n");
        manager.updateBlockText(0, "intro\n```js\nx\n```\n");

        int replacements = manager.redetectBlock(0);

        assertEquals(2, replacements);
        assertEquals(SyntaxKind.MARKDOWN, manager.block(0).getSyntaxKind());
        assertEquals(SyntaxKind.code("js"), manager.block(1).getSyntaxKind());
        assertEquals(List.of(LineRange.of(1, 1), LineRange.of(2, 4), LineRange.of(5, 5)), ranges());
        assertTrue(manager.dirtyBlocks().isEmpty());
        assertEquals("intro\n```js\nx\n```\ntail\n", manager.renderDocument());
    }

    @Test
    void testStrictDetectionFailureKeepsPreviousDocument() {
        BlockManager strict = new BlockManager(HybridConfig.defaults().withStrictDetection(true));
        strict.parseDocument("ok\n");

        assertThrows(UnterminatedBlockException.class, () -> strict.parseDocument("```\nopen\n"));

        assertEquals(1, strict.blockCount());
        assertEquals("ok\n", strict.block(0).getRawText());
    }

    @Test
    void testPatchedMetadataMarksBlockDirty() {
        manager.parseDocument("# Title\n");

        manager.patchMetadata(0, metadata -> metadata.withTodoState("TODO"));

        assertTrue(manager.block(0).isDirty());
        assertEquals(List.of(0), manager.findTodoItems());
        assertEquals("# Title\n", manager.renderDocument());
    }

    @Test
    void testOrgProseQueries() {
        BlockManager org = new BlockManager(HybridConfig.defaults().withProseSyntax(SyntaxKind.ORG));

        org.parseDocument("* TODO Plan\n\n** Details\n\nplain\n");

        assertEquals(List.of(0, 1), org.findHeadings());
        assertEquals(List.of(1), org.findHeadingsAtLevel(2));
        assertEquals(List.of(0), org.findTodoItems());
        assertEquals(List.of(0, 1, 2), org.findBlocks(block -> block.isSyntax(SyntaxKind.ORG)));
    }

    @Test
    void testOrgHeadlineNormalizationIsIdempotent() {
        BlockManager org = new BlockManager(HybridConfig.defaults().withProseSyntax(SyntaxKind.ORG));

        org.parseDocument("*   Messy title  \nbody\n");
        String once = org.renderDocument();
        org.parseDocument(once);

        assertEquals("* Messy title\nbody\n", once);
        assertEquals(once, org.renderDocument());
    }

    @Test
    void testReparseDirtyAndClearDirty() {
        manager.parseDocument(MIXED);
        manager.markDirty(0);
        manager.markDirty(2);

        assertEquals(List.of(0, 2), manager.reparseDirty());
        assertTrue(manager.dirtyBlocks().isEmpty());

        manager.markDirty(1);
        manager.clearDirty();
        assertTrue(manager.dirtyBlocks().isEmpty());
    }

    @Test
    void testParallelParsingGivesSameBlocks() {
        BlockManager parallel = new BlockManager(HybridConfig.defaults().withParallelParsing(true));

        parallel.parseDocument(MIXED);
        manager.parseDocument(MIXED);

        assertEquals(kinds(manager), kinds(parallel));
        assertEquals(MIXED, parallel.renderDocument());
    }

    private static class PythonEchoParser implements BlockParser {
        @Override
        public SyntaxKind getSyntaxKind() {
            return SyntaxKind.code("python");
        }

        @Override
        public boolean canHandle(String text) {
            return false;
        }

        @Override
        public ParsedBlock parse(String rawText, int lineOffset) {
            return ParsedBlock.of(new RawAst(rawText));
        }

        @Override
        public String render(BlockAst ast, BlockMetadata metadata) {
            return ((RawAst) ast).getText();
        }
    }

    private List<LineRange> ranges() {
        return manager.getBlocks().stream().map(HybridBlock::getLineRange).collect(Collectors.toList());
    }

    private static List<SyntaxKind> kinds(BlockManager blockManager) {
        return blockManager.getBlocks().stream().map(HybridBlock::getSyntaxKind).collect(Collectors.toList());
    }
}
