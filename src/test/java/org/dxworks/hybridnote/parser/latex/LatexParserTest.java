package org.dxworks.hybridnote.parser.latex;

import org.dxworks.hybridnote.model.latex.LatexAst;
import org.dxworks.hybridnote.parser.BlockParseException;
import org.dxworks.hybridnote.parser.ParsedBlock;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LatexParserTest {

    private final LatexParser parser = new LatexParser();

    @Test
    void testDollarBlock() throws Exception {
        ParsedBlock parsed = parser.parse("$$\nx^2\n$$\n", 1);

        LatexAst ast = (LatexAst) parsed.getAst();
        assertEquals("x^2", ast.getMath());
        assertEquals("$$", parsed.getMetadata().getProperty("delimiter"));
        assertEquals("\n", ast.getSuffix());
    }

    @Test
    void testBracketBlockWithLabelAndEnvironment() throws Exception {
        String text = "\\[\n\\begin{aligned}\na &= b \\label{eq:one}\n\\end{aligned}\n\\]\n";

        ParsedBlock parsed = parser.parse(text, 1);

        assertEquals("\\[", parsed.getMetadata().getProperty("delimiter"));
        assertEquals("eq:one", parsed.getMetadata().getId());
        assertEquals("aligned", parsed.getMetadata().getProperty("environment"));
    }

    @Test
    void testMissingClosingDelimiterReportsOpeningLine() {
        BlockParseException e = assertThrows(BlockParseException.class, () -> parser.parse("intro\n$$\nx\n", 4));

        assertEquals(5, e.getLine());
    }

    @Test
    void testNoDelimiterFails() {
        assertThrows(BlockParseException.class, () -> parser.parse("just text\n", 1));
    }

    @Test
    void testRenderIsLossless() throws Exception {
        String text = "  $$ e = mc^2 $$  \n";

        ParsedBlock parsed = parser.parse(text, 1);

        assertEquals(text, parser.render(parsed.getAst(), parsed.getMetadata()));
    }

    @Test
    void testCanHandle() {
        assertTrue(parser.canHandle("\n$$x$$\n"));
        assertTrue(parser.canHandle("\\[\nx\n\\]\n"));
        assertFalse(parser.canHandle("no math here\n$$\n"));
    }
}
