package org.dxworks.hybridnote.parser.markdown;

import org.dxworks.hybridnote.model.markdown.MarkdownAst;
import org.dxworks.hybridnote.model.markdown.MarkdownElement;
import org.dxworks.hybridnote.parser.ParsedBlock;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownParserTest {

    private final MarkdownParser parser = new MarkdownParser();

    @Test
    void testSingleHeadingSetsHeadingLevel() {
        ParsedBlock parsed = parser.parse("## Section\n\n", 1);

        assertEquals(2, parsed.getMetadata().getHeadingLevel());
        MarkdownAst ast = (MarkdownAst) parsed.getAst();
        assertTrue(ast.isSingleHeading());
        assertEquals("Section", ast.getElements().get(0).properties.get("text"));
    }

    @Test
    void testHeadingFollowedByTextIsNotAHeadingBlock() {
        ParsedBlock parsed = parser.parse("# Title\n\nSome text\n", 1);

        assertNull(parsed.getMetadata().getHeadingLevel());
        assertEquals(2, ((MarkdownAst) parsed.getAst()).getElements().size());
    }

    @Test
    void testElementLinesAreDocumentLines() {
        ParsedBlock parsed = parser.parse("# Title\n\nSome text\nmore text\n", 7);

        MarkdownAst ast = (MarkdownAst) parsed.getAst();
        MarkdownElement heading = ast.getElements().get(0);
        MarkdownElement paragraph = ast.getElements().get(1);
        assertEquals(7, heading.line);
        assertEquals(9, paragraph.line);
        assertEquals(2, paragraph.lines);
    }

    @Test
    void testListsNestTheirItems() {
        ParsedBlock parsed = parser.parse("- one\n- two\n", 1);

        MarkdownElement list = ((MarkdownAst) parsed.getAst()).getElements().get(0);
        assertEquals("bullet_list", list.type);
        assertEquals(2, list.children.size());
        assertEquals("list_item", list.children.get(0).type);
    }

    @Test
    void testTableIsRecognised() {
        ParsedBlock parsed = parser.parse("| a | b |\n|---|---|\n| 1 | 2 |\n", 1);

        assertEquals("table", ((MarkdownAst) parsed.getAst()).getElements().get(0).type);
    }

    @Test
    void testFrontMatterGoesToMetadata() {
        ParsedBlock parsed = parser.parse("---\nid: note-1\ntitle: Hello\n---\n", 1);

        assertEquals("note-1", parsed.getMetadata().getId());
        assertEquals("Hello", parsed.getMetadata().getProperty("title"));
        assertNull(parsed.getMetadata().getProperty("id"));
    }

    @Test
    void testRenderReturnsSourceUnchanged() {
        String text = "Some  *odd*   spacing\r\n\r\n";

        ParsedBlock parsed = parser.parse(text, 1);

        assertEquals(text, parser.render(parsed.getAst(), parsed.getMetadata()));
    }

    @Test
    void testCanHandle() {
        assertTrue(parser.canHandle("plain text\n"));
        assertFalse(parser.canHandle("```js\nx\n```\n"));
        assertFalse(parser.canHandle("#+BEGIN_SRC\n#+END_SRC\n"));
        assertFalse(parser.canHandle("$$x$$\n"));
        assertFalse(parser.canHandle("  \n"));
    }
}
