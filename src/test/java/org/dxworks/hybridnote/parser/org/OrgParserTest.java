package org.dxworks.hybridnote.parser.org;

import org.dxworks.hybridnote.model.org.OrgBlock;
import org.dxworks.hybridnote.model.org.OrgHeadline;
import org.dxworks.hybridnote.model.org.OrgParagraph;
import org.dxworks.hybridnote.parser.BlockParseException;
import org.dxworks.hybridnote.parser.ParsedBlock;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class OrgParserTest {

    private final OrgParser parser = new OrgParser();

    @Test
    void testHeadlineWithTodoAndTags() throws Exception {
        ParsedBlock parsed = parser.parse("** TODO Write tests :dev:java:\n", 1);

        OrgHeadline headline = (OrgHeadline) parsed.getAst();
        assertEquals(2, headline.getLevel());
        assertEquals("TODO", headline.getTodoKeyword());
        assertEquals("Write tests", headline.getTitle());
        assertEquals(List.of("dev", "java"), headline.getTags());

        assertEquals(2, parsed.getMetadata().getHeadingLevel());
        assertEquals("TODO", parsed.getMetadata().getTodoState());
        assertEquals("dev:java", parsed.getMetadata().getProperty("tags"));
    }

    @Test
    void testPlanningAndPropertyDrawer() throws Exception {
        String text = """
                * DONE Ship release
                CLOSED: [2024-03-02 Sat]
                :PROPERTIES:
                :ID: rel-42
                :EFFORT: 2h
                :END:
                Notes below.
                """;

        ParsedBlock parsed = parser.parse(text, 5);

        assertEquals("DONE", parsed.getMetadata().getTodoState());
        assertEquals("rel-42", parsed.getMetadata().getId());
        assertEquals("[2024-03-02 Sat]", parsed.getMetadata().getProperty("CLOSED"));
        assertEquals("2h", parsed.getMetadata().getProperty("EFFORT"));
        assertEquals(List.of("CLOSED", "EFFORT"), List.copyOf(parsed.getMetadata().getProperties().keySet()));
    }

    @Test
    void testCustomTodoKeywords() throws Exception {
        OrgParser custom = new OrgParser(Set.of("NEXT", "WAITING"));

        assertEquals("WAITING", custom.parse("* WAITING Reply\n", 1).getMetadata().getTodoState());
        assertNull(custom.parse("* TODO Reply\n", 1).getMetadata().getTodoState());
    }

    @Test
    void testHeadlineWithoutTitleFails() {
        BlockParseException e = assertThrows(BlockParseException.class, () -> parser.parse("***\n", 12));

        assertEquals(12, e.getLine());
        assertTrue(e.getMessage().startsWith("Syntax error at line 12"));
    }

    @Test
    void testSourceBlock() throws Exception {
        ParsedBlock parsed = parser.parse("#+BEGIN_SRC python :results output\nprint(1)\n#+END_SRC\n", 1);

        OrgBlock block = (OrgBlock) parsed.getAst();
        assertTrue(block.isSourceBlock());
        assertEquals("print(1)\n", block.getContents());
        assertEquals("SRC", parsed.getMetadata().getProperty("block_type"));
        assertEquals("python", parsed.getMetadata().getProperty("language"));
    }

    @Test
    void testUnterminatedBlockFails() {
        assertThrows(BlockParseException.class, () -> parser.parse("#+BEGIN_EXAMPLE\ntext\n", 3));
    }

    @Test
    void testKeywordsBecomeProperties() throws Exception {
        ParsedBlock parsed = parser.parse("#+title: Notes\n#+AUTHOR: Ada\n", 1);

        assertInstanceOf(OrgParagraph.class, parsed.getAst());
        assertEquals("Notes", parsed.getMetadata().getProperty("TITLE"));
        assertEquals("Ada", parsed.getMetadata().getProperty("AUTHOR"));
    }

    @Test
    void testHeadlineRenderingNormalizesSpacing() throws Exception {
        String text = "*   TODO   Buy milk    :home:\nbody\n";

        ParsedBlock parsed = parser.parse(text, 1);
        String rendered = parser.render(parsed.getAst(), parsed.getMetadata());

        assertEquals("* TODO Buy milk :home:\nbody\n", rendered);
        ParsedBlock again = parser.parse(rendered, 1);
        assertEquals(rendered, parser.render(again.getAst(), again.getMetadata()));
    }

    @Test
    void testCanonicalTextRoundTrips() throws Exception {
        for (String text : List.of(
                "* Heading\n",
                "#+BEGIN_QUOTE\nq\n#+END_QUOTE\n\n",
                "plain paragraph\nwith two lines\n")) {
            ParsedBlock parsed = parser.parse(text, 1);
            assertEquals(text, parser.render(parsed.getAst(), parsed.getMetadata()));
        }
    }

    @Test
    void testCanHandle() {
        assertTrue(parser.canHandle("* Heading\n"));
        assertTrue(parser.canHandle("#+begin_src\n"));
        assertTrue(parser.canHandle("#+TITLE: x\n"));
        assertFalse(parser.canHandle("plain text\n"));
    }
}
