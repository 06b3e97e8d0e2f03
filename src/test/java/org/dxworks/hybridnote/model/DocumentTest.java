package org.dxworks.hybridnote.model;

import org.dxworks.hybridnote.SyntaxKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DocumentTest {

    @Test
    void testHybridDocument() {
        Document document = Document.hybrid("d1", "Journal");

        assertEquals("d1", document.id());
        assertEquals("Journal", document.title());
        assertEquals(DocumentFormat.HYBRID, document.format());
        assertTrue(document.asHybrid().isPresent());
        assertTrue(document.asStandard().isEmpty());

        document.asHybrid().get().addBlock(HybridBlock.unparsed(SyntaxKind.MARKDOWN, "text\n", null));
        assertEquals(1, document.asHybrid().get().blockCount());
    }

    @Test
    void testStandardDocument() {
        Document document = Document.standard("d2", "Plain", SyntaxKind.MARKDOWN, new RawAst("x\n"), null);

        assertEquals(DocumentFormat.ABSTRACT, document.format());
        assertTrue(document.asHybrid().isEmpty());
        assertEquals(SyntaxKind.MARKDOWN, document.asStandard().get().getSyntaxKind());
        assertTrue(document.asStandard().get().getMetadata().isEmpty());
    }

    @Test
    void testMatchVisitsExactlyOneVariant() {
        Document standard = Document.standard("s", "", SyntaxKind.ORG, new RawAst("* x\n"), BlockMetadata.empty());
        Document hybrid = Document.hybrid("h", "");

        assertEquals("standard:org", standard.match(s -> "standard:" + s.getSyntaxKind(), h -> "hybrid"));
        assertEquals("hybrid:0", hybrid.match(s -> "standard", h -> "hybrid:" + h.getNote().blockCount()));
    }
}
