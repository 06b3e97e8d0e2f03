package org.dxworks.hybridnote;

import org.dxworks.hybridnote.model.Document;
import org.dxworks.hybridnote.model.HybridNote;
import org.dxworks.hybridnote.model.RawAst;
import org.dxworks.hybridnote.parser.BlockParseException;
import org.dxworks.hybridnote.parser.BlockParser;
import org.dxworks.hybridnote.parser.IdentityParser;
import org.dxworks.hybridnote.parser.ParsedBlock;

import java.util.Objects;
import java.util.Optional;

/**
 * Explicit conversion between the two document forms, always through text. Going to a standard
 * document parses everything with a single parser, so structure of other syntaxes is lost.
 */
public class DocumentConverter {

    private final HybridConfig config;
    private final ParserRegistry registry;

    public DocumentConverter() {
        this(HybridConfig.defaults(), ParserRegistry.withDefaults());
    }

    public DocumentConverter(HybridConfig config, ParserRegistry registry) {
        this.config = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * @throws IllegalArgumentException if no parser is registered for the document's syntax, unless its
     *                                  AST is raw text
     */
    public Document.Hybrid toHybrid(Document.Standard standard) {
        BlockParser parser = parserFor(standard);
        String text = parser.render(standard.getAst(), standard.getMetadata());

        BlockManager manager = new BlockManager(new HybridNote(standard.id(), standard.title()), config, registry);
        manager.parseDocument(text);
        return Document.hybrid(manager.getNote());
    }

    /**
     * @throws IllegalArgumentException if no parser is registered for {@code syntaxKind}
     * @throws BlockParseException      if that parser rejects the rendered document
     */
    public Document.Standard toStandard(Document.Hybrid hybrid, SyntaxKind syntaxKind) throws BlockParseException {
        BlockParser parser = registry.get(syntaxKind)
                .orElseThrow(() -> new IllegalArgumentException("No parser registered for " + syntaxKind));
        String text = new BlockManager(hybrid.getNote(), config, registry).renderDocument();
        ParsedBlock parsed = parser.parse(text, 1);
        return Document.standard(hybrid.id(), hybrid.title(), syntaxKind, parsed.getAst(), parsed.getMetadata());
    }

    private BlockParser parserFor(Document.Standard standard) {
        Optional<BlockParser> registered = registry.get(standard.getSyntaxKind());
        if (registered.isPresent()) {
            return registered.get();
        }
        if (standard.getAst() instanceof RawAst) {
            return IdentityParser.INSTANCE;
        }
        throw new IllegalArgumentException("No parser registered for " + standard.getSyntaxKind());
    }

    /**
     * Converts either form to the other; a standard document becomes hybrid, a hybrid one becomes a
     * standard document in {@code syntaxKind}.
     */
    public Document convert(Document document, SyntaxKind syntaxKind) throws BlockParseException {
        if (document instanceof Document.Standard standard) {
            return toHybrid(standard);
        }
        return toStandard((Document.Hybrid) document, syntaxKind);
    }
}
