package org.dxworks.hybridnote.parser;

import org.dxworks.hybridnote.SyntaxKind;
import org.dxworks.hybridnote.model.BlockAst;
import org.dxworks.hybridnote.model.BlockMetadata;

/**
 * Parses and renders the content of one block syntax.
 *
 * For any text accepted by {@link #parse}, rendering the result must give back that text, up to the
 * normalization the implementation documents; rendering must be idempotent. Implementations are
 * stateless and may be called from several threads for different blocks.
 */
public interface BlockParser {

    SyntaxKind getSyntaxKind();

    /**
     * Cheap structural probe, used only when no parser is registered for a block's own kind.
     */
    boolean canHandle(String text);

    /**
     * @param rawText    the block's text, line terminators included
     * @param lineOffset document line of the block's first line (1-indexed), for error positions
     */
    ParsedBlock parse(String rawText, int lineOffset) throws BlockParseException;

    String render(BlockAst ast, BlockMetadata metadata);
}
