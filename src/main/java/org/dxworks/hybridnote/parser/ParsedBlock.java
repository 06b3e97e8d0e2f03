package org.dxworks.hybridnote.parser;

import org.dxworks.hybridnote.model.BlockAst;
import org.dxworks.hybridnote.model.BlockMetadata;

import java.util.Objects;

public final class ParsedBlock {

    private final BlockAst ast;
    private final BlockMetadata metadata;

    public ParsedBlock(BlockAst ast, BlockMetadata metadata) {
        this.ast = Objects.requireNonNull(ast, "ast");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
    }

    public static ParsedBlock of(BlockAst ast) {
        return new ParsedBlock(ast, BlockMetadata.empty());
    }

    public BlockAst getAst() {
        return ast;
    }

    public BlockMetadata getMetadata() {
        return metadata;
    }
}
