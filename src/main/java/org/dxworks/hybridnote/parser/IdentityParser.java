package org.dxworks.hybridnote.parser;

import org.dxworks.hybridnote.SyntaxKind;
import org.dxworks.hybridnote.model.BlockAst;
import org.dxworks.hybridnote.model.BlockMetadata;
import org.dxworks.hybridnote.model.RawAst;

public final class IdentityParser implements BlockParser {

    public static final SyntaxKind KIND = SyntaxKind.custom("identity");

    public static final IdentityParser INSTANCE = new IdentityParser();

    private IdentityParser() {}

    @Override
    public SyntaxKind getSyntaxKind() {
        return KIND;
    }

    @Override
    public boolean canHandle(String text) {
        return true;
    }

    @Override
    public ParsedBlock parse(String rawText, int lineOffset) {
        return ParsedBlock.of(new RawAst(rawText));
    }

    @Override
    public String render(BlockAst ast, BlockMetadata metadata) {
        if (ast instanceof RawAst raw) {
            return raw.getText();
        }
        throw new IllegalArgumentException("Identity parser cannot render " + ast.getSyntax() + " structure");
    }
}
