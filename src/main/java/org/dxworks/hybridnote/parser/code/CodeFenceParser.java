package org.dxworks.hybridnote.parser.code;

import org.dxworks.hybridnote.SyntaxKind;
import org.dxworks.hybridnote.detector.Lines;
import org.dxworks.hybridnote.model.BlockAst;
import org.dxworks.hybridnote.model.BlockMetadata;
import org.dxworks.hybridnote.model.code.CodeAst;
import org.dxworks.hybridnote.parser.BlockParseException;
import org.dxworks.hybridnote.parser.BlockParser;
import org.dxworks.hybridnote.parser.ParsedBlock;

import java.util.List;

public class CodeFenceParser implements BlockParser {

    private static final String FENCE = "```";

    @Override
    public SyntaxKind getSyntaxKind() {
        return SyntaxKind.code("");
    }

    @Override
    public boolean canHandle(String text) {
        for (String line : Lines.split(text)) {
            if (!line.isBlank()) {
                return line.trim().startsWith(FENCE);
            }
        }
        return false;
    }

    @Override
    public ParsedBlock parse(String rawText, int lineOffset) throws BlockParseException {
        List<String> lines = Lines.split(rawText);
        if (lines.isEmpty() || !lines.get(0).trim().startsWith(FENCE)) {
            throw new BlockParseException("code block must start with " + FENCE, lineOffset);
        }

        String openingFence = lines.get(0);
        String language = languageOf(openingFence);

        int closingIndex = -1;
        for (int i = 1; i < lines.size(); i++) {
            if (Lines.content(lines.get(i)).trim().equals(FENCE)) {
                closingIndex = i;
                break;
            }
        }

        int codeEnd = closingIndex == -1 ? lines.size() : closingIndex;
        String code = String.join("", lines.subList(1, codeEnd));
        String closingFence = closingIndex == -1 ? "" : lines.get(closingIndex);
        String trailing = closingIndex == -1 ? "" : String.join("", lines.subList(closingIndex + 1, lines.size()));

        BlockMetadata.Builder metadata = BlockMetadata.builder();
        if (!language.isEmpty()) {
            metadata.property("language", language);
        }
        if (closingIndex == -1) {
            metadata.property("unterminated", "true");
        }
        return new ParsedBlock(new CodeAst(language, openingFence, code, closingFence, trailing), metadata.build());
    }

    @Override
    public String render(BlockAst ast, BlockMetadata metadata) {
        if (!(ast instanceof CodeAst code)) {
            throw new IllegalArgumentException("Expected a code block, got " + ast.getSyntax());
        }
        return code.getOpeningFence() + code.getCode() + code.getClosingFence() + code.getTrailing();
    }

    private static String languageOf(String openingFence) {
        String info = Lines.content(openingFence).trim().substring(FENCE.length()).trim();
        if (info.isEmpty()) {
            return "";
        }
        return info.split("\\s+", 2)[0];
    }
}
