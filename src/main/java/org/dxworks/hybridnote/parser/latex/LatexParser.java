package org.dxworks.hybridnote.parser.latex;

import org.dxworks.hybridnote.SyntaxKind;
import org.dxworks.hybridnote.detector.Lines;
import org.dxworks.hybridnote.model.BlockAst;
import org.dxworks.hybridnote.model.BlockMetadata;
import org.dxworks.hybridnote.model.latex.LatexAst;
import org.dxworks.hybridnote.parser.BlockParseException;
import org.dxworks.hybridnote.parser.BlockParser;
import org.dxworks.hybridnote.parser.ParsedBlock;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class LatexParser implements BlockParser {

    private static final String DOLLARS = "$$";
    private static final String BRACKET_OPEN = "\\[";
    private static final String BRACKET_CLOSE = "\\]";

    private static final Pattern LABEL = Pattern.compile("\\\\label\\{([^}]+)}");
    private static final Pattern ENVIRONMENT = Pattern.compile("\\\\begin\\{([A-Za-z]+\\*?)}");

    @Override
    public SyntaxKind getSyntaxKind() {
        return SyntaxKind.LATEX;
    }

    @Override
    public boolean canHandle(String text) {
        for (String line : Lines.split(text)) {
            if (!line.isBlank()) {
                String trimmed = line.trim();
                return trimmed.contains(DOLLARS) || trimmed.startsWith(BRACKET_OPEN);
            }
        }
        return false;
    }

    @Override
    public ParsedBlock parse(String rawText, int lineOffset) throws BlockParseException {
        int dollars = rawText.indexOf(DOLLARS);
        int bracket = rawText.indexOf(BRACKET_OPEN);

        String open;
        String close;
        int openAt;
        if (dollars != -1 && (bracket == -1 || dollars < bracket)) {
            open = DOLLARS;
            close = DOLLARS;
            openAt = dollars;
        } else if (bracket != -1) {
            open = BRACKET_OPEN;
            close = BRACKET_CLOSE;
            openAt = bracket;
        } else {
            throw new BlockParseException("no display math delimiter ($$ or \\[)", lineOffset);
        }

        int closeAt = rawText.indexOf(close, openAt + open.length());
        if (closeAt == -1) {
            throw new BlockParseException("missing closing " + close, lineAt(rawText, openAt, lineOffset));
        }

        LatexAst ast = new LatexAst(
                rawText.substring(0, openAt),
                open,
                rawText.substring(openAt + open.length(), closeAt),
                close,
                rawText.substring(closeAt + close.length()));

        BlockMetadata.Builder metadata = BlockMetadata.builder().property("delimiter", open);
        Matcher label = LABEL.matcher(ast.getBody());
        if (label.find()) {
            metadata.id(label.group(1).trim());
        }
        Matcher environment = ENVIRONMENT.matcher(ast.getBody());
        if (environment.find()) {
            metadata.property("environment", environment.group(1));
        }
        return new ParsedBlock(ast, metadata.build());
    }

    @Override
    public String render(BlockAst ast, BlockMetadata metadata) {
        if (!(ast instanceof LatexAst latex)) {
            throw new IllegalArgumentException("Expected a LaTeX block, got " + ast.getSyntax());
        }
        return latex.getPrefix() + latex.getOpenDelimiter() + latex.getBody()
                + latex.getCloseDelimiter() + latex.getSuffix();
    }

    private static int lineAt(String text, int index, int lineOffset) {
        int line = lineOffset;
        for (int i = 0; i < index; i++) {
            if (text.charAt(i) == '\n') line++;
        }
        return line;
    }
}
