package org.dxworks.hybridnote.model.org;

import org.dxworks.hybridnote.model.BlockAst;

import java.util.Objects;

public final class OrgBlock implements BlockAst {

    private final String blockType;
    private final String parameters;
    private final String beginLine;
    private final String contents;
    private final String endLine;
    private final String trailing;

    public OrgBlock(String blockType, String parameters, String beginLine, String contents,
                    String endLine, String trailing) {
        this.blockType = Objects.requireNonNull(blockType, "blockType");
        this.parameters = Objects.requireNonNull(parameters, "parameters");
        this.beginLine = Objects.requireNonNull(beginLine, "beginLine");
        this.contents = Objects.requireNonNull(contents, "contents");
        this.endLine = Objects.requireNonNull(endLine, "endLine");
        this.trailing = Objects.requireNonNull(trailing, "trailing");
    }

    /**
     * Upper-cased block type, e.g. {@code SRC} or {@code QUOTE}.
     */
    public String getBlockType() {
        return blockType;
    }

    public String getParameters() {
        return parameters;
    }

    public String getBeginLine() {
        return beginLine;
    }

    public String getContents() {
        return contents;
    }

    public String getEndLine() {
        return endLine;
    }

    public String getTrailing() {
        return trailing;
    }

    public boolean isSourceBlock() {
        return "SRC".equals(blockType);
    }

    @Override
    public String getSyntax() {
        return "org";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrgBlock other)) return false;
        return blockType.equals(other.blockType)
                && parameters.equals(other.parameters)
                && beginLine.equals(other.beginLine)
                && contents.equals(other.contents)
                && endLine.equals(other.endLine)
                && trailing.equals(other.trailing);
    }

    @Override
    public int hashCode() {
        return Objects.hash(blockType, parameters, beginLine, contents, endLine, trailing);
    }
}
