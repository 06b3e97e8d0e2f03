package org.dxworks.hybridnote.model.latex;

import org.dxworks.hybridnote.model.BlockAst;

import java.util.Objects;

public final class LatexAst implements BlockAst {

    private final String prefix;
    private final String openDelimiter;
    private final String body;
    private final String closeDelimiter;
    private final String suffix;

    public LatexAst(String prefix, String openDelimiter, String body, String closeDelimiter, String suffix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.openDelimiter = Objects.requireNonNull(openDelimiter, "openDelimiter");
        this.body = Objects.requireNonNull(body, "body");
        this.closeDelimiter = Objects.requireNonNull(closeDelimiter, "closeDelimiter");
        this.suffix = Objects.requireNonNull(suffix, "suffix");
    }

    public String getPrefix() {
        return prefix;
    }

    public String getOpenDelimiter() {
        return openDelimiter;
    }

    /**
     * The formula exactly as written between the delimiters.
     */
    public String getBody() {
        return body;
    }

    public String getMath() {
        return body.trim();
    }

    public String getCloseDelimiter() {
        return closeDelimiter;
    }

    public String getSuffix() {
        return suffix;
    }

    @Override
    public String getSyntax() {
        return "latex";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LatexAst other)) return false;
        return prefix.equals(other.prefix)
                && openDelimiter.equals(other.openDelimiter)
                && body.equals(other.body)
                && closeDelimiter.equals(other.closeDelimiter)
                && suffix.equals(other.suffix);
    }

    @Override
    public int hashCode() {
        return Objects.hash(prefix, openDelimiter, body, closeDelimiter, suffix);
    }
}
