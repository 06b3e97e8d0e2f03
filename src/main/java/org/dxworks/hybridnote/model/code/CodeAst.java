package org.dxworks.hybridnote.model.code;

import org.dxworks.hybridnote.model.BlockAst;

import java.util.Objects;

public final class CodeAst implements BlockAst {

    private final String language; // empty for an untagged fence
    private final String openingFence;
    private final String code;
    private final String closingFence; // empty when the fence was never closed
    private final String trailing;

    public CodeAst(String language, String openingFence, String code, String closingFence, String trailing) {
        this.language = Objects.requireNonNull(language, "language");
        this.openingFence = Objects.requireNonNull(openingFence, "openingFence");
        this.code = Objects.requireNonNull(code, "code");
        this.closingFence = Objects.requireNonNull(closingFence, "closingFence");
        this.trailing = Objects.requireNonNull(trailing, "trailing");
    }

    public String getLanguage() {
        return language;
    }

    public String getOpeningFence() {
        return openingFence;
    }

    public String getCode() {
        return code;
    }

    public String getClosingFence() {
        return closingFence;
    }

    public String getTrailing() {
        return trailing;
    }

    public boolean isClosed() {
        return !closingFence.isEmpty();
    }

    @Override
    public String getSyntax() {
        return "code";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CodeAst other)) return false;
        return language.equals(other.language)
                && openingFence.equals(other.openingFence)
                && code.equals(other.code)
                && closingFence.equals(other.closingFence)
                && trailing.equals(other.trailing);
    }

    @Override
    public int hashCode() {
        return Objects.hash(language, openingFence, code, closingFence, trailing);
    }
}
