package org.dxworks.hybridnote.model;

import java.util.Objects;

public final class RawAst implements BlockAst {

    private final String text;

    public RawAst(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    public String getText() {
        return text;
    }

    @Override
    public String getSyntax() {
        return "raw";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawAst other)) return false;
        return text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }
}
