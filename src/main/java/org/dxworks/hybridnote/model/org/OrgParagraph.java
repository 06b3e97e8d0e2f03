package org.dxworks.hybridnote.model.org;

import org.dxworks.hybridnote.model.BlockAst;

import java.util.Map;
import java.util.Objects;

public final class OrgParagraph implements BlockAst {

    private final String text;
    private final Map<String, String> keywords;

    public OrgParagraph(String text, Map<String, String> keywords) {
        this.text = Objects.requireNonNull(text, "text");
        this.keywords = Map.copyOf(keywords);
    }

    public String getText() {
        return text;
    }

    public Map<String, String> getKeywords() {
        return keywords;
    }

    @Override
    public String getSyntax() {
        return "org";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrgParagraph other)) return false;
        return text.equals(other.text) && keywords.equals(other.keywords);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, keywords);
    }
}
