package org.dxworks.hybridnote.model.markdown;

import org.dxworks.hybridnote.model.BlockAst;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class MarkdownAst implements BlockAst {

    private final List<MarkdownElement> elements;
    private final Map<String, String> frontMatter;
    private final String source;

    public MarkdownAst(List<MarkdownElement> elements, Map<String, String> frontMatter, String source) {
        this.elements = List.copyOf(elements);
        this.frontMatter = Map.copyOf(frontMatter);
        this.source = Objects.requireNonNull(source, "source");
    }

    public List<MarkdownElement> getElements() {
        return elements;
    }

    public Map<String, String> getFrontMatter() {
        return frontMatter;
    }

    public String getSource() {
        return source;
    }

    /**
     * True when the block is nothing but one heading.
     */
    public boolean isSingleHeading() {
        return elements.size() == 1 && "heading".equals(elements.get(0).type);
    }

    @Override
    public String getSyntax() {
        return "markdown";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MarkdownAst other)) return false;
        return source.equals(other.source) && frontMatter.equals(other.frontMatter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, frontMatter);
    }
}
