package org.dxworks.hybridnote.model.org;

import org.dxworks.hybridnote.model.BlockAst;

import java.util.List;
import java.util.Objects;

public final class OrgHeadline implements BlockAst {

    private final int level;
    private final String todoKeyword; // nullable
    private final String title;
    private final List<String> tags;
    private final String lineTerminator;
    private final String body;

    public OrgHeadline(int level, String todoKeyword, String title, List<String> tags,
                       String lineTerminator, String body) {
        if (level < 1) {
            throw new IllegalArgumentException("Headline level must be >= 1, was " + level);
        }
        this.level = level;
        this.todoKeyword = todoKeyword;
        this.title = Objects.requireNonNull(title, "title");
        this.tags = List.copyOf(tags);
        this.lineTerminator = Objects.requireNonNull(lineTerminator, "lineTerminator");
        this.body = Objects.requireNonNull(body, "body");
    }

    public int getLevel() {
        return level;
    }

    public String getTodoKeyword() {
        return todoKeyword;
    }

    public String getTitle() {
        return title;
    }

    public List<String> getTags() {
        return tags;
    }

    public String getLineTerminator() {
        return lineTerminator;
    }

    /**
     * Everything after the headline line, drawers included, verbatim.
     */
    public String getBody() {
        return body;
    }

    @Override
    public String getSyntax() {
        return "org";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrgHeadline other)) return false;
        return level == other.level
                && Objects.equals(todoKeyword, other.todoKeyword)
                && title.equals(other.title)
                && tags.equals(other.tags)
                && lineTerminator.equals(other.lineTerminator)
                && body.equals(other.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, todoKeyword, title, tags, lineTerminator, body);
    }
}
