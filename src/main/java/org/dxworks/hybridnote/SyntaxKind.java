package org.dxworks.hybridnote;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * Syntax tag of a block. The built-in families are closed; CODE and CUSTOM carry a payload
 * (language or syntax name) and compare by it.
 */
public final class SyntaxKind {

    public enum Family {
        MARKDOWN("markdown", "Markdown"),
        ORG("org", "Org-mode"),
        LATEX("latex", "LaTeX"),
        CODE("code", "Code"),
        CUSTOM("custom", "Custom");

        private final String name;
        private final String displayName;

        Family(String name, String displayName) {
            this.name = name;
            this.displayName = displayName;
        }

        public String getName() {
            return name;
        }

        public String getDisplayName() {
            return displayName;
        }
    }

    public static final SyntaxKind MARKDOWN = new SyntaxKind(Family.MARKDOWN, "");
    public static final SyntaxKind ORG = new SyntaxKind(Family.ORG, "");
    public static final SyntaxKind LATEX = new SyntaxKind(Family.LATEX, "");

    private final Family family;
    private final String payload;

    private SyntaxKind(Family family, String payload) {
        this.family = family;
        this.payload = payload;
    }

    /**
     * Fenced code in the given language. An empty language means an untagged fence.
     */
    public static SyntaxKind code(String language) {
        return new SyntaxKind(Family.CODE, language == null ? "" : language.trim());
    }

    public static SyntaxKind custom(String name) {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Custom syntax name must not be blank");
        }
        return new SyntaxKind(Family.CUSTOM, name.trim());
    }

    /**
     * Reverse of {@link #getName()}: {@code markdown}, {@code org}, {@code latex},
     * {@code code:<language>}, {@code custom:<name>}.
     */
    @JsonCreator
    public static SyntaxKind parse(String name) {
        Objects.requireNonNull(name, "name");
        String lower = name.trim().toLowerCase(Locale.ROOT);
        SyntaxKind builtIn = switch (lower) {
            case "markdown" -> MARKDOWN;
            case "org" -> ORG;
            case "latex" -> LATEX;
            case "code" -> code("");
            default -> null;
        };
        if (builtIn != null) {
            return builtIn;
        }
        int colon = name.indexOf(':');
        if (colon > 0) {
            String prefix = name.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String rest = name.substring(colon + 1);
            if (prefix.equals(Family.CODE.getName())) {
                return code(rest);
            }
            if (prefix.equals(Family.CUSTOM.getName())) {
                return custom(rest);
            }
        }
        throw new IllegalArgumentException("Unknown syntax kind: " + name);
    }

    public Family getFamily() {
        return family;
    }

    /**
     * Language of a CODE kind, or name of a CUSTOM kind; empty for the other families.
     */
    public String getPayload() {
        return payload;
    }

    public boolean isCode() {
        return family == Family.CODE;
    }

    @JsonValue
    public String getName() {
        if (family == Family.CODE || family == Family.CUSTOM) {
            return payload.isEmpty() ? family.getName() : family.getName() + ":" + payload;
        }
        return family.getName();
    }

    public String displayName() {
        return family.getDisplayName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SyntaxKind other)) return false;
        return family == other.family && payload.equals(other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(family, payload);
    }

    @Override
    public String toString() {
        return getName();
    }
}
