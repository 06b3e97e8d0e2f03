package org.dxworks.hybridnote.model;

import org.dxworks.hybridnote.SyntaxKind;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * A document is either {@link Standard} (one syntax, one structure) or {@link Hybrid} (a
 * {@link HybridNote}). There are no other variants; use {@link #match} to handle both.
 * Converting between the two is explicit, see {@code DocumentConverter}.
 */
public abstract class Document {

    private Document() {
    }

    public static Hybrid hybrid(String id, String title) {
        return new Hybrid(new HybridNote(id, title));
    }

    public static Hybrid hybrid(HybridNote note) {
        return new Hybrid(note);
    }

    public static Standard standard(String id, String title, SyntaxKind syntaxKind, BlockAst ast, BlockMetadata metadata) {
        return new Standard(id, title, syntaxKind, ast, metadata);
    }

    public abstract String id();

    public abstract String title();

    public abstract DocumentFormat format();

    public Optional<HybridNote> asHybrid() {
        return Optional.empty();
    }

    public Optional<Standard> asStandard() {
        return Optional.empty();
    }

    public abstract <R> R match(Function<Standard, R> onStandard, Function<Hybrid, R> onHybrid);

    public static final class Standard extends Document {
        private final String id;
        private final String title;
        private final SyntaxKind syntaxKind;
        private final BlockAst ast;
        private final BlockMetadata metadata;

        private Standard(String id, String title, SyntaxKind syntaxKind, BlockAst ast, BlockMetadata metadata) {
            this.id = Objects.requireNonNull(id, "id");
            this.title = title == null ? "" : title;
            this.syntaxKind = Objects.requireNonNull(syntaxKind, "syntaxKind");
            this.ast = Objects.requireNonNull(ast, "ast");
            this.metadata = metadata == null ? BlockMetadata.empty() : metadata;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public String title() {
            return title;
        }

        @Override
        public DocumentFormat format() {
            return DocumentFormat.ABSTRACT;
        }

        public SyntaxKind getSyntaxKind() {
            return syntaxKind;
        }

        public BlockAst getAst() {
            return ast;
        }

        public BlockMetadata getMetadata() {
            return metadata;
        }

        @Override
        public Optional<Standard> asStandard() {
            return Optional.of(this);
        }

        @Override
        public <R> R match(Function<Standard, R> onStandard, Function<Hybrid, R> onHybrid) {
            return onStandard.apply(this);
        }
    }

    public static final class Hybrid extends Document {
        private final HybridNote note;

        private Hybrid(HybridNote note) {
            this.note = Objects.requireNonNull(note, "note");
        }

        public HybridNote getNote() {
            return note;
        }

        @Override
        public String id() {
            return note.getId();
        }

        @Override
        public String title() {
            return note.getTitle();
        }

        @Override
        public DocumentFormat format() {
            return DocumentFormat.HYBRID;
        }

        @Override
        public Optional<HybridNote> asHybrid() {
            return Optional.of(note);
        }

        @Override
        public <R> R match(Function<Standard, R> onStandard, Function<Hybrid, R> onHybrid) {
            return onHybrid.apply(this);
        }
    }
}
