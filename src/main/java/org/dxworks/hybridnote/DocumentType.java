package org.dxworks.hybridnote;

public enum DocumentType {
    MARKDOWN("markdown", SyntaxKind.MARKDOWN),
    ORG("org", SyntaxKind.ORG);

    private final String name;
    private final SyntaxKind proseSyntax;

    DocumentType(String name, SyntaxKind proseSyntax) {
        this.name = name;
        this.proseSyntax = proseSyntax;
    }

    public String getName() {
        return name;
    }

    /**
     * Syntax of the text between special blocks in files of this type.
     */
    public SyntaxKind getProseSyntax() {
        return proseSyntax;
    }
}
