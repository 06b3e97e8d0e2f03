package org.dxworks.hybridnote.parser;

import org.dxworks.hybridnote.SyntaxKind;

public class ParserRegistrationException extends RuntimeException {

    private final SyntaxKind syntaxKind;

    public ParserRegistrationException(SyntaxKind syntaxKind) {
        super("A parser is already registered for syntax " + syntaxKind);
        this.syntaxKind = syntaxKind;
    }

    public SyntaxKind getSyntaxKind() {
        return syntaxKind;
    }
}
