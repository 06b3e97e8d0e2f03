package org.dxworks.hybridnote.model;

public interface BlockAst {
    String getSyntax();
}
