package org.dxworks.hybridnote.model;

public enum DocumentFormat {
    /** One syntax, one structure for the whole document. */
    ABSTRACT,
    /** A sequence of blocks, each in its own syntax. */
    HYBRID
}
