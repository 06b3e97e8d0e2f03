package org.dxworks.hybridnote.detector;

enum DetectorState {
    DEFAULT,
    IN_ORG_BLOCK,
    IN_CODE_FENCE,
    IN_LATEX_BRACKET
}
