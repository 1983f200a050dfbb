package org.dxworks.flowframe.analyzer;

public enum BindingKind {
    VAR,
    LET,
    CONST,
    FUNCTION,
    CLASS,
    PARAMETER,
    CATCH,
    IMPORT
}
