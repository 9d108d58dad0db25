package org.dxworks.fortranframe.parser;

/** What a classified statement does to the block stack. */
public enum StatementRole {
    OPEN,
    CLOSE,
    /** Bare {@code end}: closes whichever program unit is innermost. */
    CLOSE_UNIT,
    ELSE,
    ELSE_IF,
    CASE,
    SIMPLE
}
