package io.txxt.structure.lexer;

/**
 * Cursor state of one lexer run. Markup is only recognized in {@link #NORMAL}.
 */
enum LexerState {
    NORMAL,
    IN_VERBATIM
}
