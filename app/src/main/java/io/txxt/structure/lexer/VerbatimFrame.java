package io.txxt.structure.lexer;

import io.txxt.structure.token.Position;

/**
 * An open verbatim block: where its title sits and how much indentation its content lines shed.
 */
record VerbatimFrame(VerbatimMode mode, int titleWidth, int wall, Position title) {
}
