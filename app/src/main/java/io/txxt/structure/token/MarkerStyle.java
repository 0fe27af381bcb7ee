package io.txxt.structure.token;

/**
 * Numbering style of a list sequence marker.
 */
public enum MarkerStyle {
    PLAIN,
    NUMERICAL,
    ALPHABETICAL,
    ROMAN
}
