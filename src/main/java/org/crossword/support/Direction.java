package org.crossword.support;

/**
 * Orientamento di uno spazio del cruciverba.
 *
 * • ACROSS: la parola si legge da sinistra verso destra (orizzontale)
 * • DOWN: la parola si legge dall'alto verso il basso (verticale)
 */
public enum Direction {
    ACROSS,
    DOWN
}
