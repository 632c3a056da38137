package org.crossword.support;

/**
 * Casella della griglia identificata da riga e colonna (indici a base 0).
 */
public record Cell(int row, int col) {}
