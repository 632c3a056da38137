package org.crossword.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * VARIABILE DEL CRUCIVERBA - Spazio orizzontale o verticale da riempire con una parola
 *
 * Identifica univocamente uno spazio della griglia tramite posizione della prima casella,
 * orientamento e lunghezza. È il tipo chiave di tutte le strutture del solutore CSP
 * (domini, sovrapposizioni, assegnamenti).
 *
 * INVARIANTI MANTENUTE:
 * • Oggetto immutabile dopo la costruzione
 * • Uguaglianza e hash basati su tutti e quattro i campi
 * • Ordinamento naturale totale: riga, colonna, orientamento, lunghezza
 * • Lunghezza sempre ≥ 1, coordinate sempre ≥ 0
 */
public final class Variable implements Comparable<Variable> {

    /** Ordinamento deterministico usato per gli spareggi delle euristiche */
    private static final Comparator<Variable> NATURAL_ORDER = Comparator
            .comparingInt(Variable::getRow)
            .thenComparingInt(Variable::getCol)
            .thenComparing(Variable::getDirection)
            .thenComparingInt(Variable::getLength);

    //region ATTRIBUTI

    /** Riga della prima casella dello spazio */
    private final int row;

    /** Colonna della prima casella dello spazio */
    private final int col;

    /** Orientamento della parola */
    private final Direction direction;

    /** Numero di caselle, ossia lunghezza richiesta della parola */
    private final int length;

    /** Caselle occupate in ordine di lettura, calcolate una sola volta */
    private final List<Cell> cells;

    //endregion

    //region COSTRUZIONE

    /**
     * Costruisce una variabile validando i parametri.
     *
     * @param row riga iniziale (≥ 0)
     * @param col colonna iniziale (≥ 0)
     * @param direction orientamento (non null)
     * @param length lunghezza della parola (≥ 1)
     * @throws IllegalArgumentException se i parametri non sono validi
     */
    public Variable(int row, int col, Direction direction, int length) {
        if (row < 0 || col < 0) {
            throw new IllegalArgumentException("Coordinate non valide: (" + row + ", " + col + ")");
        }
        if (direction == null) {
            throw new IllegalArgumentException("L'orientamento non può essere null");
        }
        if (length < 1) {
            throw new IllegalArgumentException("Lunghezza deve essere ≥ 1, ricevuto: " + length);
        }

        this.row = row;
        this.col = col;
        this.direction = direction;
        this.length = length;
        this.cells = computeCells();
    }

    private List<Cell> computeCells() {
        List<Cell> result = new ArrayList<>(length);
        for (int k = 0; k < length; k++) {
            int r = row + (direction == Direction.DOWN ? k : 0);
            int c = col + (direction == Direction.ACROSS ? k : 0);
            result.add(new Cell(r, c));
        }
        return Collections.unmodifiableList(result);
    }

    //endregion

    //region ACCESSORS

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    public Direction getDirection() {
        return direction;
    }

    public int getLength() {
        return length;
    }

    /**
     * @return caselle della variabile in ordine di lettura (lista immutabile)
     */
    public List<Cell> getCells() {
        return cells;
    }

    //endregion

    //region UGUAGLIANZA E ORDINAMENTO

    @Override
    public int compareTo(Variable other) {
        return NATURAL_ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Variable other = (Variable) obj;
        return row == other.row &&
                col == other.col &&
                length == other.length &&
                direction == other.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, col, direction, length);
    }

    @Override
    public String toString() {
        return "(" + row + ", " + col + ") " + direction + " : " + length;
    }

    //endregion
}
