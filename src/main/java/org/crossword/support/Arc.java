package org.crossword.support;

import java.util.Objects;

/**
 * Arco orientato (x, y) per l'algoritmo AC-3.
 *
 * Significato: ogni parola rimasta nel dominio di x deve avere almeno una parola
 * compatibile nel dominio di y. Le due variabili sono sempre distinte.
 */
public final class Arc {

    private final Variable x;
    private final Variable y;

    /**
     * @param x variabile il cui dominio viene revisionato
     * @param y variabile che fornisce il supporto
     * @throws IllegalArgumentException se una variabile è null o se x e y coincidono
     */
    public Arc(Variable x, Variable y) {
        if (x == null || y == null) {
            throw new IllegalArgumentException("Le variabili di un arco non possono essere null");
        }
        if (x.equals(y)) {
            throw new IllegalArgumentException("Un arco richiede due variabili distinte: " + x);
        }
        this.x = x;
        this.y = y;
    }

    public Variable getX() {
        return x;
    }

    public Variable getY() {
        return y;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Arc other = (Arc) obj;
        return x.equals(other.x) && y.equals(other.y);
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y);
    }

    @Override
    public String toString() {
        return "(" + x + " -> " + y + ")";
    }
}
