package org.crossword.support;

/**
 * Sovrapposizione tra due variabili che condividono una casella.
 *
 * Per la coppia ordinata (x, y): il carattere di indice {@code first} della parola di x
 * deve coincidere con il carattere di indice {@code second} della parola di y.
 *
 * @param first indice del carattere condiviso nella parola della prima variabile
 * @param second indice del carattere condiviso nella parola della seconda variabile
 */
public record Overlap(int first, int second) {

    /**
     * Descrive la stessa casella vista dalla coppia (y, x).
     *
     * @return sovrapposizione con indici scambiati
     */
    public Overlap reversed() {
        return new Overlap(second, first);
    }
}
