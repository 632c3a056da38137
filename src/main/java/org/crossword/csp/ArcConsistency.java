package org.crossword.csp;

import org.crossword.support.Arc;
import org.crossword.support.Crossword;
import org.crossword.support.DomainStore;
import org.crossword.support.Overlap;
import org.crossword.support.Variable;

import java.util.*;
import java.util.logging.Logger;

/**
 * PROPAGAZIONE DEI VINCOLI - Consistenza di nodo e consistenza d'arco (AC-3)
 *
 * Restringe i domini del {@link DomainStore} eliminando le parole che non possono
 * comparire in nessuna soluzione:
 * • Consistenza di nodo: vincolo unario sulla lunghezza della parola
 * • Revisione di arco: vincolo binario sulla lettera condivisa tra due variabili
 * • AC-3: punto fisso guidato da una coda di archi con reinserimento dei vicini
 *
 * Le rimozioni vengono sempre raccolte prima di essere applicate: nessun dominio
 * viene modificato mentre lo si sta iterando.
 */
public class ArcConsistency {

    private static final Logger LOGGER = Logger.getLogger(ArcConsistency.class.getName());

    private final Crossword crossword;
    private final DomainStore domains;
    private final CSPStatistics statistics;

    /**
     * @param crossword geometria e tabella delle sovrapposizioni (sola lettura)
     * @param domains domini da restringere
     * @param statistics raccoglitore delle metriche di propagazione
     */
    public ArcConsistency(Crossword crossword, DomainStore domains, CSPStatistics statistics) {
        this.crossword = Objects.requireNonNull(crossword, "crossword");
        this.domains = Objects.requireNonNull(domains, "domains");
        this.statistics = Objects.requireNonNull(statistics, "statistics");
    }

    //region CONSISTENZA DI NODO

    /**
     * Rimuove da ogni dominio le parole di lunghezza diversa da quella della variabile.
     *
     * Singola passata, nessuna interazione tra variabili. Su domini già consistenti
     * non ha effetto.
     */
    public void enforceNodeConsistency() {
        int totalRemoved = 0;

        for (Variable variable : domains.variables()) {
            List<String> removals = new ArrayList<>();
            for (String word : domains.get(variable)) {
                if (word.length() != variable.getLength()) {
                    removals.add(word);
                }
            }
            totalRemoved += domains.removeAll(variable, removals);
        }

        statistics.addNodeConsistencyRemovals(totalRemoved);
        LOGGER.fine("Consistenza di nodo: " + totalRemoved + " parole rimosse");
    }

    //endregion

    //region REVISIONE DI ARCO

    /**
     * Rende la variabile x arco-consistente rispetto a y.
     *
     * Una parola wx resta nel dominio di x se esiste almeno una wy nel dominio di y
     * con wx[i] == wy[j], dove (i, j) è la sovrapposizione tra x e y. Due parole
     * uguali sono compatibili. Senza sovrapposizione le due variabili non si
     * vincolano e nessuna parola viene rimossa. Il dominio di y non viene mai modificato.
     *
     * @param x variabile da revisionare
     * @param y variabile di supporto
     * @return true se il dominio di x è stato ristretto
     */
    public boolean revise(Variable x, Variable y) {
        statistics.incrementRevisions();

        Overlap overlap = crossword.getOverlap(x, y);
        if (overlap == null) {
            return false;
        }

        // Lettere disponibili in y nella casella condivisa
        Set<Character> supportLetters = new HashSet<>();
        for (String wordY : domains.get(y)) {
            supportLetters.add(wordY.charAt(overlap.second()));
        }

        List<String> removals = new ArrayList<>();
        for (String wordX : domains.get(x)) {
            if (!supportLetters.contains(wordX.charAt(overlap.first()))) {
                removals.add(wordX);
            }
        }

        if (removals.isEmpty()) {
            return false;
        }

        int removed = domains.removeAll(x, removals);
        statistics.addArcRemovals(removed);
        LOGGER.fine(() -> "revise" + new Arc(x, y) + ": rimosse " + removed + " parole, restano " + domains.size(x));
        return true;
    }

    //endregion

    //region AC-3

    /**
     * Esegue AC-3 partendo da tutti gli archi tra coppie ordinate di variabili distinte.
     *
     * @return true se nessun dominio è vuoto al termine, false altrimenti
     */
    public boolean ac3() {
        return ac3(allArcs());
    }

    /**
     * Esegue AC-3 partendo dalla coda di archi indicata.
     *
     * ALGORITMO:
     * 1. Estrae l'arco (x, y) in testa alla coda
     * 2. Applica revise(x, y)
     * 3. Se il dominio di x è diventato vuoto: fallimento immediato
     * 4. Se il dominio di x si è ristretto: accoda (z, x) per ogni vicino z di x diverso da y
     * 5. Termina con coda vuota (punto fisso raggiunto)
     *
     * @param arcs archi iniziali da processare (null = tutti gli archi)
     * @return true se nessun dominio è vuoto al termine, false se un dominio si è svuotato
     */
    public boolean ac3(Collection<Arc> arcs) {
        Deque<Arc> queue = new ArrayDeque<>(arcs != null ? arcs : allArcs());
        LOGGER.fine("AC-3 avviato con " + queue.size() + " archi");

        while (!queue.isEmpty()) {
            Arc arc = queue.poll();
            Variable x = arc.getX();
            Variable y = arc.getY();

            if (!revise(x, y)) continue;

            if (domains.isEmpty(x)) {
                LOGGER.fine("AC-3: dominio vuoto per " + x);
                return false;
            }

            for (Variable z : crossword.neighbors(x)) {
                if (!z.equals(y)) {
                    queue.add(new Arc(z, x));
                }
            }
        }

        return !domains.hasEmptyDomain();
    }

    /**
     * @return tutti gli archi (x, y) con x ≠ y, in ordine naturale delle variabili
     */
    public List<Arc> allArcs() {
        List<Arc> arcs = new ArrayList<>();
        for (Variable x : domains.variables()) {
            for (Variable y : domains.variables()) {
                if (!x.equals(y)) {
                    arcs.add(new Arc(x, y));
                }
            }
        }
        return arcs;
    }

    //endregion
}
