package org.crossword.csp;

import org.crossword.support.Arc;
import org.crossword.support.Crossword;
import org.crossword.support.DomainStore;
import org.crossword.support.Overlap;
import org.crossword.support.Variable;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * SOLUTORE CSP DEL CRUCIVERBA - Propagazione dei vincoli e ricerca con backtracking
 *
 * Pipeline di risoluzione:
 * 1. Consistenza di nodo: ogni dominio contiene solo parole della lunghezza giusta
 * 2. AC-3: ogni parola ha supporto in ogni variabile che si sovrappone
 * 3. Backtracking: esplorazione in profondità degli assegnamenti parziali guidata da
 *    MRV + grado (scelta variabile) e LCV (ordine dei valori)
 *
 * CARATTERISTICHE:
 * • Una sola variabile assegnata per livello di ricorsione (profondità ≤ numero variabili)
 * • Inserimento dell'assegnamento tentativo con rimozione garantita su ogni uscita
 * • Spareggi deterministici: ordine naturale delle variabili e ordine alfabetico delle parole
 * • Inferenza opzionale (mantenimento della consistenza d'arco) disattivata di default
 * • Interruzione cooperativa: ad ogni livello si verifica se il thread è stato interrotto
 *
 * L'assenza di soluzioni non è un errore: produce un {@link CSPResult} UNSAT.
 */
public class CrosswordCreator {

    /** Logger per tracciamento delle fasi di risoluzione */
    private static final Logger LOGGER = Logger.getLogger(CrosswordCreator.class.getName());

    //region STRUTTURE DATI CORE

    /** Geometria, vocabolario e tabella delle sovrapposizioni */
    private final Crossword crossword;

    /** Domini correnti delle variabili */
    private final DomainStore domains;

    /** Metriche di propagazione e ricerca */
    private final CSPStatistics statistics;

    /** Motore di propagazione condiviso con la ricerca */
    private final ArcConsistency arcConsistency;

    /** true per eseguire AC-3 dopo ogni assegnamento consistente */
    private final boolean useInference;

    //endregion

    //region INIZIALIZZAZIONE

    /**
     * Crea il solutore senza inferenza durante la ricerca.
     *
     * @param crossword cruciverba da risolvere
     */
    public CrosswordCreator(Crossword crossword) {
        this(crossword, false);
    }

    /**
     * Crea il solutore inizializzando ogni dominio con l'intero vocabolario.
     *
     * @param crossword cruciverba da risolvere
     * @param useInference true per mantenere la consistenza d'arco durante la ricerca
     */
    public CrosswordCreator(Crossword crossword, boolean useInference) {
        if (crossword == null) {
            throw new IllegalArgumentException("Il cruciverba non può essere null");
        }

        this.crossword = crossword;
        this.domains = new DomainStore(crossword.getVariables(), crossword.getWords());
        this.statistics = new CSPStatistics();
        this.arcConsistency = new ArcConsistency(crossword, domains, statistics);
        this.useInference = useInference;

        if (useInference) {
            System.out.println("[I] Inferenza durante la ricerca abilitata!");
        }
    }

    //endregion

    //region INTERFACCIA PUBBLICA

    /**
     * Applica consistenza di nodo e AC-3, poi risolve il CSP con backtracking.
     *
     * @return SAT con assegnamento completo, oppure UNSAT
     * @throws InterruptedException se il thread viene interrotto (timeout esterno)
     */
    public CSPResult solve() throws InterruptedException {
        System.out.println("\n=== AVVIO RISOLUZIONE CSP ===");
        System.out.printf("[I] Variabili: %d, parole nel vocabolario: %d%n",
                crossword.getVariables().size(), crossword.getWords().size());

        statistics.startTimer();
        try {
            // FASE 1: vincoli unari
            enforceNodeConsistency();

            // FASE 2: vincoli binari fino al punto fisso
            if (!ac3()) {
                statistics.stopTimer();
                System.out.println("[I] AC-3 ha svuotato almeno un dominio: nessuna soluzione");
                return CSPResult.unsatisfiable("dominio vuoto dopo la propagazione AC-3", statistics);
            }
            logDomainSizes();

            // FASE 3: ricerca
            Map<Variable, String> assignment = backtrack(new LinkedHashMap<>());
            statistics.stopTimer();

            if (assignment == null) {
                System.out.println("[I] Ricerca esaurita: nessuna soluzione");
                return CSPResult.unsatisfiable("ricerca con backtracking esaurita", statistics);
            }

            System.out.println("[I] Soluzione trovata");
            return CSPResult.satisfiable(assignment, statistics);

        } catch (InterruptedException e) {
            statistics.stopTimer();
            System.out.println("[I] Risoluzione interrotta per timeout");
            throw e;
        } catch (RuntimeException e) {
            statistics.stopTimer();
            LOGGER.log(Level.SEVERE, "Errore critico durante la risoluzione CSP", e);
            throw new IllegalStateException("Errore critico nella risoluzione CSP: " + e.getMessage(), e);
        }
    }

    /**
     * Consistenza di nodo sui domini correnti.
     */
    public void enforceNodeConsistency() {
        arcConsistency.enforceNodeConsistency();
    }

    /**
     * Revisione dell'arco (x, y) sui domini correnti.
     *
     * @return true se il dominio di x è stato ristretto
     */
    public boolean revise(Variable x, Variable y) {
        return arcConsistency.revise(x, y);
    }

    /**
     * AC-3 su tutti gli archi del problema.
     *
     * @return true se nessun dominio è vuoto
     */
    public boolean ac3() {
        return arcConsistency.ac3();
    }

    /**
     * AC-3 sugli archi indicati.
     *
     * @param arcs archi iniziali (null = tutti gli archi)
     * @return true se nessun dominio è vuoto
     */
    public boolean ac3(Collection<Arc> arcs) {
        return arcConsistency.ac3(arcs);
    }

    public Crossword getCrossword() {
        return crossword;
    }

    /**
     * @return domini correnti (modificabili per preparare scenari specifici)
     */
    public DomainStore getDomains() {
        return domains;
    }

    public CSPStatistics getStatistics() {
        return statistics;
    }

    //endregion

    //region PREDICATI SULL'ASSEGNAMENTO

    /**
     * Verifica se l'assegnamento copre tutte le variabili con parole non vuote.
     *
     * @param assignment assegnamento variabile -> parola
     * @return true se le chiavi coincidono con le variabili e nessuna parola è vuota
     */
    public boolean assignmentComplete(Map<Variable, String> assignment) {
        if (!assignment.keySet().equals(crossword.getVariables())) {
            return false;
        }
        for (String word : assignment.values()) {
            if (word == null || word.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Verifica che ogni coppia di variabili assegnate che si sovrappongono abbia
     * la stessa lettera nella casella condivisa. Le variabili non assegnate non
     * impongono vincoli.
     *
     * @param assignment assegnamento parziale o completo
     * @return true se non ci sono conflitti tra le lettere condivise
     */
    public boolean consistent(Map<Variable, String> assignment) {
        for (Map.Entry<Variable, String> entry : assignment.entrySet()) {
            Variable variable = entry.getKey();
            String word = entry.getValue();

            for (Variable neighbor : crossword.neighbors(variable)) {
                String neighborWord = assignment.get(neighbor);
                if (neighborWord == null) continue;

                Overlap overlap = crossword.getOverlap(variable, neighbor);
                if (word == null || overlap.first() >= word.length() || overlap.second() >= neighborWord.length()) {
                    return false;
                }
                if (word.charAt(overlap.first()) != neighborWord.charAt(overlap.second())) {
                    return false;
                }
            }
        }
        return true;
    }

    //endregion

    //region EURISTICHE

    /**
     * Ordina i valori del dominio di una variabile con l'euristica LCV.
     *
     * Per ogni parola candidata conta, su tutti i vicini non ancora assegnati, quante
     * parole del loro dominio corrente risulterebbero incompatibili nella casella
     * condivisa. L'ordinamento è crescente e stabile: a parità di conteggio resta
     * l'ordine alfabetico del dominio.
     *
     * @param variable variabile da espandere
     * @param assignment assegnamento parziale corrente
     * @return parole del dominio, dalla meno vincolante alla più vincolante
     * @throws InterruptedException se il thread viene interrotto durante il conteggio
     */
    public List<String> orderDomainValues(Variable variable, Map<Variable, String> assignment)
            throws InterruptedException {
        List<Variable> unassignedNeighbors = new ArrayList<>();
        for (Variable neighbor : crossword.neighbors(variable)) {
            if (!assignment.containsKey(neighbor)) {
                unassignedNeighbors.add(neighbor);
            }
        }

        Map<String, Integer> eliminated = new HashMap<>();
        for (String word : domains.get(variable)) {
            checkForInterruption();
            int count = 0;
            for (Variable neighbor : unassignedNeighbors) {
                Overlap overlap = crossword.getOverlap(variable, neighbor);
                char letter = word.charAt(overlap.first());
                for (String neighborWord : domains.get(neighbor)) {
                    if (neighborWord.charAt(overlap.second()) != letter) {
                        count++;
                    }
                }
            }
            eliminated.put(word, count);
        }

        List<String> ordered = new ArrayList<>(domains.get(variable));
        ordered.sort(Comparator.comparingInt(eliminated::get));
        return ordered;
    }

    /**
     * Sceglie la prossima variabile da assegnare.
     *
     * Criteri in ordine di priorità:
     * 1. MRV: dominio corrente più piccolo
     * 2. Grado: maggior numero di vicini
     * 3. Ordine naturale della variabile (spareggio deterministico)
     *
     * @param assignment assegnamento parziale corrente
     * @return variabile non assegnata scelta
     * @throws IllegalStateException se tutte le variabili sono già assegnate
     */
    public Variable selectUnassignedVariable(Map<Variable, String> assignment) {
        Comparator<Variable> byRemainingValues = Comparator.comparingInt(domains::size);
        Comparator<Variable> byDegree = Comparator.comparingInt((Variable v) -> crossword.neighbors(v).size()).reversed();

        return crossword.getVariables().stream()
                .filter(variable -> !assignment.containsKey(variable))
                .min(byRemainingValues.thenComparing(byDegree).thenComparing(Comparator.naturalOrder()))
                .orElseThrow(() -> new IllegalStateException("Nessuna variabile da assegnare"));
    }

    //endregion

    //region BACKTRACKING

    /**
     * Ricerca con backtracking a partire da un assegnamento parziale.
     *
     * Ad ogni livello viene scelta una sola variabile; per ogni valore in ordine LCV
     * l'assegnamento viene esteso, verificato con {@link #consistent(Map)} e, se
     * consistente, si scende di un livello. Su ogni uscita senza successo la voce
     * tentativa viene rimossa, quindi il chiamante ritrova l'assegnamento invariato.
     *
     * @param assignment assegnamento parziale (modificato sul posto)
     * @return assegnamento completo, oppure null se nessuna estensione è possibile
     * @throws InterruptedException se il thread viene interrotto (timeout esterno)
     */
    public Map<Variable, String> backtrack(Map<Variable, String> assignment) throws InterruptedException {
        checkForInterruption();

        if (assignmentComplete(assignment)) {
            return assignment;
        }

        Variable variable = selectUnassignedVariable(assignment);
        LOGGER.fine(() -> "Livello " + (assignment.size() + 1) + ": scelta variabile " + variable
                + " (dominio " + domains.size(variable) + ")");

        for (String value : orderDomainValues(variable, assignment)) {
            statistics.incrementAssignments();

            boolean solved = false;
            assignment.put(variable, value);
            try {
                if (!consistent(assignment)) {
                    statistics.incrementConsistencyFailures();
                    continue;
                }
                statistics.recordDepth(assignment.size());

                Map<Variable, String> result = useInference
                        ? exploreWithInference(variable, value, assignment)
                        : backtrack(assignment);
                if (result != null) {
                    solved = true;
                    return result;
                }
            } finally {
                if (!solved) {
                    assignment.remove(variable);
                }
            }
        }

        statistics.incrementBacktracks();
        return null;
    }

    /**
     * Restringe il dominio della variabile appena assegnata, propaga con AC-3 verso
     * i vicini non assegnati e prosegue la ricerca. I domini vengono sempre
     * ripristinati prima di tornare al chiamante.
     */
    private Map<Variable, String> exploreWithInference(Variable variable, String value,
                                                       Map<Variable, String> assignment) throws InterruptedException {
        DomainStore saved = domains.snapshot();
        try {
            domains.set(variable, Collections.singleton(value));

            List<Arc> arcs = new ArrayList<>();
            for (Variable neighbor : crossword.neighbors(variable)) {
                if (!assignment.containsKey(neighbor)) {
                    arcs.add(new Arc(neighbor, variable));
                }
            }

            if (!arcConsistency.ac3(arcs)) {
                statistics.incrementInferenceFailures();
                return null;
            }
            return backtrack(assignment);
        } finally {
            domains.restore(saved);
        }
    }

    //endregion

    //region SUPPORTO

    private void checkForInterruption() throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("Solutore interrotto per timeout");
        }
    }

    private void logDomainSizes() {
        if (!LOGGER.isLoggable(Level.FINE)) return;
        for (Variable variable : crossword.getVariables()) {
            LOGGER.fine(variable + " -> " + domains.size(variable) + " parole");
        }
    }

    //endregion
}
