package org.crossword.csp;

/**
 * STATISTICHE CSP - Raccolta delle metriche di propagazione e ricerca
 *
 * Tiene traccia del lavoro svolto dalle tre fasi del solutore (consistenza di nodo,
 * AC-3, backtracking) e del tempo di esecuzione, per il report finale.
 */
public class CSPStatistics {

    //region CONTATORI PROPAGAZIONE

    /** Parole rimosse dalla consistenza di nodo (lunghezza errata) */
    private int nodeConsistencyRemovals = 0;

    /** Chiamate a revise(x, y) */
    private int revisions = 0;

    /** Parole rimosse dalle revisioni di arco */
    private int arcRemovals = 0;

    //endregion

    //region CONTATORI RICERCA

    /** Assegnamenti tentati durante il backtracking */
    private int assignments = 0;

    /** Assegnamenti scartati perché inconsistenti con quelli già presenti */
    private int consistencyFailures = 0;

    /** Livelli esauriti senza soluzione (ritorni al chiamante) */
    private int backtracks = 0;

    /** Rami potati dall'inferenza opzionale durante la ricerca */
    private int inferenceFailures = 0;

    /** Profondità massima raggiunta dall'assegnamento parziale */
    private int maxDepth = 0;

    //endregion

    //region TIMING

    private long startTime = 0;
    private long executionTimeMs = 0;
    private boolean timerStarted = false;
    private boolean timerStopped = false;

    //endregion

    //region INCREMENTI

    public synchronized void addNodeConsistencyRemovals(int count) {
        nodeConsistencyRemovals += count;
    }

    public synchronized void incrementRevisions() {
        revisions++;
    }

    public synchronized void addArcRemovals(int count) {
        arcRemovals += count;
    }

    public synchronized void incrementAssignments() {
        assignments++;
    }

    public synchronized void incrementConsistencyFailures() {
        consistencyFailures++;
    }

    public synchronized void incrementBacktracks() {
        backtracks++;
    }

    public synchronized void incrementInferenceFailures() {
        inferenceFailures++;
    }

    /**
     * Aggiorna la profondità massima se quella corrente è superiore.
     */
    public synchronized void recordDepth(int depth) {
        if (depth > maxDepth) {
            maxDepth = depth;
        }
    }

    //endregion

    //region TIMING

    /**
     * Avvia il cronometro. Chiamate multiple non hanno effetto.
     */
    public void startTimer() {
        if (!timerStarted) {
            startTime = System.currentTimeMillis();
            timerStarted = true;
        }
    }

    /**
     * Ferma il cronometro. Senza un avvio precedente il tempo registrato resta zero.
     */
    public void stopTimer() {
        if (!timerStarted) {
            timerStopped = true;
            return;
        }
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    /**
     * @return tempo finale, o parziale se il cronometro è ancora attivo
     */
    public long getExecutionTimeMs() {
        if (!timerStarted) {
            return 0;
        }
        if (!timerStopped) {
            return System.currentTimeMillis() - startTime;
        }
        return executionTimeMs;
    }

    public boolean isTimerStarted() {
        return timerStarted;
    }

    public boolean isTimerStopped() {
        return timerStopped;
    }

    //endregion

    //region ACCESSORS

    public int getNodeConsistencyRemovals() {
        return nodeConsistencyRemovals;
    }

    public int getRevisions() {
        return revisions;
    }

    public int getArcRemovals() {
        return arcRemovals;
    }

    public int getAssignments() {
        return assignments;
    }

    public int getConsistencyFailures() {
        return consistencyFailures;
    }

    public int getBacktracks() {
        return backtracks;
    }

    public int getInferenceFailures() {
        return inferenceFailures;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    //endregion

    /**
     * Report testuale completo, usato per il file .stats e per la console.
     */
    @Override
    public String toString() {
        StringBuilder report = new StringBuilder();
        report.append("=== STATISTICHE RISOLUZIONE CSP ===\n");
        report.append("Tempo di esecuzione: ").append(getExecutionTimeMs()).append(" ms\n");
        report.append("\n-- Propagazione --\n");
        report.append("Rimozioni consistenza di nodo: ").append(nodeConsistencyRemovals).append("\n");
        report.append("Revisioni di arco: ").append(revisions).append("\n");
        report.append("Rimozioni AC-3: ").append(arcRemovals).append("\n");
        report.append("\n-- Ricerca --\n");
        report.append("Assegnamenti tentati: ").append(assignments).append("\n");
        report.append("Assegnamenti inconsistenti: ").append(consistencyFailures).append("\n");
        report.append("Backtrack: ").append(backtracks).append("\n");
        report.append("Rami potati dall'inferenza: ").append(inferenceFailures).append("\n");
        report.append("Profondità massima: ").append(maxDepth).append("\n");
        return report.toString();
    }
}
