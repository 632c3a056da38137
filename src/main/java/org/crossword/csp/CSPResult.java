package org.crossword.csp;

import org.crossword.support.Variable;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * RISULTATO CSP - Contenitore immutabile per l'esito della risoluzione del cruciverba
 *
 * Due soli esiti possibili:
 * • SAT: assegnamento completo e consistente variabile -> parola
 * • UNSAT: nessuna soluzione, con la fase che l'ha dimostrato
 *
 * Non esistono risultati parziali: un assegnamento incompleto non viene mai
 * restituito come soluzione.
 */
public class CSPResult {

    //region ATTRIBUTI CORE

    /** true = soluzione trovata */
    private final boolean satisfiable;

    /** Assegnamento completo per SAT, null per UNSAT */
    private final Map<Variable, String> assignment;

    /** Motivazione dell'insoddisfacibilità per UNSAT, null per SAT */
    private final String reason;

    /** Metriche di esecuzione, sempre presenti */
    private final CSPStatistics statistics;

    //endregion

    //region COSTRUZIONE

    private CSPResult(boolean satisfiable, Map<Variable, String> assignment, String reason, CSPStatistics statistics) {
        if (satisfiable && assignment == null) {
            throw new IllegalArgumentException("Risultato SAT richiede un assegnamento");
        }
        if (!satisfiable && assignment != null) {
            throw new IllegalArgumentException("Risultato UNSAT non può avere assegnamento");
        }

        this.satisfiable = satisfiable;
        this.assignment = assignment != null ? Collections.unmodifiableMap(new TreeMap<>(assignment)) : null;
        this.reason = reason;
        this.statistics = statistics != null ? statistics : new CSPStatistics();
    }

    /**
     * Crea un risultato soddisfacibile con copia difensiva dell'assegnamento.
     *
     * @param assignment assegnamento completo variabile -> parola
     * @param statistics metriche di esecuzione
     * @return risultato SAT
     */
    public static CSPResult satisfiable(Map<Variable, String> assignment, CSPStatistics statistics) {
        if (assignment == null) {
            throw new IllegalArgumentException("Assegnamento SAT non può essere null");
        }
        return new CSPResult(true, assignment, null, statistics);
    }

    /**
     * Crea un risultato insoddisfacibile.
     *
     * @param reason fase o motivo che ha dimostrato l'assenza di soluzioni
     * @param statistics metriche di esecuzione
     * @return risultato UNSAT
     */
    public static CSPResult unsatisfiable(String reason, CSPStatistics statistics) {
        return new CSPResult(false, null, reason, statistics);
    }

    //endregion

    //region ACCESSORS

    public boolean isSatisfiable() {
        return satisfiable;
    }

    public boolean isUnsatisfiable() {
        return !satisfiable;
    }

    /**
     * @return assegnamento in ordine naturale delle variabili, null per UNSAT
     */
    public Map<Variable, String> getAssignment() {
        return assignment;
    }

    /**
     * @return motivazione per UNSAT, null per SAT
     */
    public String getReason() {
        return reason;
    }

    public CSPStatistics getStatistics() {
        return statistics;
    }

    //endregion

    //region OUTPUT

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        if (satisfiable) {
            output.append("SAT\n");
            output.append("Assegnamento:\n");
            assignment.forEach((variable, word) ->
                    output.append(variable).append(" → ").append(word).append("\n"));
        } else {
            output.append("UNSAT\n");
            output.append("Nessuna soluzione");
            if (reason != null) {
                output.append(": ").append(reason);
            }
            output.append("\n");
        }
        return output.toString();
    }

    /**
     * Riepilogo su una riga per la console.
     */
    public String getExecutionSummary() {
        return String.format("Esito: %s | Assegnamenti: %d | Backtrack: %d | Revisioni: %d | Tempo: %dms",
                satisfiable ? "SAT" : "UNSAT",
                statistics.getAssignments(),
                statistics.getBacktracks(),
                statistics.getRevisions(),
                statistics.getExecutionTimeMs());
    }

    //endregion

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        CSPResult other = (CSPResult) obj;
        return satisfiable == other.satisfiable &&
                Objects.equals(assignment, other.assignment) &&
                Objects.equals(reason, other.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(satisfiable, assignment, reason);
    }
}
