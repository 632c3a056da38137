package org.crossword.support;

import java.util.*;
import java.util.logging.Logger;

/**
 * DOMAIN STORE - Domini correnti delle variabili del cruciverba
 *
 * Associa a ogni variabile l'insieme delle parole ancora candidate. I domini sono
 * mantenuti in ordine alfabetico per rendere deterministici ordinamenti e spareggi.
 *
 * OPERAZIONI SUPPORTATE:
 * • Inizializzazione di tutti i domini con lo stesso vocabolario
 * • Rimozione atomica di un insieme di parole (mai durante l'iterazione del dominio)
 * • Sostituzione del dominio di una variabile
 * • Snapshot e ripristino per le diramazioni speculative della ricerca
 *
 * Un dominio vuoto segnala l'insoddisfacibilità lungo il ramo corrente.
 */
public class DomainStore {

    private static final Logger LOGGER = Logger.getLogger(DomainStore.class.getName());

    /** Variabile -> parole candidate (ordine alfabetico) */
    private final Map<Variable, NavigableSet<String>> domains;

    //region COSTRUZIONE

    /**
     * Inizializza ogni variabile con una copia indipendente del vocabolario.
     *
     * @param variables variabili del problema
     * @param words vocabolario iniziale
     */
    public DomainStore(Collection<Variable> variables, Collection<String> words) {
        this.domains = new LinkedHashMap<>();
        for (Variable variable : variables) {
            domains.put(variable, new TreeSet<>(words));
        }
        LOGGER.fine("Domini inizializzati per " + domains.size() + " variabili");
    }

    private DomainStore(Map<Variable, NavigableSet<String>> source) {
        this.domains = new LinkedHashMap<>();
        source.forEach((variable, words) -> domains.put(variable, new TreeSet<>(words)));
    }

    //endregion

    //region INTERROGAZIONE

    /**
     * @param variable variabile del problema
     * @return vista non modificabile del dominio corrente
     * @throws IllegalArgumentException se la variabile non appartiene al problema
     */
    public SortedSet<String> get(Variable variable) {
        return Collections.unmodifiableSortedSet(requireDomain(variable));
    }

    /**
     * @return dimensione corrente del dominio della variabile
     */
    public int size(Variable variable) {
        return requireDomain(variable).size();
    }

    /**
     * @return true se il dominio della variabile è vuoto
     */
    public boolean isEmpty(Variable variable) {
        return requireDomain(variable).isEmpty();
    }

    /**
     * @return true se almeno un dominio è vuoto
     */
    public boolean hasEmptyDomain() {
        return domains.values().stream().anyMatch(Set::isEmpty);
    }

    /**
     * @return variabili gestite, nell'ordine di inserimento
     */
    public Set<Variable> variables() {
        return Collections.unmodifiableSet(domains.keySet());
    }

    //endregion

    //region MODIFICA

    /**
     * Rimuove dal dominio tutte le parole indicate.
     *
     * @param variable variabile da restringere
     * @param removals parole da eliminare, raccolte prima della modifica
     * @return numero di parole effettivamente rimosse
     */
    public int removeAll(Variable variable, Collection<String> removals) {
        NavigableSet<String> domain = requireDomain(variable);
        int before = domain.size();
        domain.removeAll(removals);
        return before - domain.size();
    }

    /**
     * Sostituisce il dominio di una variabile.
     *
     * @param variable variabile da aggiornare
     * @param words nuovo insieme di parole candidate
     */
    public void set(Variable variable, Collection<String> words) {
        requireDomain(variable);
        domains.put(variable, new TreeSet<>(words));
    }

    //endregion

    //region SNAPSHOT E RIPRISTINO

    /**
     * Copia profonda dello stato corrente, indipendente da modifiche successive.
     *
     * @return snapshot dei domini
     */
    public DomainStore snapshot() {
        return new DomainStore(domains);
    }

    /**
     * Ripristina i domini dallo snapshot indicato.
     *
     * @param snapshot stato salvato in precedenza con {@link #snapshot()}
     */
    public void restore(DomainStore snapshot) {
        domains.clear();
        snapshot.domains.forEach((variable, words) -> domains.put(variable, new TreeSet<>(words)));
    }

    //endregion

    private NavigableSet<String> requireDomain(Variable variable) {
        NavigableSet<String> domain = domains.get(variable);
        if (domain == null) {
            throw new IllegalArgumentException("Variabile sconosciuta: " + variable);
        }
        return domain;
    }
}
