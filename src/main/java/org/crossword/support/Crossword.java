package org.crossword.support;

import java.util.*;
import java.util.logging.Logger;

/**
 * CRUCIVERBA - Geometria della griglia, vocabolario e grafo dei vincoli
 *
 * Deriva dalla griglia di caselle (bianche/nere) l'insieme delle variabili e la tabella
 * delle sovrapposizioni che il solutore CSP consuma in sola lettura.
 *
 * DERIVAZIONE DELLE VARIABILI:
 * • DOWN: parte da ogni casella bianca la cui casella superiore è nera o fuori griglia
 * • ACROSS: parte da ogni casella bianca la cui casella sinistra è nera o fuori griglia
 * • Lo spazio prosegue finché le caselle sono bianche; solo spazi di lunghezza > 1
 *
 * TABELLA SOVRAPPOSIZIONI:
 * • Per ogni coppia ordinata di variabili distinte: (i, j) oppure nessuna sovrapposizione
 * • Simmetrica: overlap(y, x) è overlap(x, y) con indici scambiati
 * • Una variabile non si sovrappone mai con se stessa
 *
 * INVARIANTI MANTENUTE:
 * • Tutte le strutture sono immutabili dopo la costruzione
 * • Variabili esposte in ordine naturale deterministico
 */
public class Crossword {

    private static final Logger LOGGER = Logger.getLogger(Crossword.class.getName());

    //region STRUTTURE DATI

    /** Numero di righe della griglia */
    private final int height;

    /** Numero di colonne della griglia */
    private final int width;

    /** structure[i][j] = true se la casella è da riempire */
    private final boolean[][] structure;

    /** Vocabolario iniziale, usato come seme per tutti i domini */
    private final Set<String> words;

    /** Variabili derivate dalla griglia, in ordine naturale */
    private final Set<Variable> variables;

    /** Tabella delle sovrapposizioni: x -> (y -> overlap); coppie senza sovrapposizione assenti */
    private final Map<Variable, Map<Variable, Overlap>> overlaps;

    /** Vicini di ogni variabile nel grafo dei vincoli */
    private final Map<Variable, Set<Variable>> neighbors;

    //endregion

    //region COSTRUZIONE

    /**
     * Costruisce il cruciverba a partire dalla griglia e dal vocabolario.
     *
     * Le righe più corte della riga più lunga vengono completate con caselle nere.
     *
     * @param structure griglia righe × colonne, true = casella da riempire
     * @param words vocabolario di parole candidate
     * @throws IllegalArgumentException se griglia o vocabolario sono null
     */
    public Crossword(boolean[][] structure, Collection<String> words) {
        if (structure == null) {
            throw new IllegalArgumentException("La struttura della griglia non può essere null");
        }
        if (words == null) {
            throw new IllegalArgumentException("Il vocabolario non può essere null");
        }

        this.height = structure.length;
        this.width = Arrays.stream(structure).mapToInt(row -> row == null ? 0 : row.length).max().orElse(0);
        this.structure = normalizeStructure(structure);
        this.words = Collections.unmodifiableSet(new TreeSet<>(words));
        this.variables = Collections.unmodifiableSet(deriveVariables());
        this.overlaps = computeOverlaps();
        this.neighbors = computeNeighbors();

        LOGGER.info(String.format("Cruciverba %dx%d: %d variabili, %d parole nel vocabolario",
                height, width, variables.size(), this.words.size()));
    }

    /**
     * Copia la griglia completando le righe corte con caselle nere.
     */
    private boolean[][] normalizeStructure(boolean[][] source) {
        boolean[][] grid = new boolean[height][width];
        for (int i = 0; i < height; i++) {
            if (source[i] != null) {
                System.arraycopy(source[i], 0, grid[i], 0, source[i].length);
            }
        }
        return grid;
    }

    /**
     * Individua tutti gli spazi orizzontali e verticali di lunghezza maggiore di uno.
     */
    private Set<Variable> deriveVariables() {
        Set<Variable> result = new TreeSet<>();

        for (int i = 0; i < height; i++) {
            for (int j = 0; j < width; j++) {
                if (!structure[i][j]) continue;

                // Inizio di uno spazio verticale
                if (i == 0 || !structure[i - 1][j]) {
                    int length = 1;
                    while (i + length < height && structure[i + length][j]) {
                        length++;
                    }
                    if (length > 1) {
                        result.add(new Variable(i, j, Direction.DOWN, length));
                    }
                }

                // Inizio di uno spazio orizzontale
                if (j == 0 || !structure[i][j - 1]) {
                    int length = 1;
                    while (j + length < width && structure[i][j + length]) {
                        length++;
                    }
                    if (length > 1) {
                        result.add(new Variable(i, j, Direction.ACROSS, length));
                    }
                }
            }
        }

        LOGGER.fine("Variabili derivate: " + result);
        return result;
    }

    /**
     * Calcola la sovrapposizione per ogni coppia di variabili distinte: la coppia (x, y)
     * viene esaminata una sola volta e (y, x) riceve la stessa casella con indici scambiati.
     */
    private Map<Variable, Map<Variable, Overlap>> computeOverlaps() {
        Map<Variable, Map<Variable, Overlap>> rows = new HashMap<>();
        for (Variable variable : variables) {
            rows.put(variable, new HashMap<>());
        }

        List<Variable> ordered = new ArrayList<>(variables);
        for (int a = 0; a < ordered.size(); a++) {
            Variable x = ordered.get(a);
            List<Cell> cellsX = x.getCells();

            for (int b = a + 1; b < ordered.size(); b++) {
                Variable y = ordered.get(b);
                List<Cell> cellsY = y.getCells();

                for (int i = 0; i < cellsX.size(); i++) {
                    int j = cellsY.indexOf(cellsX.get(i));
                    if (j >= 0) {
                        Overlap overlap = new Overlap(i, j);
                        rows.get(x).put(y, overlap);
                        rows.get(y).put(x, overlap.reversed());
                        break;
                    }
                }
            }
        }

        Map<Variable, Map<Variable, Overlap>> table = new HashMap<>();
        for (Map.Entry<Variable, Map<Variable, Overlap>> entry : rows.entrySet()) {
            table.put(entry.getKey(), Collections.unmodifiableMap(entry.getValue()));
        }
        return Collections.unmodifiableMap(table);
    }

    private Map<Variable, Set<Variable>> computeNeighbors() {
        Map<Variable, Set<Variable>> result = new HashMap<>();
        for (Variable variable : variables) {
            result.put(variable, Collections.unmodifiableSet(new TreeSet<>(overlaps.get(variable).keySet())));
        }
        return Collections.unmodifiableMap(result);
    }

    //endregion

    //region INTERFACCIA PUBBLICA

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    /**
     * @param row riga della casella
     * @param col colonna della casella
     * @return true se la casella esiste ed è da riempire
     */
    public boolean isFillable(int row, int col) {
        return row >= 0 && row < height && col >= 0 && col < width && structure[row][col];
    }

    /**
     * @return vocabolario in ordine alfabetico (insieme immutabile)
     */
    public Set<String> getWords() {
        return words;
    }

    /**
     * @return variabili in ordine naturale (insieme immutabile)
     */
    public Set<Variable> getVariables() {
        return variables;
    }

    /**
     * Restituisce la sovrapposizione tra due variabili.
     *
     * @param x prima variabile
     * @param y seconda variabile
     * @return (indice in x, indice in y) oppure null se le variabili non condividono caselle
     */
    public Overlap getOverlap(Variable x, Variable y) {
        Map<Variable, Overlap> row = overlaps.get(x);
        return row != null ? row.get(y) : null;
    }

    /**
     * Restituisce tutte le variabili che condividono una casella con quella data.
     *
     * @param variable variabile di riferimento
     * @return vicini in ordine naturale (insieme vuoto per variabili sconosciute)
     */
    public Set<Variable> neighbors(Variable variable) {
        return neighbors.getOrDefault(variable, Collections.emptySet());
    }

    //endregion
}
