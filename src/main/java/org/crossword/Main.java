package org.crossword;

import org.crossword.csp.CSPResult;
import org.crossword.csp.CrosswordCreator;
import org.crossword.parser.StructureParser;
import org.crossword.parser.WordListLoader;
import org.crossword.render.CrosswordRenderer;
import org.crossword.support.Crossword;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;
import java.util.concurrent.*;

/**
 * GENERATORE DI CRUCIVERBA (CSP)
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: file di struttura della griglia e file del vocabolario
 * 2. PARSING: struttura analizzata con ANTLR, vocabolario normalizzato in maiuscolo
 * 3. MODELLO: derivazione delle variabili e della tabella delle sovrapposizioni
 * 4. RISOLUZIONE: consistenza di nodo, AC-3 e backtracking con euristiche MRV/grado e LCV
 * 5. OUTPUT: griglia a console, immagine PNG facoltativa, risultato e statistiche su file
 *
 * OPZIONI FACOLTATIVE:
 * - Inferenza (-opt=m): mantenimento della consistenza d'arco durante la ricerca
 *
 * ORGANIZZAZIONE DEGLI OUTPUT (se si specifica -o):
 * - RESULT/: assegnamento trovato oppure esito UNSAT/timeout
 * - STATS/: statistiche di propagazione e ricerca
 */
public final class Main {
    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String STRUCTURE_PARAM = "-s";
    private static final String WORDS_PARAM = "-w";
    private static final String IMAGE_PARAM = "-i";
    private static final String OUTPUT_PARAM = "-o";
    private static final String TIMEOUT_PARAM = "-t";
    private static final String OPT_PARAM = "-opt=";

    /**
     * Flag opzioni disponibili
     * */
    private static final String OPT_INFERENCE = "m";
    private static final String OPT_ALL = "all";

    /**
     * Configurazioni timeout di default e limiti
     * */
    private static final int DEFAULT_TIMEOUT_SECONDS = 10;
    private static final int MIN_TIMEOUT_SECONDS = 1;

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale del generatore di cruciverba.
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        System.out.println("---> AVVIO GENERATORE CRUCIVERBA <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            SolverConfiguration config = parseAndValidateArguments(args);
            if (config == null) return; // Help mostrato o errore

            displayConfigurationSummary(config);
            processPuzzle(config);

        } catch (Exception e) {
            handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE GENERATORE CRUCIVERBA <---");
        }
    }

    private static void handleGlobalError(Exception e) {
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.out.println("Controllare i log per dettagli completi.");
        System.exit(1);
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    /**
     * @param args array di parametri da processare
     * @return configurazione validata o null se help/errore
     */
    static SolverConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    private static void displayConfigurationSummary(SolverConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE GENERATORE <<--");
        System.out.println("Struttura: " + config.structurePath);
        System.out.println("Vocabolario: " + config.wordsPath);
        System.out.println("Timeout: " + config.timeoutSeconds + " secondi");
        System.out.println("Inferenza: " + (config.useInference ? "Attiva" : "Disattiva"));
        System.out.println("Immagine: " + (config.imagePath != null ? config.imagePath : "Nessuna"));
        System.out.println("Output: " + (config.outputPath != null ? config.outputPath : "Solo console"));
        System.out.println("====================================\n");
    }

    //endregion

    //region ELABORAZIONE DEL CRUCIVERBA

    /**
     * Esegue l'intera pipeline su una coppia struttura/vocabolario.
     *
     * @param config configurazione validata
     * @throws IOException se errori di lettura o scrittura dei file
     */
    static void processPuzzle(SolverConfiguration config) throws IOException {
        // FASE 1: caricamento della geometria e del vocabolario
        Crossword crossword = loadCrossword(config);

        // FASE 2: risoluzione con timeout
        CSPResult result = executeSolvingWithTimeout(crossword, config);

        // FASE 3: presentazione e salvataggio
        if (result == null) {
            handleTimeoutResult(config);
        } else {
            handleCompletedResult(result, crossword, config);
        }
    }

    private static Crossword loadCrossword(SolverConfiguration config) throws IOException {
        System.out.println("Lettura struttura e vocabolario...");

        boolean[][] structure = new StructureParser().parseFile(Path.of(config.structurePath));
        SortedSet<String> words = WordListLoader.load(Path.of(config.wordsPath));
        Crossword crossword = new Crossword(structure, words);

        if (crossword.getVariables().isEmpty()) {
            throw new IllegalArgumentException("La struttura non contiene spazi di lunghezza maggiore di uno");
        }

        System.out.printf("[I] Griglia %dx%d, %d variabili, %d parole%n",
                crossword.getHeight(), crossword.getWidth(), crossword.getVariables().size(), words.size());
        return crossword;
    }

    /**
     * Esegue la risoluzione con controllo temporale: allo scadere il worker viene
     * interrotto e la ricerca si ferma al livello di ricorsione successivo.
     *
     * @return risultato CSP o null se timeout
     */
    private static CSPResult executeSolvingWithTimeout(Crossword crossword, SolverConfiguration config) {
        System.out.println("Risoluzione CSP (timeout: " + config.timeoutSeconds + "s)...");

        ExecutorService executor = Executors.newSingleThreadExecutor();
        CrosswordCreator creator = new CrosswordCreator(crossword, config.useInference);

        try {
            Callable<CSPResult> solverTask = creator::solve;
            Future<CSPResult> future = executor.submit(solverTask);
            return future.get(config.timeoutSeconds, TimeUnit.SECONDS);

        } catch (TimeoutException e) {
            System.out.println("[W] Timeout raggiunto dopo " + config.timeoutSeconds + " secondi");
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Attesa del risultato interrotta", e);
        } catch (ExecutionException e) {
            System.out.println("[E] Errore durante risoluzione CSP: " + e.getCause());
            throw new IllegalStateException("Errore nella risoluzione CSP", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    //endregion

    //region GESTIONE DELL'OUTPUT E SALVATAGGIO DEI FILE

    private static void handleCompletedResult(CSPResult result, Crossword crossword,
                                              SolverConfiguration config) throws IOException {
        System.out.println();
        if (result.isUnsatisfiable()) {
            System.out.println("Nessuna soluzione.");
        } else {
            CrosswordRenderer renderer = new CrosswordRenderer(crossword);
            renderer.print(result.getAssignment());

            if (config.imagePath != null) {
                renderer.save(result.getAssignment(), Path.of(config.imagePath));
                System.out.println("[I] Immagine salvata: " + config.imagePath);
            }
        }

        System.out.println("\n" + result.getExecutionSummary());

        if (config.outputPath != null) {
            StringBuilder content = new StringBuilder(result.toString());
            if (result.isSatisfiable()) {
                content.append("\n").append(new CrosswordRenderer(crossword).render(result.getAssignment()));
            }
            saveToOutputFile(content.toString(), config, "RESULT", ".result");
            saveToOutputFile(result.getStatistics().toString(), config, "STATS", ".stats");
        }
    }

    private static void handleTimeoutResult(SolverConfiguration config) throws IOException {
        System.out.println("[W] Superato il timeout con limite di " + config.timeoutSeconds + " secondi");

        if (config.outputPath != null) {
            String report = "TIMEOUT\n" +
                    "Struttura: " + config.structurePath + "\n" +
                    "Vocabolario: " + config.wordsPath + "\n" +
                    "Timeout: " + config.timeoutSeconds + " secondi\n\n" +
                    "Aumentare il timeout (-t) o abilitare l'inferenza (-opt=m) per griglie complesse.\n";
            saveToOutputFile(report, config, "RESULT", ".result");
        }
    }

    /**
     * Salva un contenuto testuale in outputPath/dirName/nome_struttura + extension.
     */
    private static void saveToOutputFile(String content, SolverConfiguration config,
                                         String dirName, String extension) throws IOException {
        Path outputDir = Paths.get(config.outputPath, dirName);
        Files.createDirectories(outputDir);

        Path outputFile = outputDir.resolve(getBaseFileName(config.structurePath) + extension);
        Files.writeString(outputFile, content, StandardCharsets.UTF_8);

        System.out.println("[I] File " + dirName + " salvato: " + outputFile);
    }

    private static String getBaseFileName(String filePath) {
        String fileName = Paths.get(filePath).getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("\n=== GENERATORE DI CRUCIVERBA ===");
        System.out.println("Riempimento di griglie di cruciverba come problema di soddisfacimento di vincoli");
        System.out.println("con consistenza di nodo, AC-3 e backtracking euristico\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar generatore-cruciverba.jar -s <struttura> -w <vocabolario> [opzioni]\n");

        System.out.println("PARAMETRI OBBLIGATORI:");
        System.out.println("  -s <file>        File di struttura ('_' = casella da riempire, altro = casella nera)");
        System.out.println("  -w <file>        Vocabolario, una parola per riga\n");

        System.out.println("OPZIONI:");
        System.out.println("  -i <file.png>    Salva la soluzione come immagine PNG");
        System.out.println("  -o <directory>   Salva risultato (RESULT/) e statistiche (STATS/)");
        System.out.println("  -t <secondi>     Timeout della risoluzione (min: " + MIN_TIMEOUT_SECONDS
                + ", default: " + DEFAULT_TIMEOUT_SECONDS + ")");
        System.out.println("  -opt=<flag>      Opzioni facoltative (m=inferenza durante la ricerca, all=tutte)");
        System.out.println("  -h               Mostra questo help\n");

        System.out.println("ESEMPI:");
        System.out.println("  -s data/structure0.txt -w data/words0.txt");
        System.out.println("  -s data/structure1.txt -w data/words1.txt -i output.png -opt=m -t 30");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata e immutabile dell'applicazione.
     */
    static final class SolverConfiguration {
        final String structurePath;
        final String wordsPath;
        final String imagePath;
        final String outputPath;
        final int timeoutSeconds;
        final boolean useInference;

        SolverConfiguration(String structurePath, String wordsPath, String imagePath, String outputPath,
                            int timeoutSeconds, boolean useInference) {
            this.structurePath = structurePath;
            this.wordsPath = wordsPath;
            this.imagePath = imagePath;
            this.outputPath = outputPath;
            this.timeoutSeconds = timeoutSeconds;
            this.useInference = useInference;
        }
    }

    /**
     * Parser dei parametri della linea di comando con messaggi di errore informativi.
     */
    static final class ArgumentParser {

        /**
         * @param args parametri da linea di comando
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri non sono validi
         */
        SolverConfiguration parse(String[] args) {
            String structurePath = null;
            String wordsPath = null;
            String imagePath = null;
            String outputPath = null;
            int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
            boolean useInference = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case STRUCTURE_PARAM -> {
                        structurePath = getNextArgument(args, ++i, "file di struttura");
                        validateFileExists(structurePath);
                    }
                    case WORDS_PARAM -> {
                        wordsPath = getNextArgument(args, ++i, "file del vocabolario");
                        validateFileExists(wordsPath);
                    }
                    case IMAGE_PARAM -> {
                        imagePath = getNextArgument(args, ++i, "file immagine");
                        if (!imagePath.toLowerCase(Locale.ROOT).endsWith(".png")) {
                            throw new IllegalArgumentException("L'immagine deve avere estensione .png: " + imagePath);
                        }
                    }
                    case OUTPUT_PARAM -> {
                        outputPath = getNextArgument(args, ++i, "directory output");
                        validateOrCreateOutputDirectory(outputPath);
                    }
                    case TIMEOUT_PARAM -> timeoutSeconds = parseAndValidateTimeout(args, ++i);
                    default -> {
                        if (args[i].startsWith(OPT_PARAM)) {
                            useInference = parseOptionalFlags(args[i].substring(OPT_PARAM.length()));
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (structurePath == null) {
                throw new IllegalArgumentException("Specificare il file di struttura con -s");
            }
            if (wordsPath == null) {
                throw new IllegalArgumentException("Specificare il vocabolario con -w");
            }

            return new SolverConfiguration(structurePath, wordsPath, imagePath, outputPath,
                    timeoutSeconds, useInference);
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] +
                        " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private int parseAndValidateTimeout(String[] args, int currentIndex) {
            String timeoutStr = getNextArgument(args, currentIndex, "numero secondi");

            try {
                int timeout = Integer.parseInt(timeoutStr);
                if (timeout < MIN_TIMEOUT_SECONDS) {
                    throw new IllegalArgumentException("Timeout minimo: " + MIN_TIMEOUT_SECONDS + " secondi");
                }
                return timeout;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore timeout non valido: " + timeoutStr);
            }
        }

        /**
         * @return true se l'inferenza è richiesta
         */
        private boolean parseOptionalFlags(String flagsStr) {
            if (flagsStr == null || flagsStr.trim().isEmpty()) {
                throw new IllegalArgumentException("Valore -opt vuoto");
            }
            if (flagsStr.equals(OPT_ALL) || flagsStr.equals(OPT_INFERENCE)) {
                return true;
            }
            throw new IllegalArgumentException("Opzione non supportata: " + flagsStr);
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.exists()) {
                throw new IllegalArgumentException("File non esistente: " + filePath);
            }
            if (!file.isFile()) {
                throw new IllegalArgumentException("Non è un file: " + filePath);
            }
            if (!file.canRead()) {
                throw new IllegalArgumentException("File non leggibile: " + filePath);
            }
        }

        private void validateOrCreateOutputDirectory(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.exists()) {
                System.out.println("Creazione directory output: " + dirPath);
                if (!dir.mkdirs()) {
                    throw new IllegalArgumentException("Impossibile creare directory: " + dirPath);
                }
            } else if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Percorso non è una directory: " + dirPath);
            }
            if (!dir.canWrite()) {
                throw new IllegalArgumentException("Directory non scrivibile: " + dirPath);
            }
        }
    }

    //endregion
}
