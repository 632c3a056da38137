package org.crossword.parser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Locale;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Caricamento del vocabolario: una parola per riga, convertita in maiuscolo.
 *
 * Righe vuote ignorate, spazi ai bordi rimossi, duplicati eliminati.
 */
public final class WordListLoader {

    private static final Logger LOGGER = Logger.getLogger(WordListLoader.class.getName());

    private WordListLoader() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param path file del vocabolario
     * @return parole normalizzate in ordine alfabetico
     * @throws IOException se il file non è leggibile
     */
    public static SortedSet<String> load(Path path) throws IOException {
        SortedSet<String> words = normalize(Files.readAllLines(path, StandardCharsets.UTF_8));
        LOGGER.info("Vocabolario caricato da " + path + ": " + words.size() + " parole");
        return words;
    }

    /**
     * @param lines righe grezze
     * @return parole normalizzate in ordine alfabetico
     */
    public static SortedSet<String> normalize(Collection<String> lines) {
        SortedSet<String> words = new TreeSet<>();
        for (String line : lines) {
            String word = line.trim().toUpperCase(Locale.ROOT);
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words;
    }
}
