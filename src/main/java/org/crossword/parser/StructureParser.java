package org.crossword.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.crossword.antlr.CrosswordStructureBaseVisitor;
import org.crossword.antlr.CrosswordStructureLexer;
import org.crossword.antlr.CrosswordStructureParser;
import org.crossword.antlr.CrosswordStructureParser.BlockedCellContext;
import org.crossword.antlr.CrosswordStructureParser.CellContext;
import org.crossword.antlr.CrosswordStructureParser.OpenCellContext;
import org.crossword.antlr.CrosswordStructureParser.RowContext;
import org.crossword.antlr.CrosswordStructureParser.StructureContext;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * PARSER DELLA STRUTTURA - Da file di testo a griglia di caselle
 *
 * Visitor sull'albero sintattico della grammatica CrosswordStructure:
 * • '_' diventa una casella da riempire (true)
 * • ogni altro carattere diventa una casella nera (false)
 * • le righe vuote finali vengono ignorate
 *
 * La griglia restituita è rettangolare: le righe corte vengono completate con
 * caselle nere fino alla larghezza della riga più lunga.
 */
public class StructureParser extends CrosswordStructureBaseVisitor<Boolean> {

    private static final Logger LOGGER = Logger.getLogger(StructureParser.class.getName());

    /**
     * Legge e analizza un file di struttura.
     *
     * @param path percorso del file
     * @return griglia righe × colonne, true = casella da riempire
     * @throws IOException se il file non è leggibile
     */
    public boolean[][] parseFile(Path path) throws IOException {
        LOGGER.info("Lettura struttura da " + path);
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * Analizza il testo di una struttura con la pipeline ANTLR.
     *
     * @param text contenuto del file di struttura
     * @return griglia righe × colonne, true = casella da riempire
     * @throws IllegalArgumentException per errori di sintassi
     */
    public boolean[][] parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Il testo della struttura non può essere null");
        }

        CharStream input = CharStreams.fromString(text);
        CrosswordStructureLexer lexer = new CrosswordStructureLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(FailingErrorListener.INSTANCE);

        CrosswordStructureParser parser = new CrosswordStructureParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(FailingErrorListener.INSTANCE);

        return buildGrid(parser.structure());
    }

    private boolean[][] buildGrid(StructureContext ctx) {
        List<List<Boolean>> rows = new ArrayList<>();
        for (RowContext row : ctx.row()) {
            List<Boolean> cells = new ArrayList<>();
            for (CellContext cell : row.cell()) {
                cells.add(visit(cell));
            }
            rows.add(cells);
        }

        // Righe vuote finali (newline in coda al file)
        while (!rows.isEmpty() && rows.get(rows.size() - 1).isEmpty()) {
            rows.remove(rows.size() - 1);
        }

        int width = rows.stream().mapToInt(List::size).max().orElse(0);
        boolean[][] grid = new boolean[rows.size()][width];
        for (int i = 0; i < rows.size(); i++) {
            List<Boolean> cells = rows.get(i);
            for (int j = 0; j < cells.size(); j++) {
                grid[i][j] = cells.get(j);
            }
        }

        LOGGER.fine(String.format("Struttura analizzata: %d righe, %d colonne", grid.length, width));
        return grid;
    }

    @Override
    public Boolean visitOpenCell(OpenCellContext ctx) {
        return Boolean.TRUE;
    }

    @Override
    public Boolean visitBlockedCell(BlockedCellContext ctx) {
        return Boolean.FALSE;
    }

    /**
     * Trasforma gli errori di lexer e parser in eccezioni invece di stamparli su stderr.
     */
    private static final class FailingErrorListener extends BaseErrorListener {

        static final FailingErrorListener INSTANCE = new FailingErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            throw new IllegalArgumentException(
                    "Struttura non valida alla riga " + line + ", colonna " + charPositionInLine + ": " + msg, e);
        }
    }
}
