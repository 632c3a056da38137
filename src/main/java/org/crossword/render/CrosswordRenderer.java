package org.crossword.render;

import org.crossword.support.Crossword;
import org.crossword.support.Direction;
import org.crossword.support.Variable;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Presentazione di un assegnamento: griglia di lettere, testo per la console e immagine PNG.
 */
public class CrosswordRenderer {

    private static final Logger LOGGER = Logger.getLogger(CrosswordRenderer.class.getName());

    /** Carattere per le caselle nere nell'output testuale */
    private static final char BLOCK = '█';

    private static final int CELL_SIZE = 100;
    private static final int CELL_BORDER = 2;
    private static final int FONT_SIZE = 80;

    private final Crossword crossword;

    public CrosswordRenderer(Crossword crossword) {
        this.crossword = crossword;
    }

    /**
     * Griglia height × width con la lettera di ogni casella, null dove non assegnata.
     */
    public Character[][] letterGrid(Map<Variable, String> assignment) {
        Character[][] letters = new Character[crossword.getHeight()][crossword.getWidth()];

        for (Map.Entry<Variable, String> entry : assignment.entrySet()) {
            Variable variable = entry.getKey();
            String word = entry.getValue();
            for (int k = 0; k < word.length(); k++) {
                int i = variable.getRow() + (variable.getDirection() == Direction.DOWN ? k : 0);
                int j = variable.getCol() + (variable.getDirection() == Direction.ACROSS ? k : 0);
                letters[i][j] = word.charAt(k);
            }
        }
        return letters;
    }

    /**
     * Rappresentazione testuale: lettere, spazio per caselle vuote, '█' per caselle nere.
     */
    public String render(Map<Variable, String> assignment) {
        Character[][] letters = letterGrid(assignment);
        StringBuilder output = new StringBuilder();

        for (int i = 0; i < crossword.getHeight(); i++) {
            for (int j = 0; j < crossword.getWidth(); j++) {
                if (crossword.isFillable(i, j)) {
                    output.append(letters[i][j] != null ? letters[i][j] : ' ');
                } else {
                    output.append(BLOCK);
                }
            }
            output.append('\n');
        }
        return output.toString();
    }

    public void print(Map<Variable, String> assignment) {
        System.out.print(render(assignment));
    }

    /**
     * Salva l'assegnamento come immagine PNG.
     *
     * @param assignment assegnamento da disegnare
     * @param path file di destinazione, le directory mancanti vengono create
     * @throws IOException se la scrittura dell'immagine fallisce
     */
    public void save(Map<Variable, String> assignment, Path path) throws IOException {
        int interiorSize = CELL_SIZE - 2 * CELL_BORDER;
        Character[][] letters = letterGrid(assignment);

        BufferedImage image = new BufferedImage(
                Math.max(1, crossword.getWidth() * CELL_SIZE),
                Math.max(1, crossword.getHeight() * CELL_SIZE),
                BufferedImage.TYPE_INT_ARGB);

        Graphics2D graphics = image.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            graphics.setColor(Color.BLACK);
            graphics.fillRect(0, 0, image.getWidth(), image.getHeight());
            graphics.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, FONT_SIZE));
            FontMetrics metrics = graphics.getFontMetrics();

            for (int i = 0; i < crossword.getHeight(); i++) {
                for (int j = 0; j < crossword.getWidth(); j++) {
                    if (!crossword.isFillable(i, j)) continue;

                    int x = j * CELL_SIZE + CELL_BORDER;
                    int y = i * CELL_SIZE + CELL_BORDER;
                    graphics.setColor(Color.WHITE);
                    graphics.fillRect(x, y, interiorSize, interiorSize);

                    if (letters[i][j] != null) {
                        String letter = String.valueOf(letters[i][j]);
                        int textX = x + (interiorSize - metrics.stringWidth(letter)) / 2;
                        int textY = y + (interiorSize - metrics.getHeight()) / 2 + metrics.getAscent();
                        graphics.setColor(Color.BLACK);
                        graphics.drawString(letter, textX, textY);
                    }
                }
            }
        } finally {
            graphics.dispose();
        }

        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (!ImageIO.write(image, "png", path.toFile())) {
            throw new IOException("Nessun writer PNG disponibile per " + path);
        }
        LOGGER.info("Immagine salvata: " + path);
    }
}
