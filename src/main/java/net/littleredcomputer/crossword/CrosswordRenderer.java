package net.littleredcomputer.crossword;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Draws an assignment into the crossword's grid, as text or as an image.
 */
public class CrosswordRenderer {
    private static final char BLOCK = '█';
    private static final int cellSize = 100;
    private static final int cellBorder = 2;
    private static final int interiorSize = cellSize - 2 * cellBorder;

    private final Crossword crossword;

    public CrosswordRenderer(Crossword crossword) {
        this.crossword = crossword;
    }

    /**
     * @return height x width array of letters; cells not covered by an assigned word hold 0
     */
    char[][] letterGrid(Map<Variable, String> assignment) {
        char[][] letters = new char[crossword.height()][crossword.width()];
        assignment.forEach((v, word) -> {
            for (int k = 0; k < Math.min(word.length(), v.length()); ++k) {
                Variable.Cell c = v.cells().get(k);
                letters[c.row()][c.column()] = word.charAt(k);
            }
        });
        return letters;
    }

    public String toText(Map<Variable, String> assignment) {
        char[][] letters = letterGrid(assignment);
        StringBuilder s = new StringBuilder();
        for (int i = 0; i < crossword.height(); ++i) {
            for (int j = 0; j < crossword.width(); ++j) {
                if (crossword.isFillable(i, j)) {
                    s.append(letters[i][j] != 0 ? letters[i][j] : ' ');
                } else {
                    s.append(BLOCK);
                }
            }
            s.append('\n');
        }
        return s.toString();
    }

    public void saveImage(Map<Variable, String> assignment, Path file) throws IOException {
        char[][] letters = letterGrid(assignment);
        BufferedImage img = new BufferedImage(crossword.width() * cellSize, crossword.height() * cellSize,
                BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = img.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setColor(Color.BLACK);
            g.fillRect(0, 0, img.getWidth(), img.getHeight());
            g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 80));
            FontMetrics fm = g.getFontMetrics();
            for (int i = 0; i < crossword.height(); ++i) {
                for (int j = 0; j < crossword.width(); ++j) {
                    if (!crossword.isFillable(i, j)) continue;
                    int x = j * cellSize + cellBorder;
                    int y = i * cellSize + cellBorder;
                    g.setColor(Color.WHITE);
                    g.fillRect(x, y, interiorSize, interiorSize);
                    if (letters[i][j] != 0) {
                        String letter = String.valueOf(letters[i][j]);
                        g.setColor(Color.BLACK);
                        g.drawString(letter,
                                x + (interiorSize - fm.stringWidth(letter)) / 2,
                                y + (interiorSize - fm.getHeight()) / 2 + fm.getAscent());
                    }
                }
            }
        } finally {
            g.dispose();
        }
        if (!ImageIO.write(img, "png", file.toFile())) {
            throw new IOException("no PNG writer available");
        }
    }
}
