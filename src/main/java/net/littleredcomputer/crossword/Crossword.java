// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.ImmutableTable;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A crossword puzzle: the grid structure, the slots (variables) it contains, the
 * overlaps between intersecting slots and the vocabulary from which slots are filled.
 */
public class Crossword {
    private static final char FILLABLE = '_';

    private final int height;
    private final int width;
    private final boolean[][] structure;
    private final ImmutableSet<String> words;
    private final ImmutableSortedSet<Variable> variables;
    private final ImmutableTable<Variable, Variable, Overlap> overlaps;

    private Crossword(boolean[][] structure, Iterable<String> words) {
        this.height = structure.length;
        this.width = height > 0 ? structure[0].length : 0;
        this.structure = structure;
        this.words = ImmutableSet.copyOf(words);
        if (this.words.isEmpty()) throw new IllegalArgumentException("word list is empty");
        this.variables = findVariables();
        if (variables.isEmpty()) throw new IllegalArgumentException("structure contains no slot of length 2 or more");
        this.overlaps = findOverlaps(variables);
    }

    private ImmutableSortedSet<Variable> findVariables() {
        ImmutableSortedSet.Builder<Variable> vs = ImmutableSortedSet.naturalOrder();
        for (int i = 0; i < height; ++i) {
            for (int j = 0; j < width; ++j) {
                if (!structure[i][j]) continue;
                if (i == 0 || !structure[i - 1][j]) {
                    int length = 1;
                    while (i + length < height && structure[i + length][j]) ++length;
                    if (length > 1) vs.add(new Variable(i, j, Variable.Direction.DOWN, length));
                }
                if (j == 0 || !structure[i][j - 1]) {
                    int length = 1;
                    while (j + length < width && structure[i][j + length]) ++length;
                    if (length > 1) vs.add(new Variable(i, j, Variable.Direction.ACROSS, length));
                }
            }
        }
        return vs.build();
    }

    private static ImmutableTable<Variable, Variable, Overlap> findOverlaps(Iterable<Variable> variables) {
        ImmutableTable.Builder<Variable, Variable, Overlap> b = ImmutableTable.builder();
        for (Variable v1 : variables) {
            List<Variable.Cell> cells1 = v1.cells();
            for (Variable v2 : variables) {
                if (v1.equals(v2)) continue;
                List<Variable.Cell> cells2 = v2.cells();
                for (int i = 0; i < cells1.size(); ++i) {
                    int j = cells2.indexOf(cells1.get(i));
                    if (j >= 0) {
                        b.put(v1, v2, new Overlap(i, j));
                        break;
                    }
                }
            }
        }
        return b.build();
    }

    public int height() { return height; }
    public int width() { return width; }

    /**
     * @return true if the cell at (i, j) is marked fillable
     */
    public boolean isFillable(int i, int j) { return structure[i][j]; }

    public ImmutableSet<String> words() { return words; }

    public ImmutableSortedSet<Variable> variables() { return variables; }

    /**
     * @return the letter positions (i, j) at which x and y must agree, if they intersect.
     */
    public Optional<Overlap> overlap(Variable x, Variable y) {
        return Optional.ofNullable(overlaps.get(x, y));
    }

    /**
     * @return the variables which intersect v
     */
    public ImmutableSet<Variable> neighbors(Variable v) {
        return overlaps.row(v).keySet();
    }

    public static Crossword parseFrom(String structure, String words) {
        return parseFrom(new StringReader(structure), new StringReader(words));
    }

    /**
     * Parses a puzzle. In the structure, '_' marks a fillable cell and any other character a
     * blocked cell; short lines are padded with blocked cells. The word list has one word per
     * line; words are upper-cased and blank lines ignored.
     * @param structure grid description
     * @param words vocabulary
     * @return the puzzle
     */
    public static Crossword parseFrom(Reader structure, Reader words) {
        List<String> lines = new BufferedReader(structure).lines().collect(Collectors.toList());
        if (lines.isEmpty()) throw new IllegalArgumentException("empty structure");
        int width = lines.stream().mapToInt(String::length).max().orElse(0);
        if (width == 0) throw new IllegalArgumentException("structure has zero width");
        boolean[][] grid = new boolean[lines.size()][width];
        for (int i = 0; i < lines.size(); ++i) {
            String line = lines.get(i);
            for (int j = 0; j < line.length(); ++j) {
                grid[i][j] = line.charAt(j) == FILLABLE;
            }
        }
        List<String> vocabulary = new BufferedReader(words).lines()
                .map(CharMatcher.whitespace()::trimFrom)
                .filter(w -> !w.isEmpty())
                .map(w -> w.toUpperCase(Locale.ROOT))
                .collect(Collectors.toList());
        return new Crossword(grid, vocabulary);
    }

    public static Crossword fromFiles(Path structure, Path words) throws IOException {
        try (Reader s = Files.newBufferedReader(structure, StandardCharsets.UTF_8);
             Reader w = Files.newBufferedReader(words, StandardCharsets.UTF_8)) {
            return parseFrom(s, w);
        }
    }
}
