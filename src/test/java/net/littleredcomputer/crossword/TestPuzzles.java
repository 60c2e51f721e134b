package net.littleredcomputer.crossword;

import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/**
 * Puzzles shared among the tests.
 */
class TestPuzzles {
    private static Reader resource(String name) {
        return new InputStreamReader(TestPuzzles.class.getClassLoader().getResourceAsStream(name), StandardCharsets.UTF_8);
    }

    static Crossword fromResources(String structure, String words) {
        return Crossword.parseFrom(resource(structure), resource(words));
    }

    /** Four slots, solvable in exactly one way. */
    static Crossword structure0() {
        return fromResources("structure0.txt", "words0.txt");
    }

    /** Three across and three down five-letter slots meeting at nine cells. */
    static Crossword lattice() {
        return fromResources("lattice.txt", "lattice-words.txt");
    }
}
