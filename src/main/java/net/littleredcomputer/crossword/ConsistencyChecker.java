package net.littleredcomputer.crossword;

import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Checks partial or complete assignments against the puzzle's constraints.
 */
public class ConsistencyChecker {
    private final Crossword crossword;

    public ConsistencyChecker(Crossword crossword) {
        this.crossword = crossword;
    }

    /**
     * @return true if every variable of the puzzle is assigned.
     */
    public boolean complete(Map<Variable, String> assignment) {
        return assignment.keySet().containsAll(crossword.variables());
    }

    /**
     * An assignment is consistent when its words are distinct, each word fits its
     * variable's length, and assigned intersecting variables agree at their overlap.
     * Unassigned neighbors impose no constraint.
     */
    public boolean consistent(Map<Variable, String> assignment) {
        Set<String> seen = new HashSet<>();
        for (Map.Entry<Variable, String> e : assignment.entrySet()) {
            if (!seen.add(e.getValue())) return false;
            if (e.getValue().length() != e.getKey().length()) return false;
        }
        // All lengths are now known to be right, so overlap indices are in range.
        for (Map.Entry<Variable, String> e : assignment.entrySet()) {
            Variable v = e.getKey();
            String word = e.getValue();
            for (Variable n : crossword.neighbors(v)) {
                String other = assignment.get(n);
                if (other == null) continue;
                Optional<Overlap> o = crossword.overlap(v, n);
                if (o.isPresent() && !o.get().agrees(word, other)) return false;
            }
        }
        return true;
    }
}
