package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableSet;
import org.junit.Test;

import static net.littleredcomputer.crossword.Variable.Direction.ACROSS;
import static net.littleredcomputer.crossword.Variable.Direction.DOWN;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.Assert.assertThat;

public class DomainsTest {
    private final Crossword c0 = TestPuzzles.structure0();

    @Test
    public void initiallyEveryWord() {
        Domains d = Domains.initialize(c0);
        for (Variable v : c0.variables()) assertThat(ImmutableSet.copyOf(d.get(v)), is(c0.words()));
    }

    @Test
    public void nodeConsistency() {
        Domains d = Domains.initialize(c0);
        d.enforceNodeConsistency();
        assertThat(d.get(new Variable(0, 1, ACROSS, 3)), containsInAnyOrder("ONE", "TWO", "SIX", "TEN"));
        assertThat(d.get(new Variable(0, 1, DOWN, 5)), containsInAnyOrder("THREE", "SEVEN", "EIGHT"));
        assertThat(d.get(new Variable(4, 1, ACROSS, 4)), containsInAnyOrder("FOUR", "FIVE", "NINE"));
        for (Variable v : c0.variables()) {
            assertThat(d.get(v).stream().allMatch(w -> w.length() == v.length()), is(true));
        }
    }

    @Test
    public void nodeConsistencyIsIdempotent() {
        Domains d = Domains.initialize(c0);
        d.enforceNodeConsistency();
        Variable v = new Variable(1, 4, DOWN, 4);
        ImmutableSet<String> once = ImmutableSet.copyOf(d.get(v));
        d.enforceNodeConsistency();
        assertThat(ImmutableSet.copyOf(d.get(v)), is(once));
    }

    @Test
    public void lengthWithNoWordsEmptiesDomain() {
        Crossword c = Crossword.parseFrom("____", "cat\ndog");
        Domains d = Domains.initialize(c);
        d.enforceNodeConsistency();
        assertThat(d.isEmpty(new Variable(0, 0, ACROSS, 4)), is(true));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void viewsAreReadOnly() {
        Domains.initialize(c0).get(new Variable(0, 1, ACROSS, 3)).clear();
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownVariable() {
        Domains.initialize(c0).size(new Variable(3, 3, ACROSS, 2));
    }
}
