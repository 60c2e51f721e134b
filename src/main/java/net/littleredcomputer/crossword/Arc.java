package net.littleredcomputer.crossword;

import java.util.Objects;

/**
 * A directed constraint arc: x is to be made consistent with y.
 */
public final class Arc {
    private final Variable x;
    private final Variable y;

    public Arc(Variable x, Variable y) {
        this.x = Objects.requireNonNull(x);
        this.y = Objects.requireNonNull(y);
    }

    public Variable x() { return x; }
    public Variable y() { return y; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Arc)) return false;
        Arc a = (Arc) o;
        return x.equals(a.x) && y.equals(a.y);
    }

    @Override
    public int hashCode() { return 31 * x.hashCode() + y.hashCode(); }

    @Override
    public String toString() { return x + " -> " + y; }
}
