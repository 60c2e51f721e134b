package net.littleredcomputer.crossword;

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;

import java.util.Locale;
import java.util.Objects;

/**
 * A fillable slot of the grid: a run of cells starting at (row, column) and extending
 * either across or down.
 */
public final class Variable implements Comparable<Variable> {
    public enum Direction {
        ACROSS,
        DOWN,
    }

    private final int row;
    private final int column;
    private final Direction direction;
    private final int length;
    private final ImmutableList<Cell> cells;

    /** A grid coordinate. */
    public static final class Cell {
        final int row;
        final int column;

        Cell(int row, int column) { this.row = row; this.column = column; }

        public int row() { return row; }
        public int column() { return column; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Cell)) return false;
            Cell c = (Cell) o;
            return row == c.row && column == c.column;
        }

        @Override
        public int hashCode() { return 31 * row + column; }

        @Override
        public String toString() { return "(" + row + ", " + column + ")"; }
    }

    public Variable(int row, int column, Direction direction, int length) {
        if (row < 0 || column < 0) throw new IllegalArgumentException("negative coordinate: " + row + "," + column);
        if (length < 1) throw new IllegalArgumentException("length must be positive: " + length);
        this.row = row;
        this.column = column;
        this.direction = Objects.requireNonNull(direction, "direction");
        this.length = length;
        ImmutableList.Builder<Cell> b = ImmutableList.builder();
        for (int k = 0; k < length; ++k) {
            b.add(direction == Direction.DOWN ? new Cell(row + k, column) : new Cell(row, column + k));
        }
        this.cells = b.build();
    }

    public int row() { return row; }
    public int column() { return column; }
    public Direction direction() { return direction; }
    public int length() { return length; }

    /**
     * @return the cells covered by this slot; the k-th cell holds the k-th letter.
     */
    public ImmutableList<Cell> cells() { return cells; }

    @Override
    public int compareTo(Variable o) {
        return ComparisonChain.start()
                .compare(row, o.row)
                .compare(column, o.column)
                .compare(direction, o.direction)
                .compare(length, o.length)
                .result();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Variable)) return false;
        Variable v = (Variable) o;
        return row == v.row && column == v.column && direction == v.direction && length == v.length;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, column, direction, length);
    }

    @Override
    public String toString() {
        return "(" + row + ", " + column + ") " + direction.name().toLowerCase(Locale.ROOT) + " : " + length;
    }
}
