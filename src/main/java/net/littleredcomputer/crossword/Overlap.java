package net.littleredcomputer.crossword;

/**
 * Letter i of the first variable's word must equal letter j of the second's.
 */
public final class Overlap {
    private final int i;
    private final int j;

    Overlap(int i, int j) {
        if (i < 0 || j < 0) throw new IllegalArgumentException("negative overlap index: " + i + "," + j);
        this.i = i;
        this.j = j;
    }

    public int i() { return i; }
    public int j() { return j; }

    Overlap reversed() { return new Overlap(j, i); }

    /**
     * @return true if the two words agree at this overlap.
     */
    boolean agrees(String first, String second) {
        return first.charAt(i) == second.charAt(j);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Overlap)) return false;
        Overlap other = (Overlap) o;
        return i == other.i && j == other.j;
    }

    @Override
    public int hashCode() { return 31 * i + j; }

    @Override
    public String toString() { return "(" + i + ", " + j + ")"; }
}
