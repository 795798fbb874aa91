package FSA.Minimise;

import java.util.BitSet;

import FSA.BitSetUtils;

/**
 * An all-true rectangle of a {@link StateMapMatrix}: every (row, column) of the cross product is set.
 * The bit sets are owned by the grid and never modified after construction.
 */
public record Grid(BitSet rows, BitSet columns) {

    public boolean contains(int row, int column) {
        return rows.get(row) && columns.get(column);
    }

    /**
     * @return whether this grid lies inside {@code other}
     */
    public boolean isContainedIn(Grid other) {
        return BitSetUtils.isSubset(rows, other.rows) && BitSetUtils.isSubset(columns, other.columns);
    }

    @Override
    public String toString() {
        return "Grid{rows=" + rows + ", columns=" + columns + '}';
    }
}
