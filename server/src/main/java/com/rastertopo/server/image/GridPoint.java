package com.rastertopo.server.image;

import java.util.Objects;

/**
 * Immutable (row, col) coordinate. Coordinates are not bound to any grid, so a
 * point may lie outside it (e.g. the virtual pixel left of column 0).
 */
public final class GridPoint {
    private final int row;
    private final int col;

    public GridPoint(int row, int col) {
        this.row = row;
        this.col = col;
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    public GridPoint step(Direction direction) {
        return new GridPoint(row + direction.getRowOffset(), col + direction.getColOffset());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GridPoint)) {
            return false;
        }
        GridPoint other = (GridPoint) o;
        return row == other.row && col == other.col;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, col);
    }

    @Override
    public String toString() {
        return "(" + row + ", " + col + ")";
    }
}
