package com.rastertopo.server.image;

/**
 * The 8 compass directions in clockwise order, starting at north. Rows grow
 * southwards and columns grow eastwards.
 */
public enum Direction {
    NORTH(-1, 0),
    NORTH_EAST(-1, 1),
    EAST(0, 1),
    SOUTH_EAST(1, 1),
    SOUTH(1, 0),
    SOUTH_WEST(1, -1),
    WEST(0, -1),
    NORTH_WEST(-1, -1);

    private static final Direction[] VALUES = values();

    private final int rowOffset;
    private final int colOffset;

    Direction(int rowOffset, int colOffset) {
        this.rowOffset = rowOffset;
        this.colOffset = colOffset;
    }

    public int getRowOffset() {
        return rowOffset;
    }

    public int getColOffset() {
        return colOffset;
    }

    public Direction clockwise() {
        return VALUES[(ordinal() + 1) % VALUES.length];
    }

    public Direction counterClockwise() {
        return VALUES[(ordinal() + VALUES.length - 1) % VALUES.length];
    }
}
