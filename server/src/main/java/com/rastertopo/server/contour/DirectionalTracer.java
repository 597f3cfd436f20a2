package com.rastertopo.server.contour;

import com.rastertopo.server.image.Direction;
import com.rastertopo.server.image.GridPoint;
import com.rastertopo.server.image.PixelGrid;

import java.util.Optional;

/**
 * Stateless compass helpers used by the border follower.
 */
public final class DirectionalTracer {

    private DirectionalTracer() {
    }

    /**
     * Returns the neighbor of {@code point} in {@code direction} if it lies
     * inside the grid and holds a nonzero value.
     */
    public static Optional<GridPoint> activeNeighbor(PixelGrid<Integer> grid, GridPoint point, Direction direction) {
        GridPoint neighbor = point.step(direction);
        return grid.tryGet(neighbor.getRow(), neighbor.getCol())
                .filter(value -> value != 0)
                .map(value -> neighbor);
    }

    /**
     * Compass direction pointing from {@code from} towards {@code to}. The points
     * need not be adjacent; only the signs of the row and column deltas matter.
     *
     * @throws TracerInvariantException if both points are the same
     */
    public static Direction direction(GridPoint from, GridPoint to) {
        if (from.equals(to)) {
            throw new TracerInvariantException("Cannot take a direction between identical points " + from);
        }

        int dRow = Integer.signum(to.getRow() - from.getRow());
        int dCol = Integer.signum(to.getCol() - from.getCol());
        if (dRow == 0) {
            return dCol > 0 ? Direction.EAST : Direction.WEST;
        } else if (dRow > 0) {
            if (dCol == 0) {
                return Direction.SOUTH;
            }
            return dCol > 0 ? Direction.SOUTH_EAST : Direction.SOUTH_WEST;
        } else {
            if (dCol == 0) {
                return Direction.NORTH;
            }
            return dCol > 0 ? Direction.NORTH_EAST : Direction.NORTH_WEST;
        }
    }
}
