package com.rastertopo.server.labeling;

import com.rastertopo.server.image.Direction;

import java.util.List;
import java.util.Locale;

/**
 * Which neighboring pixels count as adjacent when grouping foreground pixels.
 */
public enum Connectivity {
    FOUR_CONNECTED(
            List.of(Direction.NORTH, Direction.WEST, Direction.EAST, Direction.SOUTH),
            List.of(Direction.NORTH, Direction.WEST)),
    EIGHT_CONNECTED(
            List.of(Direction.values()),
            List.of(Direction.NORTH_WEST, Direction.NORTH, Direction.NORTH_EAST, Direction.WEST));

    private final List<Direction> neighbors;
    private final List<Direction> causalNeighbors;

    Connectivity(List<Direction> neighbors, List<Direction> causalNeighbors) {
        this.neighbors = neighbors;
        this.causalNeighbors = causalNeighbors;
    }

    public List<Direction> neighbors() {
        return neighbors;
    }

    /** Neighbors already visited by a row-major scan when the current pixel is reached. */
    public List<Direction> causalNeighbors() {
        return causalNeighbors;
    }

    public static Connectivity parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Connectivity must not be null");
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "4":
            case "four":
            case "four_connected":
                return FOUR_CONNECTED;
            case "8":
            case "eight":
            case "eight_connected":
                return EIGHT_CONNECTED;
            default:
                throw new IllegalArgumentException("Unknown connectivity '" + value + "', expected 4 or 8");
        }
    }
}
