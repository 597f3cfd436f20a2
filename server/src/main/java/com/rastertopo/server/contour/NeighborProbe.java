package com.rastertopo.server.contour;

import com.rastertopo.server.image.Direction;
import com.rastertopo.server.image.GridPoint;
import com.rastertopo.server.image.PixelGrid;

import java.util.Optional;

@FunctionalInterface
interface NeighborProbe {
    Optional<GridPoint> probe(PixelGrid<Integer> grid, GridPoint point, Direction direction);
}
