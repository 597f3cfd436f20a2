package com.rastertopo.server.labeling;

import com.rastertopo.server.image.Direction;
import com.rastertopo.server.image.GridPoint;
import com.rastertopo.server.image.PixelGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Breadth-first flood labeling. Labels are handed out in row-major discovery
 * order and always form the contiguous range {@code [1, componentCount]}.
 */
public class FloodFillLabeler implements ConnectedComponentLabeler {

    private static final Logger logger = LoggerFactory.getLogger(FloodFillLabeler.class);

    @Override
    public LabelingResult label(PixelGrid<Integer> image, Connectivity connectivity) {
        if (image.isEmpty()) {
            return LabelingResult.empty(connectivity);
        }

        int height = image.getHeight();
        int width = image.getWidth();
        PixelGrid<Integer> labels = new PixelGrid<>(height, width, 0);
        Deque<GridPoint> queue = new ArrayDeque<>();
        int currentLabel = 0;

        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                int value = image.get(r, c);
                if (value == 0 || labels.get(r, c) != 0) {
                    continue;
                }

                currentLabel++;
                labels.set(r, c, currentLabel);
                queue.add(new GridPoint(r, c));
                absorbNeighbors(image, labels, queue, value, currentLabel, connectivity);
            }
        }

        logger.debug("Flood fill labeled {}x{} grid: {} components ({})", height, width, currentLabel,
                connectivity);
        return new LabelingResult(labels, currentLabel, connectivity);
    }

    // A pixel is labeled when enqueued, so it is never enqueued twice.
    private void absorbNeighbors(PixelGrid<Integer> image, PixelGrid<Integer> labels, Deque<GridPoint> queue,
            int value, int currentLabel, Connectivity connectivity) {
        while (!queue.isEmpty()) {
            GridPoint point = queue.poll();
            for (Direction d : connectivity.neighbors()) {
                GridPoint neighbor = point.step(d);
                Optional<Integer> neighborValue = image.tryGet(neighbor.getRow(), neighbor.getCol());
                if (neighborValue.isPresent() && neighborValue.get() == value
                        && labels.get(neighbor.getRow(), neighbor.getCol()) == 0) {
                    labels.set(neighbor.getRow(), neighbor.getCol(), currentLabel);
                    queue.add(neighbor);
                }
            }
        }
    }
}
