package com.rastertopo.server.labeling;

import com.rastertopo.server.image.Direction;
import com.rastertopo.server.image.PixelGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Classic two-pass labeling. The first pass hands out provisional labels from
 * the causal neighbors and records equivalences; the second pass rewrites each
 * provisional label to the smallest label of its class.
 * <p>
 * Final labels are class minima and are therefore not necessarily contiguous.
 */
public class TwoPassLabeler implements ConnectedComponentLabeler {

    private static final Logger logger = LoggerFactory.getLogger(TwoPassLabeler.class);

    @Override
    public LabelingResult label(PixelGrid<Integer> image, Connectivity connectivity) {
        if (image.isEmpty()) {
            return LabelingResult.empty(connectivity);
        }

        int height = image.getHeight();
        int width = image.getWidth();
        PixelGrid<Integer> labels = new PixelGrid<>(height, width, 0);
        EquivalenceClasses equivalences = new EquivalenceClasses();

        // First pass
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                int value = image.get(r, c);
                if (value == 0) {
                    continue;
                }

                SortedSet<Integer> neighborLabels = neighborLabels(image, labels, r, c, value, connectivity);
                if (neighborLabels.isEmpty()) {
                    labels.set(r, c, equivalences.newLabel());
                } else {
                    int smallest = neighborLabels.first();
                    labels.set(r, c, smallest);
                    for (int other : neighborLabels) {
                        equivalences.union(smallest, other);
                    }
                }
            }
        }

        // Second pass
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                int provisional = labels.get(r, c);
                if (provisional != 0) {
                    labels.set(r, c, equivalences.representative(provisional));
                }
            }
        }

        int componentCount = equivalences.classCount();
        logger.debug("Two-pass labeled {}x{} grid: {} provisional labels resolved into {} components ({})",
                height, width, equivalences.size(), componentCount, connectivity);
        return new LabelingResult(labels, componentCount, connectivity);
    }

    private SortedSet<Integer> neighborLabels(PixelGrid<Integer> image, PixelGrid<Integer> labels, int r, int c,
            int value, Connectivity connectivity) {
        SortedSet<Integer> found = new TreeSet<>();
        for (Direction d : connectivity.causalNeighbors()) {
            int nr = r + d.getRowOffset();
            int nc = c + d.getColOffset();
            Optional<Integer> neighborValue = image.tryGet(nr, nc);
            if (neighborValue.isPresent() && neighborValue.get() == value) {
                int neighborLabel = labels.get(nr, nc);
                if (neighborLabel != 0) {
                    found.add(neighborLabel);
                }
            }
        }
        return found;
    }
}
