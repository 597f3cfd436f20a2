package com.rastertopo.server.labeling;

import com.rastertopo.server.image.PixelGrid;

public class LabelingResult {
    private final PixelGrid<Integer> labels;
    private final int componentCount;
    private final Connectivity connectivity;

    public LabelingResult(PixelGrid<Integer> labels, int componentCount, Connectivity connectivity) {
        this.labels = labels;
        this.componentCount = componentCount;
        this.connectivity = connectivity;
    }

    public static LabelingResult empty(Connectivity connectivity) {
        return new LabelingResult(new PixelGrid<>(0, 0, 0), 0, connectivity);
    }

    /** Label per pixel, 0 for background. Same dimensions as the input. */
    public PixelGrid<Integer> getLabels() {
        return labels;
    }

    public int getComponentCount() {
        return componentCount;
    }

    public Connectivity getConnectivity() {
        return connectivity;
    }
}
