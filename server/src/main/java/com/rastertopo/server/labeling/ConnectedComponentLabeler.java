package com.rastertopo.server.labeling;

import com.rastertopo.server.image.PixelGrid;

public interface ConnectedComponentLabeler {
    /**
     * Assigns a component label to every nonzero pixel of the image. Two pixels
     * share a component when they are adjacent under the given connectivity and
     * carry the same value. The input grid is left untouched.
     *
     * @param image        input grid, 0 means background
     * @param connectivity neighborhood used to group pixels
     * @return label grid with the same dimensions and the number of components
     */
    LabelingResult label(PixelGrid<Integer> image, Connectivity connectivity);
}
