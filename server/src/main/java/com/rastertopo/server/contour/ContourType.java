package com.rastertopo.server.contour;

public enum ContourType {
    /** Boundary between a foreground region and the background directly around it. */
    OUTER,
    /** Boundary of a background region enclosed by a foreground region. */
    HOLE,
    /** Synthetic root standing for the frame around the image. */
    BACKGROUND
}
