package com.rastertopo.server.labeling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LabelerFactory {

    private static final Logger logger = LoggerFactory.getLogger(LabelerFactory.class);

    public static final String FLOOD_FILL = "flood_fill";
    public static final String TWO_PASS = "two_pass";

    public static ConnectedComponentLabeler create(String strategy) {
        // Default to flood fill if missing or invalid
        if (strategy == null || strategy.trim().isEmpty()) {
            return new FloodFillLabeler();
        }

        switch (strategy.trim().toLowerCase()) {
            case FLOOD_FILL:
                return new FloodFillLabeler();
            case TWO_PASS:
                return new TwoPassLabeler();
            default:
                logger.warn("Unknown labeling strategy '{}', defaulting to '{}'", strategy, FLOOD_FILL);
                return new FloodFillLabeler();
        }
    }
}
