package com.rastertopo.server.config;

public class TopologyConfig {

    public static final int DEFAULT_MAX_PIXELS = 16_777_216;

    public static class LabelingConfig {
        public String strategy = "flood_fill";
        public String connectivity = "8";
    }

    public static class ContourConfig {
        public String retrieval = "tree";
    }

    public LabelingConfig labeling = new LabelingConfig();
    public ContourConfig contours = new ContourConfig();
    // Requests with more pixels than this are rejected
    public Integer maxPixels = DEFAULT_MAX_PIXELS;

    public static TopologyConfig defaults() {
        return new TopologyConfig();
    }

    /** Fills any section or value missing from a parsed file with its default. */
    public TopologyConfig withDefaults() {
        TopologyConfig d = defaults();
        if (labeling == null) {
            labeling = d.labeling;
        }
        if (labeling.strategy == null) {
            labeling.strategy = d.labeling.strategy;
        }
        if (labeling.connectivity == null) {
            labeling.connectivity = d.labeling.connectivity;
        }
        if (contours == null) {
            contours = d.contours;
        }
        if (contours.retrieval == null) {
            contours.retrieval = d.contours.retrieval;
        }
        if (maxPixels == null || maxPixels <= 0) {
            maxPixels = DEFAULT_MAX_PIXELS;
        }
        return this;
    }
}
