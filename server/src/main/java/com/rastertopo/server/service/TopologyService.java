package com.rastertopo.server.service;

import com.rastertopo.server.config.TopologyConfig;
import com.rastertopo.server.config.TopologyConfigLoader;
import com.rastertopo.server.contour.ContourPainter;
import com.rastertopo.server.contour.ContourResult;
import com.rastertopo.server.contour.ContourRetrieval;
import com.rastertopo.server.contour.ContourTracer;
import com.rastertopo.server.image.PixelGrid;
import com.rastertopo.server.labeling.ConnectedComponentLabeler;
import com.rastertopo.server.labeling.Connectivity;
import com.rastertopo.server.labeling.LabelerFactory;
import com.rastertopo.server.labeling.LabelingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class TopologyService {

    private static final Logger logger = LoggerFactory.getLogger(TopologyService.class);

    private final TopologyConfig config;
    private final ContourTracer tracer = new ContourTracer();

    public TopologyService() {
        this(TopologyConfigLoader.load());
    }

    public TopologyService(TopologyConfig config) {
        this.config = config.withDefaults();
        logger.info("Topology service ready: strategy={}, connectivity={}, retrieval={}, maxPixels={}",
                this.config.labeling.strategy, this.config.labeling.connectivity, this.config.contours.retrieval,
                this.config.maxPixels);
    }

    public TopologyConfig getConfig() {
        return config;
    }

    /**
     * Labels connected components. Null connectivity or strategy falls back to
     * the configured defaults.
     */
    public LabelingResult labelComponents(int[][] pixels, String connectivity, String strategy) {
        Connectivity conn = Connectivity.parse(connectivity != null ? connectivity : config.labeling.connectivity);
        ConnectedComponentLabeler labeler = LabelerFactory.create(
                strategy != null ? strategy : config.labeling.strategy);

        PixelGrid<Integer> image = toGrid(pixels);
        LabelingResult result = labeler.label(image, conn);
        logger.info("Labeled {}x{} grid with {}: {} components", image.getHeight(), image.getWidth(),
                labeler.getClass().getSimpleName(), result.getComponentCount());
        return result;
    }

    public ContourResult findContours(int[][] pixels, String retrieval) {
        ContourRetrieval mode = ContourRetrieval.parse(retrieval != null ? retrieval : config.contours.retrieval);
        PixelGrid<Integer> image = toGrid(pixels);
        ContourResult result = tracer.findContours(image, mode);
        logger.info("Traced {}x{} grid: {} contours, {} degenerate", image.getHeight(), image.getWidth(),
                result.getContourCount(), result.getDegenerateBorderCount());
        return result;
    }

    /** Grid of the input's size with 1 on every traced border pixel. */
    public PixelGrid<Integer> contourMask(int[][] pixels, String retrieval) {
        PixelGrid<Integer> image = toGrid(pixels);
        ContourRetrieval mode = ContourRetrieval.parse(retrieval != null ? retrieval : config.contours.retrieval);
        ContourResult result = tracer.findContours(image, mode);
        return ContourPainter.paint(result, image.getHeight(), image.getWidth());
    }

    private PixelGrid<Integer> toGrid(int[][] pixels) {
        if (pixels != null) {
            long size = 0;
            for (int[] row : pixels) {
                size += row != null ? row.length : 0;
            }
            if (size > config.maxPixels) {
                throw new IllegalArgumentException(
                        "Grid has " + size + " pixels, limit is " + config.maxPixels);
            }
        }
        return PixelGrid.fromArray(pixels);
    }
}
