package com.rastertopo.server.controller;

import com.rastertopo.server.contour.Contour;
import com.rastertopo.server.contour.ContourResult;
import com.rastertopo.server.image.GridPoint;
import com.rastertopo.server.image.PixelGrid;
import com.rastertopo.server.labeling.LabelingResult;
import com.rastertopo.server.service.TopologyService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;

@RestController
public class TopologyController {

    private static final Logger logger = LoggerFactory.getLogger(TopologyController.class);
    private final TopologyService topologyService;

    public TopologyController(TopologyService topologyService) {
        this.topologyService = topologyService;
    }

    public static class LabelingRequest {
        public int[][] pixels;
        // Optional, configured defaults apply when absent
        public String connectivity;
        public String strategy;
    }

    public static class ContourRequest {
        public int[][] pixels;
        public String retrieval;
    }

    public static class LabelingResponse {
        public int width;
        public int height;
        public int componentCount;
        public String connectivity;
        public int[][] labels;
    }

    public static class ContourNode {
        public String type;
        public List<GridPoint> points;
        public List<ContourNode> children = new ArrayList<>();
    }

    public static class ContourResponse {
        public int contourCount;
        public int degenerateBorders;
        public ContourNode root;
    }

    public static class MaskResponse {
        public int width;
        public int height;
        public int[][] mask;
    }

    @PostMapping("/connected-components")
    public ResponseEntity<?> connectedComponents(@RequestBody LabelingRequest request) {
        if (request.pixels == null) {
            return ResponseEntity.badRequest().body("Missing pixel grid.");
        }

        logger.info("Received connected components request.");
        LabelingResult result = topologyService.labelComponents(request.pixels, request.connectivity,
                request.strategy);

        LabelingResponse response = new LabelingResponse();
        response.width = result.getLabels().getWidth();
        response.height = result.getLabels().getHeight();
        response.componentCount = result.getComponentCount();
        response.connectivity = result.getConnectivity().name();
        response.labels = PixelGrid.toIntArray(result.getLabels());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/contours")
    public ResponseEntity<?> contours(@RequestBody ContourRequest request) {
        if (request.pixels == null) {
            return ResponseEntity.badRequest().body("Missing pixel grid.");
        }

        logger.info("Received contour request.");
        ContourResult result = topologyService.findContours(request.pixels, request.retrieval);

        ContourResponse response = new ContourResponse();
        response.contourCount = result.getContourCount();
        response.degenerateBorders = result.getDegenerateBorderCount();
        response.root = toNode(result.getRoot());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/contours/mask")
    public ResponseEntity<?> contourMask(@RequestBody ContourRequest request) {
        if (request.pixels == null) {
            return ResponseEntity.badRequest().body("Missing pixel grid.");
        }

        PixelGrid<Integer> mask = topologyService.contourMask(request.pixels, request.retrieval);
        MaskResponse response = new MaskResponse();
        response.width = mask.getWidth();
        response.height = mask.getHeight();
        response.mask = PixelGrid.toIntArray(mask);
        return ResponseEntity.ok(response);
    }

    private static ContourNode toNode(Contour contour) {
        ContourNode node = new ContourNode();
        node.type = contour.getType().name();
        node.points = contour.getPoints();
        for (Contour child : contour.getChildren()) {
            node.children.add(toNode(child));
        }
        return node;
    }
}
