package com.monitoring.customgraph.render;

import java.util.List;

public class RenderModels {
    public static final String PNG_CONTENT_TYPE = "image/png";
    public static final String HTML_CONTENT_TYPE = "text/html;charset=UTF-8";

    public record CombinedGraphRequest(List<Integer> moduleIds,
                                       List<Double> weights,
                                       long periodSeconds,
                                       int width,
                                       int height,
                                       String title,
                                       String yLabel,
                                       boolean baseline,
                                       boolean showLabels,
                                       boolean onlyAverage,
                                       boolean stacked,
                                       long startDate) {
        public CombinedGraphRequest {
            if (moduleIds.size() != weights.size()) {
                throw new IllegalArgumentException("Expected one weight per module, got " + weights.size() + " for " + moduleIds.size());
            }
            moduleIds = List.copyOf(moduleIds);
            weights = List.copyOf(weights);
        }
    }

    public record RenderedGraph(String contentType, byte[] content, boolean empty) {}

    private RenderModels() {}
}
