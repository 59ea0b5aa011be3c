package com.monitoring.customgraph.graph;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.monitoring.customgraph.domain.DomainModels.GraphDefinition;

public class CustomGraphModels {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record VisibleGraphEntry(int id, String name, GraphDefinition definition, Integer sourceCount) {
        public static VisibleGraphEntry nameOnly(GraphDefinition graph) {
            return new VisibleGraphEntry(graph.id(), graph.name(), null, null);
        }

        public static VisibleGraphEntry annotated(GraphDefinition graph, int sourceCount) {
            return new VisibleGraphEntry(graph.id(), graph.name(), graph, sourceCount);
        }
    }

    public record RenderRequest(int graphId, int height, int width, long periodSeconds, boolean stacked, long startDate) {}

    private CustomGraphModels() {}
}
