package com.monitoring.customgraph.render;

import com.monitoring.customgraph.render.RenderModels.CombinedGraphRequest;
import com.monitoring.customgraph.render.RenderModels.RenderedGraph;

public interface CombinedSeriesRenderer {
    RenderedGraph renderCombined(CombinedGraphRequest request);
}
