package com.monitoring.customgraph.render;

import com.monitoring.customgraph.render.RenderModels.CombinedGraphRequest;
import com.monitoring.customgraph.render.RenderModels.RenderedGraph;
import com.monitoring.customgraph.repository.ModuleDataJdbcRepository;
import com.monitoring.customgraph.repository.ModuleDataJdbcRepository.ModuleSample;
import org.rrd4j.data.IPlottable;
import org.rrd4j.data.LinearInterpolator;
import org.rrd4j.data.Variable;
import org.rrd4j.graph.RrdGraph;
import org.rrd4j.graph.RrdGraphDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.Color;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.*;

@Component
public class RrdCombinedSeriesRenderer implements CombinedSeriesRenderer {
    private static final Logger log = LoggerFactory.getLogger(RrdCombinedSeriesRenderer.class);

    private static final Color[] PALETTE = {
            new Color(0x3465a4), new Color(0xcc0000), new Color(0x73d216), new Color(0xf57900),
            new Color(0x75507b), new Color(0xc4a000), new Color(0x06989a), new Color(0x555753)
    };

    private final ModuleDataJdbcRepository repository;

    public RrdCombinedSeriesRenderer(ModuleDataJdbcRepository repository) {
        this.repository = repository;
    }

    @Override
    public RenderedGraph renderCombined(CombinedGraphRequest request) {
        long end = request.startDate() == 0 ? Instant.now().getEpochSecond() : request.startDate();
        RrdGraphDef def = graphDef(request, end);
        try {
            RrdGraph graph = new RrdGraph(def);
            log.debug("Rendered {} series ending at {}, stacked={}", request.moduleIds().size(), end, request.stacked());
            return new RenderedGraph(RenderModels.PNG_CONTENT_TYPE, graph.getRrdGraphInfo().getBytes(), false);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render combined graph", e);
        }
    }

    RrdGraphDef graphDef(CombinedGraphRequest request, long end) {
        long start = end - request.periodSeconds();
        Map<Integer, String> names = repository.loadModuleNames(new LinkedHashSet<>(request.moduleIds()));

        RrdGraphDef def = new RrdGraphDef(start, end);
        def.setWidth(request.width());
        def.setHeight(request.height());
        def.setImageFormat("PNG");
        def.setFilename("-");
        def.setShowSignature(false);
        if (request.title() != null && !request.title().isBlank()) {
            def.setTitle(request.title());
        }
        if (request.yLabel() != null && !request.yLabel().isBlank()) {
            def.setVerticalLabel(request.yLabel());
        }

        for (int i = 0; i < request.moduleIds().size(); i++) {
            int moduleId = request.moduleIds().get(i);
            String raw = "m" + i;
            String scaled = seriesName(i);
            Color color = PALETTE[i % PALETTE.length];
            String legend = names.getOrDefault(moduleId, "module #" + moduleId) + " (x" + request.weights().get(i) + ")";

            def.datasource(raw, plottable(repository.loadSamples(moduleId, start, end)));
            def.datasource(scaled, raw + "," + request.weights().get(i) + ",*");

            if (request.stacked()) {
                def.area(scaled, color, legend, i > 0);
            } else {
                def.line(scaled, color, legend, 1.5f);
            }
            if (request.baseline()) {
                def.datasource(scaled + "trend", scaled + "," + Math.max(1, request.periodSeconds() / 10) + ",TREND");
                def.line(scaled + "trend", color.darker(), 1.0f);
            }

            statistics(def, i, request.onlyAverage(), request.showLabels());
        }
        return def;
    }

    static String seriesName(int index) {
        return "w" + index;
    }

    private static void statistics(RrdGraphDef def, int index, boolean onlyAverage, boolean showLast) {
        String scaled = seriesName(index);
        if (!onlyAverage) {
            def.datasource("min" + index, scaled, new Variable.MIN());
            def.gprint("min" + index, "  Min: %.2f");
        }
        def.datasource("avg" + index, scaled, new Variable.AVERAGE());
        def.gprint("avg" + index, "  Avg: %.2f");
        if (!onlyAverage) {
            def.datasource("max" + index, scaled, new Variable.MAX());
            def.gprint("max" + index, "  Max: %.2f");
        }
        if (showLast) {
            def.datasource("last" + index, scaled, new Variable.LAST());
            def.gprint("last" + index, "  Now: %.2f");
        }
        def.comment("\\l");
    }

    // Linear between samples, unknown outside them. A lone sample holds from its timestamp on.
    static IPlottable plottable(List<ModuleSample> samples) {
        TreeMap<Long, Double> points = new TreeMap<>();
        samples.forEach(s -> points.put(s.timestamp(), s.value()));

        if (points.isEmpty()) return timestamp -> Double.NaN;
        if (points.size() == 1) {
            long at = points.firstKey();
            double value = points.firstEntry().getValue();
            return timestamp -> timestamp >= at ? value : Double.NaN;
        }
        return new LinearInterpolator(
                points.keySet().stream().mapToLong(Long::longValue).toArray(),
                points.values().stream().mapToDouble(Double::doubleValue).toArray());
    }
}
