package com.monitoring.customgraph.render;

import com.monitoring.customgraph.render.RenderModels.CombinedGraphRequest;
import com.monitoring.customgraph.repository.ModuleDataJdbcRepository;
import com.monitoring.customgraph.repository.ModuleDataJdbcRepository.ModuleSample;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.rrd4j.data.IPlottable;
import org.rrd4j.graph.RrdGraph;
import org.rrd4j.graph.RrdGraphDef;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class RrdCombinedSeriesRendererTest {
    private static final long END = 1_700_000_000L;

    private ModuleDataJdbcRepository repository;
    private RrdCombinedSeriesRenderer renderer;

    @BeforeEach
    void setUp() {
        repository = mock(ModuleDataJdbcRepository.class);
        when(repository.loadModuleNames(anyCollection())).thenReturn(Map.of(100, "cpu_load", 101, "mem_used"));
        when(repository.loadSamples(eq(100), anyLong(), anyLong())).thenReturn(List.of(
                new ModuleSample(100, END - 3000, 10.0),
                new ModuleSample(100, END - 1000, 10.0)));
        when(repository.loadSamples(eq(101), anyLong(), anyLong())).thenReturn(List.of(
                new ModuleSample(101, END - 3000, 4.0),
                new ModuleSample(101, END - 1000, 4.0)));
        renderer = new RrdCombinedSeriesRenderer(repository);
    }

    @Test
    void interpolatesLinearlyBetweenSamples() {
        IPlottable plottable = RrdCombinedSeriesRenderer.plottable(List.of(
                new ModuleSample(1, 1000, 0.0),
                new ModuleSample(1, 1100, 10.0)));

        assertEquals(5.0, plottable.getValue(1050), 1e-9);
        assertEquals(10.0, plottable.getValue(1100), 1e-9);
        assertTrue(Double.isNaN(plottable.getValue(999)));
    }

    @Test
    void duplicateTimestampsKeepTheLastValue() {
        IPlottable plottable = RrdCombinedSeriesRenderer.plottable(List.of(
                new ModuleSample(1, 1000, 1.0),
                new ModuleSample(1, 1000, 3.0),
                new ModuleSample(1, 2000, 3.0)));

        assertEquals(3.0, plottable.getValue(1500), 1e-9);
    }

    @Test
    void singleSampleHoldsFromItsTimestamp() {
        IPlottable plottable = RrdCombinedSeriesRenderer.plottable(List.of(new ModuleSample(1, 1000, 7.0)));

        assertTrue(Double.isNaN(plottable.getValue(999)));
        assertEquals(7.0, plottable.getValue(5000), 1e-9);
    }

    @Test
    void noSamplesMeansUnknown() {
        assertTrue(Double.isNaN(RrdCombinedSeriesRenderer.plottable(List.of()).getValue(1000)));
    }

    @Test
    void appliesWeightToEachSeries() throws Exception {
        RrdGraphDef def = renderer.graphDef(request(List.of(100, 101), List.of(2.0, 0.5), false, false), END);
        def.setLocale(Locale.US);
        def.print("avg0", "%.2f");
        def.print("max0", "%.2f");
        def.print("avg1", "%.2f");

        String[] lines = new RrdGraph(def).getRrdGraphInfo().getPrintLines();

        assertArrayEquals(new String[]{"20.00", "20.00", "2.00"}, lines);
    }

    @Test
    void queriesTheRequestedWindow() {
        renderer.graphDef(request(List.of(100), List.of(1.0), false, false), END);

        verify(repository).loadSamples(100, END - 3600, END);
    }

    @Test
    void rendersPng() {
        RenderModels.RenderedGraph rendered = renderer.renderCombined(request(List.of(100, 101), List.of(1.0, 1.0), true, true));

        assertEquals(RenderModels.PNG_CONTENT_TYPE, rendered.contentType());
        assertFalse(rendered.empty());
        byte[] png = rendered.content();
        assertEquals((byte) 0x89, png[0]);
        assertEquals('P', png[1]);
        assertEquals('N', png[2]);
        assertEquals('G', png[3]);
    }

    @Test
    void unknownModuleRendersWithoutData() {
        when(repository.loadSamples(eq(42), anyLong(), anyLong())).thenReturn(List.of());

        RenderModels.RenderedGraph rendered = renderer.renderCombined(request(List.of(42), List.of(1.0), false, false));

        assertTrue(rendered.content().length > 0);
    }

    private static CombinedGraphRequest request(List<Integer> moduleIds, List<Double> weights, boolean stacked, boolean decorated) {
        return new CombinedGraphRequest(moduleIds, weights, 3600, 400, 200,
                decorated ? "Load" : "", decorated ? "units" : "",
                decorated, decorated, false, stacked, END);
    }
}
