package com.monitoring.customgraph.api;

import com.monitoring.customgraph.config.CustomGraphProperties;
import com.monitoring.customgraph.graph.CustomGraphCatalogService;
import com.monitoring.customgraph.graph.CustomGraphModels.RenderRequest;
import com.monitoring.customgraph.graph.CustomGraphRenderService;
import com.monitoring.customgraph.graph.GraphPeriodService;
import com.monitoring.customgraph.render.RenderModels.RenderedGraph;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/custom-graphs")
public class CustomGraphController {
    static final String USER_HEADER = "X-User-Id";

    private final CustomGraphCatalogService catalogService;
    private final CustomGraphRenderService renderService;
    private final GraphPeriodService periodService;
    private final CustomGraphProperties properties;

    public CustomGraphController(CustomGraphCatalogService catalogService,
                                 CustomGraphRenderService renderService,
                                 GraphPeriodService periodService,
                                 CustomGraphProperties properties) {
        this.catalogService = catalogService;
        this.renderService = renderService;
        this.periodService = periodService;
        this.properties = properties;
    }

    @GetMapping
    public ResponseEntity<Map<Integer, ?>> list(@RequestParam(required = false) String userId,
                                                @RequestHeader(value = USER_HEADER, required = false) String sessionUserId,
                                                @RequestParam(defaultValue = "false") boolean namesOnly,
                                                @RequestParam(defaultValue = "true") boolean includeAllGroup,
                                                @RequestParam(required = false) String privileges) {
        String user = resolveUser(userId, sessionUserId);
        if (namesOnly) {
            return ResponseEntity.ok(catalogService.visibleGraphNames(user, includeAllGroup, privileges));
        }
        return ResponseEntity.ok(catalogService.listVisibleGraphs(user, false, includeAllGroup, privileges));
    }

    @GetMapping("/periods")
    public ResponseEntity<Map<Integer, String>> periods(Locale locale) {
        return ResponseEntity.ok(periodService.listStandardPeriods(locale));
    }

    @GetMapping("/{graphId}/render")
    public ResponseEntity<RenderedGraph> render(@PathVariable int graphId,
                                                @RequestParam(required = false) Integer height,
                                                @RequestParam(required = false) Integer width,
                                                @RequestParam(required = false) Long period,
                                                @RequestParam(defaultValue = "false") boolean stacked,
                                                @RequestParam(defaultValue = "0") long date,
                                                Locale locale) {
        return ResponseEntity.ok(renderService.renderGraph(toRequest(graphId, height, width, period, stacked, date), locale));
    }

    @GetMapping("/{graphId}/image")
    public void image(@PathVariable int graphId,
                      @RequestParam(required = false) Integer height,
                      @RequestParam(required = false) Integer width,
                      @RequestParam(required = false) Long period,
                      @RequestParam(defaultValue = "false") boolean stacked,
                      @RequestParam(defaultValue = "0") long date,
                      Locale locale,
                      HttpServletResponse response) throws IOException {
        RenderRequest request = toRequest(graphId, height, width, period, stacked, date);
        renderService.renderGraphTo(request, locale, contentType -> {
            response.setContentType(contentType);
            return response.getOutputStream();
        });
    }

    private RenderRequest toRequest(int graphId, Integer height, Integer width, Long period, boolean stacked, long date) {
        CustomGraphProperties.Render defaults = properties.render();
        return new RenderRequest(graphId,
                height == null ? defaults.defaultHeight() : height,
                width == null ? defaults.defaultWidth() : width,
                period == null ? defaults.defaultPeriodSeconds() : period,
                stacked,
                date);
    }

    private static String resolveUser(String userId, String sessionUserId) {
        return userId != null && !userId.isBlank() ? userId : sessionUserId;
    }
}
