package com.monitoring.customgraph.graph;

import com.monitoring.customgraph.domain.DomainModels.GraphSource;
import com.monitoring.customgraph.graph.CustomGraphModels.RenderRequest;
import com.monitoring.customgraph.render.CombinedSeriesRenderer;
import com.monitoring.customgraph.render.RenderModels;
import com.monitoring.customgraph.render.RenderModels.CombinedGraphRequest;
import com.monitoring.customgraph.render.RenderModels.RenderedGraph;
import com.monitoring.customgraph.repository.CustomGraphJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.MessageSource;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;
import org.springframework.web.util.HtmlUtils;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

@Service
public class CustomGraphRenderService {
    private static final Logger log = LoggerFactory.getLogger(CustomGraphRenderService.class);

    private final CustomGraphJdbcRepository repository;
    private final CombinedSeriesRenderer renderer;
    private final MessageSource messageSource;

    public CustomGraphRenderService(CustomGraphJdbcRepository repository,
                                    CombinedSeriesRenderer renderer,
                                    MessageSource messageSource) {
        this.repository = repository;
        this.renderer = renderer;
        this.messageSource = messageSource;
    }

    public RenderedGraph renderGraph(RenderRequest request, Locale locale) {
        validate(request);

        List<GraphSource> sources = repository.findSources(request.graphId());
        if (sources.isEmpty()) {
            log.debug("Custom graph {} has no sources", request.graphId());
            return emptyGraph(locale);
        }

        List<Integer> moduleIds = sources.stream().map(GraphSource::moduleId).toList();
        List<Double> weights = sources.stream().map(GraphSource::weight).toList();

        return renderer.renderCombined(new CombinedGraphRequest(
                moduleIds, weights,
                request.periodSeconds(), request.width(), request.height(),
                "", "", false, false, false,
                request.stacked(), request.startDate()));
    }

    public void renderGraphTo(RenderRequest request, Locale locale, RenderTarget target) throws IOException {
        RenderedGraph rendered = renderGraph(request, locale);
        OutputStream out = target.open(rendered.contentType());
        out.write(rendered.content());
        out.flush();
    }

    private RenderedGraph emptyGraph(Locale locale) {
        String notice = messageSource.getMessage("graph.empty", null, "Empty graph", locale);
        return new RenderedGraph(RenderModels.HTML_CONTENT_TYPE,
                ("<div class='nf'>" + HtmlUtils.htmlEscape(notice, "UTF-8") + "</div>").getBytes(StandardCharsets.UTF_8),
                true);
    }

    private static void validate(RenderRequest request) {
        Assert.isTrue(request.height() > 0, "height must be positive");
        Assert.isTrue(request.width() > 0, "width must be positive");
        Assert.isTrue(request.periodSeconds() > 0, "period must be positive");
        Assert.isTrue(request.startDate() >= 0, "date must not be negative");
    }
}
