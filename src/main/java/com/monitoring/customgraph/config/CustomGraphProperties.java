package com.monitoring.customgraph.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "custom-graphs")
public record CustomGraphProperties(@DefaultValue("IR") String defaultPrivileges,
                                    @DefaultValue("false") boolean batchSourceCounts,
                                    @DefaultValue Render render) {

    public record Render(@DefaultValue("300") int defaultWidth,
                         @DefaultValue("200") int defaultHeight,
                         @DefaultValue("86400") long defaultPeriodSeconds) {}
}
