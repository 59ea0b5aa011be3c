package com.monitoring.customgraph.graph;

import org.springframework.context.MessageSource;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Service
public class GraphPeriodService {
    private final MessageSource messageSource;

    public GraphPeriodService(MessageSource messageSource) {
        this.messageSource = messageSource;
    }

    public Map<Integer, String> listStandardPeriods(Locale locale) {
        Map<Integer, String> periods = new LinkedHashMap<>();
        for (StandardPeriod period : StandardPeriod.values()) {
            periods.put(period.hours(), messageSource.getMessage(period.messageKey(), period.messageArgs(), locale));
        }
        return periods;
    }
}
