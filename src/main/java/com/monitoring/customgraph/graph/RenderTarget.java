package com.monitoring.customgraph.graph;

import java.io.IOException;
import java.io.OutputStream;

@FunctionalInterface
public interface RenderTarget {
    OutputStream open(String contentType) throws IOException;
}
