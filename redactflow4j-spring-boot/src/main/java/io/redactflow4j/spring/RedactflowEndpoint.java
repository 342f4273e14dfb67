/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.spring;

import io.redactflow4j.core.api.ReconciliationPipeline;
import java.util.HashMap;
import java.util.Map;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;

@Endpoint(id = "redactflow")
public class RedactflowEndpoint {

    private final MicrometerDiscardSink sink;
    private final ReconciliationPipeline pipeline;

    public RedactflowEndpoint(MicrometerDiscardSink sink, ReconciliationPipeline pipeline) {
        this.sink = sink;
        this.pipeline = pipeline;
    }

    @ReadOperation
    public Map<String, Object> info() {
        Map<String, Object> m = new HashMap<>();
        m.put("status", "OK");
        m.put("strict", pipeline.config().strict());
        m.put("typePriority", pipeline.config().typePriority());
        m.put("recentDiscards", sink.recentDiscards());
        return m;
    }
}
