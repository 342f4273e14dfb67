/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.spring.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.redactflow4j.core.api.ReconciliationPipeline;
import io.redactflow4j.core.api.model.CanonicalType;
import io.redactflow4j.core.api.model.DetectorSource;
import io.redactflow4j.core.detect.BioSpanDecoder;
import io.redactflow4j.core.detect.GenerativeDetector;
import io.redactflow4j.core.detect.SpanDetector;
import io.redactflow4j.core.filter.AllowList;
import io.redactflow4j.core.normalize.TypeMapping;
import io.redactflow4j.core.normalize.TypeNormalizer;
import io.redactflow4j.core.preset.PatternRegistry;
import io.redactflow4j.core.preset.ReconciliationConfig;
import io.redactflow4j.core.redact.MaskConfig;
import io.redactflow4j.core.redact.Redactor;
import io.redactflow4j.core.report.CompositeSink;
import io.redactflow4j.core.report.DiscardSink;
import io.redactflow4j.core.report.LoggingSink;
import io.redactflow4j.core.service.DetectionService;
import io.redactflow4j.spring.MicrometerDiscardSink;
import io.redactflow4j.spring.RedactflowEndpoint;
import io.redactflow4j.spring.RedactflowProperties;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.autoconfigure.endpoint.condition.ConditionalOnAvailableEndpoint;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.*;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@Slf4j
@AutoConfiguration(
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableConfigurationProperties(RedactflowProperties.class)
@ConditionalOnProperty(prefix = "redactflow4j", name = "enabled", havingValue = "true")
public class RedactflowAutoConfiguration {

    public static final String EXECUTOR_BEAN = "redactflowDetectorExecutor";

    @Bean
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnMissingBean(MicrometerDiscardSink.class)
    public MicrometerDiscardSink micrometerDiscardSink(MeterRegistry registry, RedactflowProperties props) {
        return new MicrometerDiscardSink(registry, props.getRecentDiscards());
    }

    @Bean
    @ConditionalOnMissingBean(DiscardSink.class)
    public DiscardSink discardSink(ObjectProvider<MicrometerDiscardSink> micrometer) {
        List<DiscardSink> sinks = new ArrayList<>();
        sinks.add(new LoggingSink());
        micrometer.ifAvailable(sinks::add);
        return new CompositeSink(sinks);
    }

    @Bean
    @ConditionalOnMissingBean
    public ReconciliationConfig reconciliationConfig(RedactflowProperties props) {
        TypeMapping mapping = TypeMapping.defaults();
        for (Map.Entry<DetectorSource, Map<String, CanonicalType>> e : props.getLabels().entrySet()) {
            mapping = mapping.withLabels(e.getKey(), e.getValue());
        }

        AllowList allow = AllowList.of(props.getAllowlist().getTerms());
        for (String path : props.getAllowlist().getDictionaries()) {
            List<String> terms = AllowList.readDictionary(Path.of(path));
            log.info("[Redactflow4J] Loaded {} allow-list terms from {}", terms.size(), path);
            allow = allow.plus(terms);
        }

        var recovery = props.getRecovery();
        var builder = ReconciliationConfig.defaults().toBuilder()
                .typeMapping(mapping)
                .strict(props.isStrict())
                .overlapThreshold(props.getOverlapThreshold())
                .noiseContentRatio(props.getNoiseContentRatio())
                .lengthTolerance(recovery.getLengthTolerance())
                .anchorLength(recovery.getAnchorLength())
                .minSimilarity(recovery.getMinSimilarity())
                .generativeBaseScore(recovery.getBaseScore())
                .searchWindow(recovery.getSearchWindow())
                .defaultMaxSpan(recovery.getDefaultMaxSpan())
                .primarySources(props.getConsensus().getPrimarySources())
                .consensusExemptTypes(props.getConsensus().getExemptTypes())
                .allowList(allow);
        if (!props.getTypePriority().isEmpty()) builder.typePriority(props.getTypePriority());
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public ReconciliationPipeline reconciliationPipeline(ReconciliationConfig config, DiscardSink sink) {
        log.info("[Redactflow4J] Reconciliation pipeline ready (strict={})", config.strict());
        return new ReconciliationPipeline(config, sink);
    }

    @Bean
    @ConditionalOnMissingBean
    public BioSpanDecoder bioSpanDecoder(ReconciliationPipeline pipeline) {
        return new BioSpanDecoder(pipeline.normalizer());
    }

    @Bean
    @ConditionalOnMissingBean
    public TypeNormalizer typeNormalizer(ReconciliationPipeline pipeline) {
        return pipeline.normalizer();
    }

    @Bean
    @ConditionalOnMissingBean
    public Redactor redactor(RedactflowProperties props) {
        var masks = props.getMasks();
        return new Redactor(new MaskConfig(masks.getDefaultMask(), masks.getByType()));
    }

    @Bean(name = EXECUTOR_BEAN, destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = EXECUTOR_BEAN)
    public ExecutorService redactflowDetectorExecutor() {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "redactflow-detector-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    @ConditionalOnMissingBean
    public DetectionService detectionService(
            RedactflowProperties props,
            ReconciliationPipeline pipeline,
            ObjectProvider<SpanDetector> customDetectors,
            ObjectProvider<GenerativeDetector> generative,
            @Qualifier(EXECUTOR_BEAN) ExecutorService executor) {
        List<SpanDetector> detectors = new ArrayList<>(new PatternRegistry().build(props.getPatterns()));
        customDetectors.orderedStream().forEach(detectors::add);
        GenerativeDetector gen = generative.getIfUnique();
        log.info(
                "[Redactflow4J] Detection service with {} span detector(s){}",
                detectors.size(),
                gen == null ? "" : " and generative detector '" + gen.name() + "'");
        return new DetectionService(detectors, gen, pipeline, executor, props.getDetectorTimeout());
    }

    @Bean
    @ConditionalOnBean(MicrometerDiscardSink.class)
    @ConditionalOnAvailableEndpoint(endpoint = RedactflowEndpoint.class)
    public RedactflowEndpoint redactflowEndpoint(MicrometerDiscardSink sink, ReconciliationPipeline pipeline) {
        return new RedactflowEndpoint(sink, pipeline);
    }
}
