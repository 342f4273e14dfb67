/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.service;

import io.redactflow4j.core.api.DetectorOutputs;
import io.redactflow4j.core.api.ReconciliationPipeline;
import io.redactflow4j.core.api.ReconciliationResult;
import io.redactflow4j.core.api.model.GenerativeTag;
import io.redactflow4j.core.api.model.RawCandidate;
import io.redactflow4j.core.detect.GenerativeDetector;
import io.redactflow4j.core.detect.SpanDetector;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs all detectors on the injected executor and hands their outputs to the pipeline.
 *
 * <p>A detector that throws or does not answer within {@code timeout} contributes an empty list.
 * Outputs are collected in registration order, independent of completion order. The executor is
 * owned by the caller.
 */
public final class DetectionService {
    private static final Logger log = LoggerFactory.getLogger(DetectionService.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final List<SpanDetector> detectors;
    private final GenerativeDetector generative;
    private final ReconciliationPipeline pipeline;
    private final ExecutorService executor;
    private final Duration timeout;

    public DetectionService(
            List<SpanDetector> detectors,
            GenerativeDetector generative,
            ReconciliationPipeline pipeline,
            ExecutorService executor,
            Duration timeout) {
        this.detectors = List.copyOf(Objects.requireNonNull(detectors, "detectors"));
        this.generative = generative;
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        if (this.timeout.isNegative() || this.timeout.isZero())
            throw new IllegalArgumentException("timeout must be positive: " + this.timeout);
    }

    /** Detects and reconciles in one go. */
    public ReconciliationResult process(String text) {
        Objects.requireNonNull(text, "text");
        return pipeline.reconcile(text, collect(text));
    }

    /**
     * Raw detector outputs for {@code text}; never throws because of a detector. All detectors share
     * one deadline, and those still running when it passes are cancelled with an interrupt.
     */
    public DetectorOutputs collect(String text) {
        Objects.requireNonNull(text, "text");
        if (text.isEmpty()) return DetectorOutputs.empty();

        List<Future<List<RawCandidate>>> spans = new ArrayList<>(detectors.size());
        for (SpanDetector d : detectors) spans.add(submit(() -> d.detect(text)));
        Future<List<GenerativeTag>> tags = generative == null ? null : submit(() -> generative.tag(text));

        long deadline = System.nanoTime() + timeout.toNanos();
        List<RawCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < spans.size(); i++) {
            candidates.addAll(await(spans.get(i), detectors.get(i).name(), deadline));
        }
        List<GenerativeTag> generated = tags == null ? List.of() : await(tags, generative.name(), deadline);
        return new DetectorOutputs(candidates, generated);
    }

    private <T> Future<List<T>> submit(Callable<List<T>> task) {
        try {
            return executor.submit(task);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private <T> List<T> await(Future<List<T>> future, String name, long deadline) {
        try {
            long remaining = Math.max(0L, deadline - System.nanoTime());
            List<T> out = future.get(remaining, TimeUnit.NANOSECONDS);
            return out == null ? List.of() : out;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Detector '{}' timed out after {} ms, using empty result", name, timeout.toMillis());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("Detector '{}' failed, using empty result: {}", name, cause.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("Interrupted while waiting for detector '{}'", name);
        } catch (CancellationException e) {
            log.warn("Detector '{}' was cancelled, using empty result", name);
        }
        return List.of();
    }

    public List<SpanDetector> detectors() {
        return detectors;
    }

    public ReconciliationPipeline pipeline() {
        return pipeline;
    }
}
