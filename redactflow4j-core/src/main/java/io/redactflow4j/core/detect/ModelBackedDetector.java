/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.detect;

import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds a heavy model behind a ready flag. The model is loaded once, on first use or on
 * {@link #warmUp()}, and released on {@link #close()}. After close the next use loads it again.
 *
 * @param <M> model handle type
 */
public abstract class ModelBackedDetector<M> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ModelBackedDetector.class);

    private final String name;
    private final Supplier<? extends M> loader;
    private final Object lock = new Object();
    private volatile M model;

    protected ModelBackedDetector(String name, Supplier<? extends M> loader) {
        this.name = Objects.requireNonNull(name, "name");
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    public String name() {
        return name;
    }

    public boolean isReady() {
        return model != null;
    }

    public void warmUp() {
        model();
    }

    protected M model() {
        M m = model;
        if (m != null) return m;
        synchronized (lock) {
            if (model == null) {
                long t0 = System.nanoTime();
                M loaded = loader.get();
                if (loaded == null) throw new IllegalStateException("Model loader for " + name + " returned null");
                model = loaded;
                log.info("Loaded model for detector '{}' in {} ms", name, (System.nanoTime() - t0) / 1_000_000);
            }
            return model;
        }
    }

    @Override
    public void close() {
        M m;
        synchronized (lock) {
            m = model;
            model = null;
        }
        if (m == null) return;
        release(m);
        log.debug("Released model for detector '{}'", name);
    }

    /** Frees the model. Default closes it if it is {@link AutoCloseable}. */
    protected void release(M m) {
        if (m instanceof AutoCloseable) {
            try {
                ((AutoCloseable) m).close();
            } catch (Exception e) {
                log.warn("Failed to release model for detector '{}': {}", name, e.toString());
            }
        }
    }
}
