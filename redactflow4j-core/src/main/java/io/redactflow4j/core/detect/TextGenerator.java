/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.detect;

/** Runs a text-to-text model that rewrites its input with inline PII tags. */
@FunctionalInterface
public interface TextGenerator {
    String generate(String text);
}
