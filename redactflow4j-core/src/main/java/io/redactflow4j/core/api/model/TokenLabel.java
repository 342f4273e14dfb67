/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api.model;

/** Per-token NER prediction. Special tokens ([CLS], [SEP], padding) have start == end. */
public record TokenLabel(int start, int end, String label, double score) {

    public boolean isSpecial() {
        return start == end;
    }
}
