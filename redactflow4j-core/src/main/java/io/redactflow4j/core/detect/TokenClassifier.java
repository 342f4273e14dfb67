/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.detect;

import io.redactflow4j.core.api.model.TokenLabel;
import java.util.List;

/** Runs a token-classification model over the text; one label per token, in order. */
@FunctionalInterface
public interface TokenClassifier {
    List<TokenLabel> classify(String text);
}
