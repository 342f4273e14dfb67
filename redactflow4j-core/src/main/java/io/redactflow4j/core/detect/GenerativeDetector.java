/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.detect;

import io.redactflow4j.core.api.model.GenerativeTag;
import java.util.List;

/** A detector that only reports tagged values, in text order, without offsets. */
public interface GenerativeDetector {
    String name();

    List<GenerativeTag> tag(String text);
}
