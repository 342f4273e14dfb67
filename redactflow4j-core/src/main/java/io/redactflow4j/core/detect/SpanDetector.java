/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.detect;

import io.redactflow4j.core.api.model.DetectorSource;
import io.redactflow4j.core.api.model.RawCandidate;
import java.util.List;

/** A detector that reports offset-carrying candidates directly. */
public interface SpanDetector {
    String name();

    DetectorSource source();

    List<RawCandidate> detect(String text);
}
