/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.spring;

import io.redactflow4j.core.api.model.CanonicalType;
import io.redactflow4j.core.api.model.DetectorSource;
import io.redactflow4j.core.preset.PatternType;
import java.time.Duration;
import java.util.*;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@ConfigurationProperties(prefix = "redactflow4j")
public class RedactflowProperties {

    @Setter
    private boolean enabled = false;

    /** Keep only candidates confirmed by a primary and a secondary detector. */
    @Setter
    private boolean strict = false;

    @Setter
    private double overlapThreshold = 0.5;

    @Setter
    private double noiseContentRatio = 0.5;

    @Setter
    private Duration detectorTimeout = Duration.ofSeconds(30);

    @Setter
    private int recentDiscards = 200;

    private List<PatternType> patterns = new ArrayList<>();
    private List<CanonicalType> typePriority = new ArrayList<>();
    private Map<DetectorSource, Map<String, CanonicalType>> labels = new EnumMap<>(DetectorSource.class);
    private Recovery recovery = new Recovery();
    private Consensus consensus = new Consensus();
    private Allowlist allowlist = new Allowlist();
    private Masks masks = new Masks();

    public List<PatternType> getPatterns() {
        return Collections.unmodifiableList(patterns);
    }

    public void setPatterns(List<PatternType> v) {
        this.patterns = new ArrayList<>(Objects.requireNonNullElse(v, List.of()));
    }

    public List<CanonicalType> getTypePriority() {
        return Collections.unmodifiableList(typePriority);
    }

    public void setTypePriority(List<CanonicalType> v) {
        this.typePriority = new ArrayList<>(Objects.requireNonNullElse(v, List.of()));
    }

    /** Extra raw label mappings per detector source, merged over the built-in vocabularies. */
    public Map<DetectorSource, Map<String, CanonicalType>> getLabels() {
        return Collections.unmodifiableMap(labels);
    }

    public void setLabels(Map<DetectorSource, Map<String, CanonicalType>> v) {
        this.labels = new EnumMap<>(DetectorSource.class);
        if (v != null) this.labels.putAll(v);
    }

    public void setRecovery(Recovery r) {
        this.recovery = (r == null) ? new Recovery() : r;
    }

    public void setConsensus(Consensus c) {
        this.consensus = (c == null) ? new Consensus() : c;
    }

    public void setAllowlist(Allowlist a) {
        this.allowlist = (a == null) ? new Allowlist() : a;
    }

    public void setMasks(Masks m) {
        this.masks = (m == null) ? new Masks() : m;
    }

    // ---- nested: recovery ----
    @Getter
    @Setter
    public static final class Recovery {
        private double lengthTolerance = 0.3;
        private int anchorLength = 8;
        private double minSimilarity = 0.6;
        private double baseScore = 0.85;
        private int searchWindow = 700;
        private int defaultMaxSpan = 120;
    }

    // ---- nested: consensus ----
    public static final class Consensus {
        private Set<DetectorSource> primarySources = EnumSet.of(DetectorSource.PATTERN);
        private Set<CanonicalType> exemptTypes = new HashSet<>();

        public Set<DetectorSource> getPrimarySources() {
            return Collections.unmodifiableSet(primarySources);
        }

        public void setPrimarySources(Set<DetectorSource> v) {
            this.primarySources = new HashSet<>(Objects.requireNonNullElse(v, Set.of()));
        }

        public Set<CanonicalType> getExemptTypes() {
            return Collections.unmodifiableSet(exemptTypes);
        }

        public void setExemptTypes(Set<CanonicalType> v) {
            this.exemptTypes = new HashSet<>(Objects.requireNonNullElse(v, Set.of()));
        }
    }

    // ---- nested: allowlist ----
    public static final class Allowlist {
        private List<String> terms = new ArrayList<>();
        private List<String> dictionaries = new ArrayList<>();

        public List<String> getTerms() {
            return Collections.unmodifiableList(terms);
        }

        public void setTerms(List<String> v) {
            this.terms = new ArrayList<>(Objects.requireNonNullElse(v, List.of()));
        }

        /** Dictionary file paths, one term per line. */
        public List<String> getDictionaries() {
            return Collections.unmodifiableList(dictionaries);
        }

        public void setDictionaries(List<String> v) {
            this.dictionaries = new ArrayList<>(Objects.requireNonNullElse(v, List.of()));
        }
    }

    // ---- nested: masks ----
    public static final class Masks {
        @Getter
        @Setter
        private String defaultMask = "****";

        private Map<CanonicalType, String> byType = new EnumMap<>(CanonicalType.class);

        public Map<CanonicalType, String> getByType() {
            return Collections.unmodifiableMap(byType);
        }

        public void setByType(Map<CanonicalType, String> v) {
            this.byType = new EnumMap<>(CanonicalType.class);
            if (v != null) this.byType.putAll(v);
        }
    }
}
