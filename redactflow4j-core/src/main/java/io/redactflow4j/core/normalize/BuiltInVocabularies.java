/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.normalize;

import static io.redactflow4j.core.api.model.CanonicalType.*;

import io.redactflow4j.core.api.model.CanonicalType;
import java.util.LinkedHashMap;
import java.util.Map;

/** Label tables of the detectors the library ships presets for. */
public final class BuiltInVocabularies {
    private BuiltInVocabularies() {}

    /** Pattern recognizer labels (Presidio-style entity names). */
    public static final LabelVocabulary PRESIDIO = LabelVocabulary.of("presidio", table(
            "PERSON", PERSON,
            "JP_PERSON", PERSON,
            "LOCATION", LOCATION,
            "JP_ADDRESS", LOCATION,
            "ORGANIZATION", ORGANIZATION,
            "JP_ORGANIZATION", ORGANIZATION,
            "PHONE_NUMBER", PHONE,
            "PHONE_NUMBER_JP", PHONE,
            "EMAIL_ADDRESS", EMAIL,
            "JP_ZIP_CODE", ZIP_CODE,
            "US_ZIP_CODE", ZIP_CODE,
            "DATE_OF_BIRTH_JP", DATE_OF_BIRTH,
            "DATE", DATE_OF_BIRTH,
            "JP_AGE", AGE,
            "JP_GENDER", GENDER,
            "CUSTOMER_ID_JP", CUSTOMER_ID));

    /** CoNLL-2003 style token labels (after BIO stripping). */
    public static final LabelVocabulary CONLL = LabelVocabulary.of("conll", table(
            "PER", PERSON,
            "LOC", LOCATION,
            "ORG", ORGANIZATION,
            "MISC", UNKNOWN));

    /** Non-BIO labels of Japanese NER models. */
    public static final LabelVocabulary JA_NER = LabelVocabulary.of("ja-ner", table(
            "人名", PERSON,
            "地名", LOCATION,
            "施設名", LOCATION,
            "法人名", ORGANIZATION,
            "政治的組織名", ORGANIZATION,
            "その他の組織名", ORGANIZATION));

    /** Fixed tag set of the generative PII masking model. */
    public static final LabelVocabulary PII_MASKER = LabelVocabulary.of("pii-masker", table(
            "<name>", PERSON,
            "<birthday>", DATE_OF_BIRTH,
            "<phone-number>", PHONE,
            "<mail-address>", EMAIL,
            "<customer-id>", CUSTOMER_ID,
            "<address>", LOCATION,
            "<post-code>", ZIP_CODE,
            "<company>", ORGANIZATION));

    private static Map<String, CanonicalType> table(Object... kv) {
        Map<String, CanonicalType> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) m.put((String) kv[i], (CanonicalType) kv[i + 1]);
        return m;
    }
}
