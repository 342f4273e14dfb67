/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.preset;

import java.util.List;

/** Built-in pattern recognizers. Raw labels resolve through the presidio vocabulary. */
public enum PatternType {
    PHONE_JP(
            "PHONE_NUMBER_JP",
            0.7,
            List.of("0\\d{1,4}-\\d{1,4}-\\d{4}", "(?<!\\d)0\\d{9,10}(?!\\d)", "\\+81-?\\d{1,4}-?\\d{1,4}-?\\d{4}"),
            List.of("TEL", "Tel", "tel", "電話", "携帯", "自宅")),
    PHONE_INTL(
            "PHONE_NUMBER",
            0.6,
            List.of("\\+1-?\\d{3}-?\\d{3}-?\\d{4}", "\\(\\d{3}\\)\\s?\\d{3}-\\d{4}"),
            List.of("phone", "Phone", "TEL", "Tel")),
    EMAIL(
            "EMAIL_ADDRESS",
            0.9,
            List.of("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}"),
            List.of("mail", "Mail", "メール")),
    ZIP_CODE_JP(
            "JP_ZIP_CODE",
            0.6,
            List.of("(?:〒\\s*)?(?<!\\d)\\d{3}-\\d{4}(?![\\d-])"),
            List.of("〒", "郵便番号", "郵便", "zip", "ZIP")),
    DATE_OF_BIRTH(
            "DATE_OF_BIRTH_JP",
            0.6,
            List.of(
                    "(?<!\\d)\\d{4}/\\d{1,2}/\\d{1,2}(?!\\d)",
                    "(?<!\\d)\\d{4}-\\d{1,2}-\\d{1,2}(?!\\d)",
                    "\\d{4}年\\d{1,2}月\\d{1,2}日",
                    "(?:令和|平成|昭和)\\d{1,2}年\\d{1,2}月\\d{1,2}日"),
            List.of("生年月日", "生まれ", "誕生日", "生年", "年月日")),
    AGE_JP("JP_AGE", 0.5, List.of("\\d{1,3}\\s*歳"), List.of("年齢")),
    GENDER_JP("JP_GENDER", 0.4, List.of("(?<=性別[:：]?\\s?)(?:男性|女性|男|女)"), List.of("性別"));

    private final String rawType;
    private final double score;
    private final List<String> regexes;
    private final List<String> contextWords;

    PatternType(String rawType, double score, List<String> regexes, List<String> contextWords) {
        this.rawType = rawType;
        this.score = score;
        this.regexes = regexes;
        this.contextWords = contextWords;
    }

    public String rawType() {
        return rawType;
    }

    public double score() {
        return score;
    }

    public List<String> regexes() {
        return regexes;
    }

    public List<String> contextWords() {
        return contextWords;
    }
}
