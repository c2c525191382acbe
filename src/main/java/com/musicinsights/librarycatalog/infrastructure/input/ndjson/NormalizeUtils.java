package com.musicinsights.librarycatalog.infrastructure.input.ndjson;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * 시드 적재 과정에서 사용하는 "정규화/파싱" 유틸리티입니다.
 */
public final class NormalizeUtils {
    private NormalizeUtils() {}

    /**
     * 문자열을 정규화합니다.
     * <p>
     * trim 후 빈 문자열이면 null을 반환합니다.
     *
     * @param s 원본 문자열
     * @return 정규화된 문자열 또는 null
     */
    public static String norm(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    /**
     * 문자열 목록의 각 항목을 {@link #norm(String)}으로 정규화합니다.
     * <p>
     * 빈 항목은 null로 남겨 적재 단계에서 거절되도록 합니다.
     *
     * @param values 원본 목록
     * @return 정규화된 목록(입력이 null이면 빈 목록)
     */
    public static List<String> normAll(List<String> values) {
        if (values == null) return List.of();
        List<String> out = new ArrayList<>(values.size());
        for (String v : values) out.add(norm(v));
        return out;
    }

    /**
     * ISO-8601 날짜 문자열(yyyy-MM-dd)을 {@link LocalDate}로 파싱합니다.
     * <p>
     * 빈 값이거나 형식이 맞지 않으면 null을 반환합니다.
     *
     * @param s 날짜 문자열 (예: "2008-10-01")
     * @return 파싱된 LocalDate 또는 null
     */
    public static LocalDate parseDateOrNull(String s) {
        String t = norm(s);
        if (t == null) return null;
        try {
            return LocalDate.parse(t);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
