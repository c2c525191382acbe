package com.musicinsights.librarycatalog.infrastructure.input.ndjson;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link NormalizeUtils} 단위 테스트.
 */
@DisplayName("정규화 util 테스트")
class NormalizeUtilsTest {

    @DisplayName("norm은 trim하고 빈 문자열이면 null을 반환")
    @Test
    void norm_trims_andBlankToNull() {
        assertNull(NormalizeUtils.norm(null));
        assertNull(NormalizeUtils.norm(""));
        assertNull(NormalizeUtils.norm("   "));
        assertEquals("Pop", NormalizeUtils.norm("  Pop "));
    }

    @DisplayName("normAll은 null 입력에 빈 리스트, 빈 항목은 null로 남긴다")
    @Test
    void normAll_keepsBlankEntriesAsNull() {
        assertEquals(List.of(), NormalizeUtils.normAll(null));
        assertEquals(Arrays.asList("Rock", null, "Blues"), NormalizeUtils.normAll(List.of(" Rock", " ", "Blues ")));
    }

    @DisplayName("parseDateOrNull yyyy-MM-dd 형식의 유효한 날짜를 LocalDate로 파싱 검증")
    @Test
    void parseDateOrNull_validDate_parses() {
        assertEquals(LocalDate.of(2008, 10, 1), NormalizeUtils.parseDateOrNull(" 2008-10-01 "));
    }

    @DisplayName("parseDateOrNull 빈 값이나 잘못된 형식이면 null 반환 검증")
    @Test
    void parseDateOrNull_invalid_returnsNull() {
        assertNull(NormalizeUtils.parseDateOrNull(null));
        assertNull(NormalizeUtils.parseDateOrNull(""));
        assertNull(NormalizeUtils.parseDateOrNull("2008/10/01"));
        assertNull(NormalizeUtils.parseDateOrNull("2008-02-30"));
    }
}
