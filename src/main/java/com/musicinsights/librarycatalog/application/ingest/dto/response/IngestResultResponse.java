package com.musicinsights.librarycatalog.application.ingest.dto.response;

import com.musicinsights.librarycatalog.application.ingest.outcome.IngestReport;

import java.util.ArrayList;
import java.util.List;

/**
 * 배치 적재 API 응답.
 *
 * @param requested 요청 아이템 수
 * @param accepted  저장된 아이템 수
 * @param rejects   저장되지 않은 아이템 키 목록
 * @param <K>       키 타입
 */
public record IngestResultResponse<K>(
        int requested,
        int accepted,
        List<K> rejects
) {
    public static <K> IngestResultResponse<K> from(IngestReport<K> report) {
        return new IngestResultResponse<>(
                report.requested(),
                report.acceptedCount(),
                new ArrayList<>(report.rejects())
        );
    }
}
