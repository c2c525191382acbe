package com.musicinsights.librarycatalog.application.ingest.outcome;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 배치 적재 결과.
 *
 * <p>입력 순서대로 아이템별 결과를 보관하며, 저장된 아이템과 거절된 아이템의 합은 항상 입력 배치와 같다.</p>
 *
 * @param outcomes 아이템별 결과(입력 순서)
 * @param <K>      키 타입
 */
public record IngestReport<K>(List<ItemOutcome<K>> outcomes) {

    public IngestReport {
        outcomes = List.copyOf(outcomes);
    }

    public int requested() {
        return outcomes.size();
    }

    public int acceptedCount() {
        return (int) outcomes.stream().filter(ItemOutcome::isAccepted).count();
    }

    /**
     * @return 저장되지 않은 아이템 키 집합(입력 순서 유지)
     */
    public Set<K> rejects() {
        return outcomes.stream()
                .filter(o -> !o.isAccepted())
                .map(ItemOutcome::key)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * @param reason 거절 이유
     * @return 해당 이유로 거절된 키 집합
     */
    public Set<K> rejects(RejectReason reason) {
        return outcomes.stream()
                .filter(o -> o.reason() == reason)
                .map(ItemOutcome::key)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
