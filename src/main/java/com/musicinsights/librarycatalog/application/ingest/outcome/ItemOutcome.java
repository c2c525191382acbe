package com.musicinsights.librarycatalog.application.ingest.outcome;

/**
 * 적재 아이템 1건의 처리 결과.
 *
 * @param key    아이템 식별 키(reject 집합에 들어가는 값)
 * @param reason 거절 이유, 저장에 성공했으면 null
 * @param <K>    키 타입
 */
public record ItemOutcome<K>(K key, RejectReason reason) {

    public static <K> ItemOutcome<K> accepted(K key) {
        return new ItemOutcome<>(key, null);
    }

    public static <K> ItemOutcome<K> rejected(K key, RejectReason reason) {
        return new ItemOutcome<>(key, reason);
    }

    public boolean isAccepted() {
        return reason == null;
    }
}
