package com.musicinsights.librarycatalog.application.ingest.outcome;

import org.springframework.dao.DataIntegrityViolationException;

/**
 * 적재 아이템이 거절된 이유.
 *
 * <p>반환되는 reject 집합은 이유를 구분하지 않지만, 로그와 테스트에서는 이 값으로 원인을 판별한다.</p>
 */
public enum RejectReason {

    /** 입력 검증 실패(빈 장르 목록, 범위 밖 평점 등). DB는 변경되지 않는다. */
    INVALID,

    /** 참조 대상 없음(존재하지 않는 사용자/곡). */
    NOT_FOUND,

    /** 유일성 충돌(선검사 또는 DB 제약 위반). */
    CONFLICT,

    /** 그 밖의 예상하지 못한 저장소 오류. */
    STORE_FAILURE;

    /**
     * 저장소 예외를 거절 이유로 분류한다.
     *
     * @param error 아이템 처리 중 발생한 예외
     * @return 무결성 제약 위반이면 {@link #CONFLICT}, 그 외는 {@link #STORE_FAILURE}
     */
    public static RejectReason classify(Throwable error) {
        return (error instanceof DataIntegrityViolationException) ? CONFLICT : STORE_FAILURE;
    }
}
