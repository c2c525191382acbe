package com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc;

import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Mono;

/**
 * R2DBC 기반 Repository 공통 베이스 클래스입니다.
 * <p>
 * 자동 생성 키 조회, 존재 여부 조회, null-safe 바인딩 편의 메서드를 제공합니다.
 * 트랜잭션 안에서 호출되면 모든 구문은 해당 트랜잭션의 커넥션에서 실행됩니다.
 */
public abstract class SqlSupport {

    /** 자동 생성 PK 컬럼 이름 */
    protected static final String ID_COLUMN = "id";

    /** R2DBC SQL 실행을 위한 DatabaseClient */
    protected final DatabaseClient db;

    /**
     * @param db R2DBC DatabaseClient
     */
    protected SqlSupport(DatabaseClient db) {
        this.db = db;
    }

    /**
     * INSERT 구문을 실행하고 새로 발급된 surrogate id를 반환합니다.
     *
     * @param spec 바인딩이 끝난 INSERT spec
     * @return 생성된 id
     */
    protected Mono<Long> insertReturningId(DatabaseClient.GenericExecuteSpec spec) {
        return spec.filter(statement -> statement.returnGeneratedValues(ID_COLUMN))
                .map((row, meta) -> row.get(0, Number.class).longValue())
                .one()
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("No generated key returned")));
    }

    /**
     * 조회 결과가 한 행이라도 있으면 true, 없으면 false를 반환합니다.
     *
     * @param spec {@code SELECT 1 ...} 형태의 spec
     * @return 존재 여부
     */
    protected Mono<Boolean> exists(DatabaseClient.GenericExecuteSpec spec) {
        return spec.map((row, meta) -> true)
                .first()
                .defaultIfEmpty(false);
    }

    /**
     * 첫 번째 행의 {@code id} 컬럼을 반환합니다. 행이 없으면 empty.
     *
     * @param spec {@code SELECT id ...} 형태의 spec
     * @return id 또는 empty
     */
    protected Mono<Long> firstId(DatabaseClient.GenericExecuteSpec spec) {
        return spec.map((row, meta) -> row.get(ID_COLUMN, Number.class).longValue())
                .first();
    }

    /**
     * 값이 null인 경우 {@code bindNull}, 아니면 {@code bind}를 수행하는 null-safe 바인딩 헬퍼입니다.
     *
     * @param spec  바인딩 대상 spec
     * @param name  파라미터 이름
     * @param value 바인딩할 값(Nullable)
     * @param type  null 바인딩 시 사용할 타입
     * @param <V>   값 타입
     * @return 바인딩이 적용된 spec
     */
    protected <V> DatabaseClient.GenericExecuteSpec bindOrNull(
            DatabaseClient.GenericExecuteSpec spec, String name, V value, Class<V> type
    ) {
        return value == null ? spec.bindNull(name, type) : spec.bind(name, value);
    }
}
