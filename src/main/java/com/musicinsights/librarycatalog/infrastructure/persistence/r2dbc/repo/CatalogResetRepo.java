package com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc.repo;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 카탈로그 전체 테이블을 비우는 Repository입니다.
 * <p>
 * FK 검사를 세션 단위로 중지한 뒤 자식 → 부모 순서로 TRUNCATE하고,
 * 성공/실패/취소 어느 경로에서도 FK 검사를 다시 켭니다.
 * FK 설정은 커넥션(세션) 단위이므로 반드시 트랜잭션 안에서 호출해야 합니다.
 */
@Component
public class CatalogResetRepo {

    /** 삭제 순서: 자식의 자식 → 부모 */
    public static final List<String> TABLES_IN_DELETE_ORDER = List.of(
            "rating",
            "song_genre",
            "song",
            "album",
            "user_account",
            "genre",
            "artist"
    );

    private final DatabaseClient db;

    public CatalogResetRepo(DatabaseClient db) {
        this.db = db;
    }

    /**
     * 모든 카탈로그 테이블을 TRUNCATE 합니다.
     *
     * @param integrityOffSql FK 검사 중지 구문
     * @param integrityOnSql  FK 검사 재개 구문
     * @return 완료 신호. 실패 시 FK 검사를 복구한 뒤 원래 에러를 그대로 전파
     */
    public Mono<Void> truncateAll(String integrityOffSql, String integrityOnSql) {
        return Mono.usingWhen(
                execute(integrityOffSql).thenReturn(Boolean.TRUE),
                suspended -> Flux.fromIterable(TABLES_IN_DELETE_ORDER)
                        .concatMap(table -> execute("TRUNCATE TABLE " + table))
                        .then(),
                suspended -> execute(integrityOnSql),
                (suspended, err) -> execute(integrityOnSql),
                suspended -> execute(integrityOnSql)
        );
    }

    private Mono<Void> execute(String sql) {
        return db.sql(sql).then();
    }
}
