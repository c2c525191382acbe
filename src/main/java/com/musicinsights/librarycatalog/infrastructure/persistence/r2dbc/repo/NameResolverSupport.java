package com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc.repo;

import com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc.SqlSupport;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Mono;

/**
 * {@code (id, name UNIQUE)} 형태 테이블의 lookup-or-create 공통 구현입니다.
 * <p>
 * 캐시 없이 항상 현재 DB 상태로 판단하므로, 같은 배치 안에서 앞선 아이템이 롤백되어도
 * 사라진 id를 재사용하지 않습니다. 호출자는 resolve와 그 뒤의 의존 INSERT를
 * 같은 트랜잭션 안에서 수행해야 합니다.
 */
public abstract class NameResolverSupport extends SqlSupport {

    private final String selectIdSql;
    private final String insertSql;

    /**
     * @param db    R2DBC DatabaseClient
     * @param table 대상 테이블 이름(상수)
     */
    protected NameResolverSupport(DatabaseClient db, String table) {
        super(db);
        this.selectIdSql = "SELECT id FROM " + table + " WHERE name = :name";
        this.insertSql = "INSERT INTO " + table + " (name) VALUES (:name)";
    }

    /**
     * 이름으로 id를 조회합니다.
     *
     * @param name 이름
     * @return id, 없으면 empty
     */
    public Mono<Long> findIdByName(String name) {
        return firstId(db.sql(selectIdSql).bind("name", name));
    }

    /**
     * 새 행을 삽입하고 생성된 id를 반환합니다.
     *
     * @param name 이름
     * @return 생성된 id
     */
    public Mono<Long> insert(String name) {
        return insertReturningId(db.sql(insertSql).bind("name", name));
    }

    /**
     * 이름이 이미 있으면 그 id를, 없으면 새로 삽입한 id를 반환합니다(멱등).
     *
     * @param name 이름
     * @return id
     */
    public Mono<Long> resolveId(String name) {
        return findIdByName(name)
                .switchIfEmpty(Mono.defer(() -> insert(name)));
    }
}
