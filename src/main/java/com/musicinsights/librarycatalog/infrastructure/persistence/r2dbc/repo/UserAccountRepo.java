package com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc.repo;

import com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc.SqlSupport;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * user_account 테이블 Repository입니다.
 * <p>
 * username은 UNIQUE이며, 중복 INSERT는 DB가 거부합니다(선검사 없음).
 */
@Component
public class UserAccountRepo extends SqlSupport {

    public UserAccountRepo(DatabaseClient db) {
        super(db);
    }

    /**
     * @param username 사용자 이름
     * @return 생성된 user_account.id
     */
    public Mono<Long> insert(String username) {
        return insertReturningId(db.sql("INSERT INTO user_account (username) VALUES (:username)")
                .bind("username", username));
    }

    /**
     * @param username 사용자 이름
     * @return user_account.id, 없으면 empty
     */
    public Mono<Long> findIdByUsername(String username) {
        return firstId(db.sql("SELECT id FROM user_account WHERE username = :username")
                .bind("username", username));
    }
}
