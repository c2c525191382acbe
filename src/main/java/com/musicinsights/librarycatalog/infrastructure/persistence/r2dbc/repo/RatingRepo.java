package com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc.repo;

import com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc.SqlSupport;
import com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc.row.RatingRow;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

/**
 * rating 테이블 Repository입니다.
 * <p>
 * (user_id, song_id) 당 평점은 최대 1건이며 수정 경로는 없습니다.
 */
@Component
public class RatingRepo extends SqlSupport {

    public RatingRepo(DatabaseClient db) {
        super(db);
    }

    /**
     * 사용자가 해당 곡을 이미 평가했는지 확인합니다.
     *
     * @param userId 사용자 id
     * @param songId 곡 id
     * @return 존재 여부
     */
    public Mono<Boolean> existsByUserAndSong(long userId, long songId) {
        String sql = """
            SELECT 1 AS ok
            FROM rating
            WHERE user_id = :userId
              AND song_id = :songId
        """;

        return exists(db.sql(sql)
                .bind("userId", userId)
                .bind("songId", songId));
    }

    /**
     * @param rating rating row
     * @return 생성된 rating.id
     */
    public Mono<Long> insert(RatingRow rating) {
        String sql = """
            INSERT INTO rating (user_id, song_id, rating_value, rating_date)
            VALUES (:userId, :songId, :ratingValue, :ratingDate)
        """;

        DatabaseClient.GenericExecuteSpec spec = db.sql(sql)
                .bind("userId", rating.userId())
                .bind("songId", rating.songId())
                .bind("ratingValue", rating.ratingValue());
        // rating_date는 NOT NULL 제약으로 DB에서 거부된다
        spec = bindOrNull(spec, "ratingDate", rating.ratingDate(), LocalDate.class);

        return insertReturningId(spec);
    }
}
