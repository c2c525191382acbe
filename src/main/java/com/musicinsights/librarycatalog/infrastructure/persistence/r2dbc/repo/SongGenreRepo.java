package com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc.repo;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * song_genre 조인 테이블 Repository입니다.
 * <p>
 * PK가 (song_id, genre_id)이므로 같은 곡에 같은 장르를 두 번 연결하면 DB가 거부합니다.
 */
@Component
public class SongGenreRepo {
    private final DatabaseClient db;

    public SongGenreRepo(DatabaseClient db) {
        this.db = db;
    }

    /**
     * 곡-장르 연결 1건을 삽입합니다.
     *
     * @param songId  곡 id
     * @param genreId 장르 id
     * @return 반영된 행 수
     */
    public Mono<Long> insert(long songId, long genreId) {
        String sql = """
            INSERT INTO song_genre (song_id, genre_id)
            VALUES (:songId, :genreId)
        """;

        return db.sql(sql)
                .bind("songId", songId)
                .bind("genreId", genreId)
                .fetch()
                .rowsUpdated();
    }
}
