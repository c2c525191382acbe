package com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc.repo;

import com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc.SqlSupport;
import com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc.row.AlbumRow;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * album 테이블 Repository입니다.
 * <p>
 * (name, artist_id)는 UNIQUE이며, 적재 서비스는 INSERT 전에 {@link #existsByNameAndArtist}로 선검사합니다.
 */
@Component
public class AlbumRepo extends SqlSupport {

    public AlbumRepo(DatabaseClient db) {
        super(db);
    }

    /**
     * 같은 아티스트에게 같은 제목의 앨범이 이미 있는지 확인합니다.
     *
     * @param name     앨범명
     * @param artistId 아티스트 id
     * @return 존재 여부
     */
    public Mono<Boolean> existsByNameAndArtist(String name, long artistId) {
        String sql = """
            SELECT 1 AS ok
            FROM album
            WHERE name = :name
              AND artist_id = :artistId
        """;

        return exists(db.sql(sql)
                .bind("name", name)
                .bind("artistId", artistId));
    }

    /**
     * 앨범 1건을 삽입합니다.
     *
     * @param album 앨범 row
     * @return 생성된 album.id
     */
    public Mono<Long> insert(AlbumRow album) {
        String sql = """
            INSERT INTO album (name, artist_id, release_date, genre_id)
            VALUES (:name, :artistId, :releaseDate, :genreId)
        """;

        return insertReturningId(db.sql(sql)
                .bind("name", album.name())
                .bind("artistId", album.artistId())
                .bind("releaseDate", album.releaseDate())
                .bind("genreId", album.genreId()));
    }
}
