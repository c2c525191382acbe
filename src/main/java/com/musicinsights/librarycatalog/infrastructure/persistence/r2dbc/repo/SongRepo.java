package com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc.repo;

import com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc.SqlSupport;
import com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc.row.SongRow;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

/**
 * song 테이블 Repository입니다.
 * <p>
 * (artist_id, title)은 UNIQUE이므로 같은 아티스트의 같은 제목 곡은 DB가 거부합니다.
 */
@Component
public class SongRepo extends SqlSupport {

    public SongRepo(DatabaseClient db) {
        super(db);
    }

    /**
     * 싱글 또는 앨범 수록곡 1건을 삽입합니다.
     *
     * @param song song row
     * @return 생성된 song.id
     */
    public Mono<Long> insert(SongRow song) {
        String sql = """
            INSERT INTO song (title, artist_id, album_id, single_release_date)
            VALUES (:title, :artistId, :albumId, :releaseDate)
        """;

        DatabaseClient.GenericExecuteSpec spec = db.sql(sql)
                .bind("title", song.title())
                .bind("artistId", song.artistId());
        spec = bindOrNull(spec, "albumId", song.albumId(), Long.class);
        spec = bindOrNull(spec, "releaseDate", song.singleReleaseDate(), LocalDate.class);

        return insertReturningId(spec);
    }

    /**
     * (아티스트 이름, 곡 제목)으로 곡 id를 조회합니다.
     *
     * @param artistName 아티스트 이름
     * @param title      곡 제목
     * @return song.id, 없으면 empty
     */
    public Mono<Long> findIdByArtistAndTitle(String artistName, String title) {
        String sql = """
            SELECT s.id
            FROM song s
            JOIN artist a ON a.id = s.artist_id
            WHERE a.name = :artistName
              AND s.title = :title
        """;

        return firstId(db.sql(sql)
                .bind("artistName", artistName)
                .bind("title", title));
    }
}
