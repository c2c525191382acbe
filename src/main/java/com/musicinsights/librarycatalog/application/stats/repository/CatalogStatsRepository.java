package com.musicinsights.librarycatalog.application.stats.repository;

import com.musicinsights.librarycatalog.application.stats.dto.response.CatalogStatsResponse.ArtistSingleCountResponse;
import com.musicinsights.librarycatalog.application.stats.dto.response.CatalogStatsResponse.GenreSongCountResponse;
import com.musicinsights.librarycatalog.application.stats.dto.response.CatalogStatsResponse.SongRatingCountResponse;
import com.musicinsights.librarycatalog.application.stats.dto.response.CatalogStatsResponse.UserRatingCountResponse;
import com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc.repo.CatalogResetRepo;
import io.r2dbc.spi.Readable;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.musicinsights.librarycatalog.application.stats.repository.CatalogStatsSql.*;

/**
 * 카탈로그 분석 조회 Repository.
 */
@Component
public class CatalogStatsRepository {
    private final DatabaseClient db;

    public CatalogStatsRepository(DatabaseClient db) {
        this.db = db;
    }

    public Flux<ArtistSingleCountResponse> findProlificSingleArtists(int fromYear, int toYear, int limit) {
        return db.sql(SQL_PROLIFIC_SINGLE_ARTISTS)
                .bind("fromYear", fromYear)
                .bind("toYear", toYear)
                .bind("limit", limit)
                .map((row, meta) -> new ArtistSingleCountResponse(
                        row.get("artist_name", String.class),
                        count(row)
                ))
                .all();
    }

    public Flux<String> findArtistsWithLastSingleIn(int year) {
        return db.sql(SQL_LAST_SINGLE_IN_YEAR)
                .bind("targetYear", year)
                .map((row, meta) -> row.get("artist_name", String.class))
                .all();
    }

    public Flux<GenreSongCountResponse> findTopSongGenres(int limit) {
        return db.sql(SQL_TOP_SONG_GENRES)
                .bind("limit", limit)
                .map((row, meta) -> new GenreSongCountResponse(
                        row.get("genre_name", String.class),
                        count(row)
                ))
                .all();
    }

    public Flux<String> findArtistsWithAlbumAndSingle() {
        return db.sql(SQL_ALBUM_AND_SINGLE_ARTISTS)
                .map((row, meta) -> row.get("artist_name", String.class))
                .all();
    }

    public Flux<SongRatingCountResponse> findMostRatedSongs(int fromYear, int toYear, int limit) {
        return db.sql(SQL_MOST_RATED_SONGS)
                .bind("fromYear", fromYear)
                .bind("toYear", toYear)
                .bind("limit", limit)
                .map((row, meta) -> new SongRatingCountResponse(
                        row.get("song_title", String.class),
                        row.get("artist_name", String.class),
                        count(row)
                ))
                .all();
    }

    public Flux<UserRatingCountResponse> findMostEngagedUsers(int fromYear, int toYear, int limit) {
        return db.sql(SQL_MOST_ENGAGED_USERS)
                .bind("fromYear", fromYear)
                .bind("toYear", toYear)
                .bind("limit", limit)
                .map((row, meta) -> new UserRatingCountResponse(
                        row.get("username", String.class),
                        count(row)
                ))
                .all();
    }

    /**
     * 엔티티 테이블별 행 수를 조회합니다.
     *
     * @return 테이블명 → 행 수 (삭제 순서 기준으로 정렬)
     */
    public Mono<Map<String, Long>> countRows() {
        return Flux.fromIterable(CatalogResetRepo.TABLES_IN_DELETE_ORDER)
                .concatMap(table -> db.sql(String.format(SQL_COUNT_ROWS_TEMPLATE, table))
                        .map((row, meta) -> {
                            Number n = row.get("total", Number.class);
                            return (n == null) ? 0L : n.longValue();
                        })
                        .one()
                        .defaultIfEmpty(0L)
                        .map(total -> Map.entry(table, total)))
                .collectMap(Map.Entry::getKey, Map.Entry::getValue, LinkedHashMap::new);
    }

    private static long count(Readable row) {
        Number n = row.get("cnt", Number.class);
        return (n == null) ? 0L : n.longValue();
    }
}
