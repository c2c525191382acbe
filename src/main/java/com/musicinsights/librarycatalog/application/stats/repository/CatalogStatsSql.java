package com.musicinsights.librarycatalog.application.stats.repository;

/**
 * 카탈로그 분석 조회에 사용되는 SQL 상수 모음.
 *
 * <p>연도는 저장하지 않고 날짜 컬럼에서 조회 시점에 추출한다.
 * top-n 조회는 모두 건수 DESC, 이름 ASC로 정렬해 동률에서도 결과 순서가 고정된다.</p>
 */
final class CatalogStatsSql {
    private CatalogStatsSql() {}

    /** 연도 범위 내 싱글 발매 수 상위 아티스트 */
    static final String SQL_PROLIFIC_SINGLE_ARTISTS = """
        SELECT
          a.name   AS artist_name,
          COUNT(*) AS cnt
        FROM artist a
        JOIN song s ON s.artist_id = a.id
        WHERE s.album_id IS NULL
          AND EXTRACT(YEAR FROM s.single_release_date) BETWEEN :fromYear AND :toYear
        GROUP BY a.id, a.name
        ORDER BY cnt DESC, a.name ASC
        LIMIT :limit
    """;

    /** 가장 최근 싱글의 발매 연도가 주어진 연도인 아티스트 */
    static final String SQL_LAST_SINGLE_IN_YEAR = """
        SELECT a.name AS artist_name
        FROM artist a
        JOIN (
          SELECT artist_id, MAX(EXTRACT(YEAR FROM single_release_date)) AS last_year
          FROM song
          WHERE album_id IS NULL
          GROUP BY artist_id
        ) t ON t.artist_id = a.id
        WHERE t.last_year = :targetYear
        ORDER BY a.name ASC
    """;

    /** 장르별 곡 수(싱글 + 앨범 수록곡) 상위 */
    static final String SQL_TOP_SONG_GENRES = """
        SELECT
          g.name            AS genre_name,
          COUNT(sg.song_id) AS cnt
        FROM genre g
        JOIN song_genre sg ON sg.genre_id = g.id
        GROUP BY g.id, g.name
        ORDER BY cnt DESC, g.name ASC
        LIMIT :limit
    """;

    /** 앨범과 싱글을 모두 가진 아티스트 */
    static final String SQL_ALBUM_AND_SINGLE_ARTISTS = """
        SELECT a.name AS artist_name
        FROM artist a
        WHERE EXISTS (SELECT 1 FROM album al WHERE al.artist_id = a.id)
          AND EXISTS (SELECT 1 FROM song s WHERE s.artist_id = a.id AND s.album_id IS NULL)
        ORDER BY a.name ASC
    """;

    /** 연도 범위 내 평점 수 상위 곡 */
    static final String SQL_MOST_RATED_SONGS = """
        SELECT
          s.title     AS song_title,
          a.name      AS artist_name,
          COUNT(r.id) AS cnt
        FROM rating r
        JOIN song s   ON s.id = r.song_id
        JOIN artist a ON a.id = s.artist_id
        WHERE EXTRACT(YEAR FROM r.rating_date) BETWEEN :fromYear AND :toYear
        GROUP BY s.id, s.title, a.name
        ORDER BY cnt DESC, s.title ASC, a.name ASC
        LIMIT :limit
    """;

    /** 연도 범위 내 평점을 가장 많이 남긴 사용자 */
    static final String SQL_MOST_ENGAGED_USERS = """
        SELECT
          u.username  AS username,
          COUNT(r.id) AS cnt
        FROM rating r
        JOIN user_account u ON u.id = r.user_id
        WHERE EXTRACT(YEAR FROM r.rating_date) BETWEEN :fromYear AND :toYear
        GROUP BY u.id, u.username
        ORDER BY cnt DESC, u.username ASC
        LIMIT :limit
    """;

    /** 테이블 행 수. 테이블명은 고정 목록에서만 채운다. */
    static final String SQL_COUNT_ROWS_TEMPLATE = "SELECT COUNT(*) AS total FROM %s";
}
