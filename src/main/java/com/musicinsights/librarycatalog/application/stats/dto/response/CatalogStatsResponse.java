package com.musicinsights.librarycatalog.application.stats.dto.response;

/**
 * 카탈로그 분석 조회 API 응답 DTO 모음.
 */
public class CatalogStatsResponse {

    /**
     * 아티스트별 싱글 수.
     *
     * @param artist      아티스트 이름
     * @param singleCount 기간 내 싱글 수
     */
    public static record ArtistSingleCountResponse(
            String artist,
            long singleCount
    ) {}

    /**
     * 장르별 곡 수.
     *
     * @param genre     장르 이름
     * @param songCount 해당 장르에 연결된 곡 수
     */
    public static record GenreSongCountResponse(
            String genre,
            long songCount
    ) {}

    /**
     * 곡별 평점 수.
     *
     * @param title       곡 제목
     * @param artist      아티스트 이름
     * @param ratingCount 기간 내 평점 수
     */
    public static record SongRatingCountResponse(
            String title,
            String artist,
            long ratingCount
    ) {}

    public static record UserRatingCountResponse(
            String username,
            long ratingCount
    ) {}
}
