package com.musicinsights.librarycatalog.application.stats.service;

import com.musicinsights.librarycatalog.application.stats.dto.response.CatalogStatsResponse.ArtistSingleCountResponse;
import com.musicinsights.librarycatalog.application.stats.dto.response.CatalogStatsResponse.GenreSongCountResponse;
import com.musicinsights.librarycatalog.application.stats.dto.response.CatalogStatsResponse.SongRatingCountResponse;
import com.musicinsights.librarycatalog.application.stats.dto.response.CatalogStatsResponse.UserRatingCountResponse;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * 카탈로그 분석 조회 서비스.
 *
 * <p>top-n 조회는 조건을 만족하는 행이 n보다 적으면 있는 만큼만, 없으면 빈 목록을 반환한다.</p>
 */
public interface CatalogStatsService {

    /**
     * 기간 내 싱글을 가장 많이 발매한 아티스트를 조회한다.
     *
     * @param fromYear 시작 연도(포함)
     * @param toYear   종료 연도(포함)
     * @param n        최대 결과 수
     * @return (아티스트, 싱글 수) 목록. 싱글 수 DESC, 아티스트명 ASC
     */
    Mono<List<ArtistSingleCountResponse>> getProlificSingleArtists(int fromYear, int toYear, int n);

    /**
     * 가장 최근 싱글이 주어진 연도에 발매된 아티스트를 조회한다.
     *
     * @param year 대상 연도
     * @return 아티스트 이름 목록(이름순)
     */
    Mono<List<String>> getArtistsWithLastSingleIn(int year);

    /**
     * 곡 수 기준 상위 장르를 조회한다.
     *
     * @param n 최대 결과 수
     * @return (장르, 곡 수) 목록. 곡 수 DESC, 장르명 ASC
     */
    Mono<List<GenreSongCountResponse>> getTopSongGenres(int n);

    /**
     * 앨범과 싱글을 모두 발매한 아티스트를 조회한다.
     *
     * @return 아티스트 이름 목록(이름순)
     */
    Mono<List<String>> getArtistsWithAlbumAndSingle();

    /**
     * 기간 내 평점이 가장 많은 곡을 조회한다.
     *
     * @param fromYear 시작 연도(포함)
     * @param toYear   종료 연도(포함)
     * @param n        최대 결과 수
     * @return (곡, 아티스트, 평점 수) 목록. 평점 수 DESC, 곡 제목 ASC, 아티스트명 ASC
     */
    Mono<List<SongRatingCountResponse>> getMostRatedSongs(int fromYear, int toYear, int n);

    /**
     * 기간 내 평점을 가장 많이 남긴 사용자를 조회한다.
     *
     * @param fromYear 시작 연도(포함)
     * @param toYear   종료 연도(포함)
     * @param n        최대 결과 수
     * @return (사용자, 평점 수) 목록. 평점 수 DESC, username ASC
     */
    Mono<List<UserRatingCountResponse>> getMostEngagedUsers(int fromYear, int toYear, int n);

    /**
     * 엔티티 테이블별 행 수를 조회한다.
     *
     * @return 테이블명 → 행 수
     */
    Mono<Map<String, Long>> countRows();
}
