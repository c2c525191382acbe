package com.musicinsights.librarycatalog.application.stats.controller;

import com.musicinsights.librarycatalog.application.stats.dto.response.CatalogStatsResponse.ArtistSingleCountResponse;
import com.musicinsights.librarycatalog.application.stats.dto.response.CatalogStatsResponse.GenreSongCountResponse;
import com.musicinsights.librarycatalog.application.stats.dto.response.CatalogStatsResponse.SongRatingCountResponse;
import com.musicinsights.librarycatalog.application.stats.dto.response.CatalogStatsResponse.UserRatingCountResponse;
import com.musicinsights.librarycatalog.application.stats.service.CatalogStatsService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 카탈로그 분석 조회 REST 컨트롤러.
 *
 * <p>쿼리 파라미터 검증을 위해 {@link Validated}를 사용하며, 서비스로 요청을 위임한다.</p>
 */
@RestController
@RequestMapping("/api/stats")
@Validated
public class CatalogStatsController {
    private final CatalogStatsService service;

    public CatalogStatsController(CatalogStatsService service) {
        this.service = service;
    }

    /**
     * 기간 내 싱글 발매 수 상위 아티스트를 조회한다.
     *
     * @param from 시작 연도(포함)
     * @param to   종료 연도(포함)
     * @param n    최대 결과 수(기본 10)
     * @return (아티스트, 싱글 수) 목록
     */
    @GetMapping("/artists/prolific")
    public Mono<List<ArtistSingleCountResponse>> getProlificSingleArtists(
            @RequestParam int from,
            @RequestParam int to,
            @RequestParam(defaultValue = "10") @Min(0) @Max(1000) int n
    ) {
        return service.getProlificSingleArtists(from, to, n);
    }

    @GetMapping("/artists/last-single")
    public Mono<List<String>> getArtistsWithLastSingleIn(
            @RequestParam int year
    ) {
        return service.getArtistsWithLastSingleIn(year);
    }

    @GetMapping("/genres/top")
    public Mono<List<GenreSongCountResponse>> getTopSongGenres(
            @RequestParam(defaultValue = "10") @Min(0) @Max(1000) int n
    ) {
        return service.getTopSongGenres(n);
    }

    @GetMapping("/artists/album-and-single")
    public Mono<List<String>> getArtistsWithAlbumAndSingle() {
        return service.getArtistsWithAlbumAndSingle();
    }

    /**
     * 기간 내 평점 수 상위 곡을 조회한다.
     *
     * @param from 시작 연도(포함)
     * @param to   종료 연도(포함)
     * @param n    최대 결과 수(기본 10)
     * @return (곡, 아티스트, 평점 수) 목록
     */
    @GetMapping("/songs/most-rated")
    public Mono<List<SongRatingCountResponse>> getMostRatedSongs(
            @RequestParam int from,
            @RequestParam int to,
            @RequestParam(defaultValue = "10") @Min(0) @Max(1000) int n
    ) {
        return service.getMostRatedSongs(from, to, n);
    }

    @GetMapping("/users/most-engaged")
    public Mono<List<UserRatingCountResponse>> getMostEngagedUsers(
            @RequestParam int from,
            @RequestParam int to,
            @RequestParam(defaultValue = "10") @Min(0) @Max(1000) int n
    ) {
        return service.getMostEngagedUsers(from, to, n);
    }
}
