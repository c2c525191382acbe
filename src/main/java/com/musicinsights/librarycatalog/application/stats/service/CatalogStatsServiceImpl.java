package com.musicinsights.librarycatalog.application.stats.service;

import com.musicinsights.librarycatalog.application.common.error.BadRequestException;
import com.musicinsights.librarycatalog.application.stats.dto.response.CatalogStatsResponse.ArtistSingleCountResponse;
import com.musicinsights.librarycatalog.application.stats.dto.response.CatalogStatsResponse.GenreSongCountResponse;
import com.musicinsights.librarycatalog.application.stats.dto.response.CatalogStatsResponse.SongRatingCountResponse;
import com.musicinsights.librarycatalog.application.stats.dto.response.CatalogStatsResponse.UserRatingCountResponse;
import com.musicinsights.librarycatalog.application.stats.repository.CatalogStatsRepository;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 카탈로그 분석 조회 서비스 구현체.
 *
 * <p>Repository 조회 결과를 목록으로 모아 반환한다. 뒤집힌 연도 범위나 n = 0은 조건을 만족하는 행이 없으므로 빈 목록이 된다.</p>
 */
@Service
public class CatalogStatsServiceImpl implements CatalogStatsService {

    private final CatalogStatsRepository statsRepository;

    public CatalogStatsServiceImpl(CatalogStatsRepository statsRepository) {
        this.statsRepository = statsRepository;
    }

    @Override
    public Mono<List<ArtistSingleCountResponse>> getProlificSingleArtists(int fromYear, int toYear, int n) {
        return topN(n, () -> statsRepository.findProlificSingleArtists(fromYear, toYear, n));
    }

    @Override
    public Mono<List<String>> getArtistsWithLastSingleIn(int year) {
        return statsRepository.findArtistsWithLastSingleIn(year).collectList();
    }

    @Override
    public Mono<List<GenreSongCountResponse>> getTopSongGenres(int n) {
        return topN(n, () -> statsRepository.findTopSongGenres(n));
    }

    @Override
    public Mono<List<String>> getArtistsWithAlbumAndSingle() {
        return statsRepository.findArtistsWithAlbumAndSingle().collectList();
    }

    @Override
    public Mono<List<SongRatingCountResponse>> getMostRatedSongs(int fromYear, int toYear, int n) {
        return topN(n, () -> statsRepository.findMostRatedSongs(fromYear, toYear, n));
    }

    @Override
    public Mono<List<UserRatingCountResponse>> getMostEngagedUsers(int fromYear, int toYear, int n) {
        return topN(n, () -> statsRepository.findMostEngagedUsers(fromYear, toYear, n));
    }

    @Override
    public Mono<Map<String, Long>> countRows() {
        return statsRepository.countRows();
    }

    /**
     * top-n 조회 공통 처리. 음수 n은 LIMIT으로 표현할 수 없으므로 {@link BadRequestException},
     * n = 0은 DB를 조회하지 않고 빈 목록을 반환한다.
     */
    private <T> Mono<List<T>> topN(int n, Supplier<Flux<T>> query) {
        if (n < 0) {
            return Mono.error(new BadRequestException("n must not be negative", "INVALID_LIMIT"));
        }
        if (n == 0) {
            return Mono.just(List.of());
        }
        return Flux.defer(query).collectList();
    }
}
