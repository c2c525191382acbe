package com.musicinsights.librarycatalog.application.ingest.controller;

import com.musicinsights.librarycatalog.application.ingest.CatalogIngestService;
import com.musicinsights.librarycatalog.application.ingest.CatalogResetService;
import com.musicinsights.librarycatalog.application.ingest.dto.request.AlbumRequest;
import com.musicinsights.librarycatalog.application.ingest.dto.request.RatingRequest;
import com.musicinsights.librarycatalog.application.ingest.dto.request.SingleSongRequest;
import com.musicinsights.librarycatalog.application.ingest.dto.response.IngestResultResponse;
import com.musicinsights.librarycatalog.application.ingest.outcome.IngestKeys.AlbumKey;
import com.musicinsights.librarycatalog.application.ingest.outcome.IngestKeys.RatingKey;
import com.musicinsights.librarycatalog.application.ingest.outcome.IngestKeys.SongKey;
import com.musicinsights.librarycatalog.application.stats.service.CatalogStatsService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * 카탈로그 배치 적재/전체 삭제 REST 컨트롤러.
 *
 * <p>배치 적재 API는 아이템 실패가 있어도 200으로 응답하고, 저장되지 않은 아이템을 rejects로 돌려준다.</p>
 */
@RestController
@RequestMapping("/api/catalog")
public class CatalogIngestController {

    private final CatalogIngestService ingestService;
    private final CatalogResetService resetService;
    private final CatalogStatsService statsService;

    public CatalogIngestController(
            CatalogIngestService ingestService,
            CatalogResetService resetService,
            CatalogStatsService statsService
    ) {
        this.ingestService = ingestService;
        this.resetService = resetService;
        this.statsService = statsService;
    }

    @PostMapping("/singles")
    public Mono<IngestResultResponse<SongKey>> loadSingles(@RequestBody List<SingleSongRequest> body) {
        return ingestService.loadSingles(body).map(IngestResultResponse::from);
    }

    /**
     * 앨범 배치를 적재한다. 수록곡 중 하나라도 실패하면 해당 앨범은 통째로 rejects에 들어간다.
     *
     * @param body 앨범 목록
     * @return 적재 결과
     */
    @PostMapping("/albums")
    public Mono<IngestResultResponse<AlbumKey>> loadAlbums(@RequestBody List<AlbumRequest> body) {
        return ingestService.loadAlbums(body).map(IngestResultResponse::from);
    }

    @PostMapping("/users")
    public Mono<IngestResultResponse<String>> loadUsers(@RequestBody List<String> body) {
        return ingestService.loadUsers(body).map(IngestResultResponse::from);
    }

    @PostMapping("/ratings")
    public Mono<IngestResultResponse<RatingKey>> loadRatings(@RequestBody List<RatingRequest> body) {
        return ingestService.loadRatings(body).map(IngestResultResponse::from);
    }

    /**
     * 모든 카탈로그 데이터를 삭제한다.
     *
     * @return 204 No Content. 실패 시 에러 응답
     */
    @DeleteMapping
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> resetAll() {
        return resetService.resetAll();
    }

    /**
     * 엔티티 테이블별 행 수를 조회한다.
     *
     * @return 테이블명 → 행 수
     */
    @GetMapping("/counts")
    public Mono<Map<String, Long>> counts() {
        return statsService.countRows();
    }
}
