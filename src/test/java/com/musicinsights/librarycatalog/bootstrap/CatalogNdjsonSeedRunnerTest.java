package com.musicinsights.librarycatalog.bootstrap;

import com.musicinsights.librarycatalog.application.ingest.CatalogIngestService;
import com.musicinsights.librarycatalog.application.ingest.CatalogResetService;
import com.musicinsights.librarycatalog.application.ingest.dto.request.AlbumRequest;
import com.musicinsights.librarycatalog.application.ingest.dto.request.RatingRequest;
import com.musicinsights.librarycatalog.application.ingest.dto.request.SingleSongRequest;
import com.musicinsights.librarycatalog.application.ingest.outcome.IngestReport;
import com.musicinsights.librarycatalog.config.CatalogProperties;
import com.musicinsights.librarycatalog.infrastructure.input.ndjson.NdjsonLineReader;
import com.musicinsights.librarycatalog.infrastructure.mapper.CatalogRecordMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import tools.jackson.databind.json.JsonMapper;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

/**
 * {@link CatalogNdjsonSeedRunner} 단위 테스트.
 *
 * <p>NDJSON 라인을 읽어 파싱한 뒤 users → singles → albums → ratings 순서로 적재하는 흐름과,
 * JSON 파싱 실패/적재 전 전체 삭제 옵션을 검증한다.</p>
 */
@DisplayName("시드 적재 runner 테스트")
class CatalogNdjsonSeedRunnerTest {

    private static final String PATH = "dataset/seed-under-test.ndjson";

    private NdjsonLineReader lineReader;
    private CatalogIngestService ingestService;
    private CatalogResetService resetService;

    @BeforeEach
    void setUp() {
        lineReader = mock(NdjsonLineReader.class);
        ingestService = mock(CatalogIngestService.class);
        resetService = mock(CatalogResetService.class);

        when(ingestService.loadUsers(anyList())).thenReturn(Mono.just(new IngestReport<>(List.of())));
        when(ingestService.loadSingles(anyList())).thenReturn(Mono.just(new IngestReport<>(List.of())));
        when(ingestService.loadAlbums(anyList())).thenReturn(Mono.just(new IngestReport<>(List.of())));
        when(ingestService.loadRatings(anyList())).thenReturn(Mono.just(new IngestReport<>(List.of())));
        when(resetService.resetAll()).thenReturn(Mono.empty());
    }

    private CatalogNdjsonSeedRunner runner(boolean resetFirst) {
        CatalogProperties props = new CatalogProperties(null, new CatalogProperties.Seed(PATH, resetFirst));
        return new CatalogNdjsonSeedRunner(
                lineReader, JsonMapper.builder().build(), new CatalogRecordMapper(),
                ingestService, resetService, props);
    }

    @DisplayName("빈 줄을 건너뛰고 users → singles → albums → ratings 순서로 적재하는지 검증")
    @Test
    @SuppressWarnings("unchecked")
    void run_loadsKindsInReferenceOrder() {
        when(lineReader.readLines(PATH)).thenReturn(Flux.just(
                "{\"type\":\"rating\",\"username\":\"u1\",\"artist\":\"A1\",\"song\":\"S1\",\"rating\":5,\"ratedOn\":\"2021-01-01\"}",
                "   ",
                "{\"type\":\"single\",\"title\":\"S1\",\"genres\":[\"Pop\"],\"artist\":\"A1\",\"releaseDate\":\"2008-10-01\"}",
                "{\"type\":\"album\",\"title\":\"Album1\",\"genre\":\"Jazz\",\"artist\":\"A3\",\"releaseDate\":\"2016-01-01\",\"songs\":[\"J1\"]}",
                "",
                "{\"type\":\"user\",\"username\":\"u1\"}"
        ));

        runner(false).run();

        InOrder inOrder = inOrder(ingestService);
        inOrder.verify(ingestService).loadUsers(List.of("u1"));

        ArgumentCaptor<List<SingleSongRequest>> singles = ArgumentCaptor.forClass(List.class);
        inOrder.verify(ingestService).loadSingles(singles.capture());
        ArgumentCaptor<List<AlbumRequest>> albums = ArgumentCaptor.forClass(List.class);
        inOrder.verify(ingestService).loadAlbums(albums.capture());
        ArgumentCaptor<List<RatingRequest>> ratings = ArgumentCaptor.forClass(List.class);
        inOrder.verify(ingestService).loadRatings(ratings.capture());

        assertEquals("S1", singles.getValue().get(0).title());
        assertEquals(List.of("J1"), albums.getValue().get(0).songs());
        assertEquals(5, ratings.getValue().get(0).rating());

        verifyNoInteractions(resetService);
    }

    @DisplayName("resetFirst이면 적재 전에 전체 삭제를 먼저 수행하는지 검증")
    @Test
    void run_resetFirst_resetsBeforeLoading() {
        when(lineReader.readLines(PATH)).thenReturn(Flux.just("{\"type\":\"user\",\"username\":\"u1\"}"));

        runner(true).run();

        InOrder inOrder = inOrder(resetService, ingestService);
        inOrder.verify(resetService).resetAll();
        inOrder.verify(ingestService).loadUsers(List.of("u1"));
        inOrder.verify(ingestService).loadRatings(List.of());
    }

    @DisplayName("JSON 파싱 실패 시 IllegalStateException을 전파하고 아무것도 적재하지 않는지 검증")
    @Test
    void seed_parseError_propagates_andLoadsNothing() {
        when(lineReader.readLines(PATH)).thenReturn(Flux.just(
                "{\"type\":\"user\",\"username\":\"u1\"}",
                "{\"type\":\"user\",\"username\":"
        ));

        StepVerifier.create(runner(true).seed())
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(IllegalStateException.class, e);
                    assertEquals("JSON parse error", e.getMessage());
                })
                .verify();

        verifyNoInteractions(ingestService);
        verifyNoInteractions(resetService);
    }

    @DisplayName("적재 중 오류가 나면 이후 종류는 적재하지 않고 에러를 전파하는지 검증")
    @Test
    void seed_loadFailure_stopsPipeline() {
        when(lineReader.readLines(PATH)).thenReturn(Flux.just("{\"type\":\"user\",\"username\":\"u1\"}"));
        when(ingestService.loadSingles(anyList())).thenReturn(Mono.error(new IllegalStateException("boom")));

        StepVerifier.create(runner(false).seed())
                .expectErrorMessage("boom")
                .verify();

        verify(ingestService, never()).loadAlbums(anyList());
        verify(ingestService, never()).loadRatings(anyList());
    }
}
