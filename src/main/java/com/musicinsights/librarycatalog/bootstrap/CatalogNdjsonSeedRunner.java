package com.musicinsights.librarycatalog.bootstrap;

import com.musicinsights.librarycatalog.application.ingest.CatalogIngestService;
import com.musicinsights.librarycatalog.application.ingest.CatalogResetService;
import com.musicinsights.librarycatalog.application.ingest.outcome.IngestReport;
import com.musicinsights.librarycatalog.config.CatalogProperties;
import com.musicinsights.librarycatalog.infrastructure.input.ndjson.CatalogRecordRaw;
import com.musicinsights.librarycatalog.infrastructure.input.ndjson.NdjsonLineReader;
import com.musicinsights.librarycatalog.infrastructure.mapper.CatalogRecordMapper;
import com.musicinsights.librarycatalog.infrastructure.mapper.CatalogRecordMapper.SeedBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * NDJSON 시드 파일을 카탈로그에 적재하는 {@link CommandLineRunner}.
 *
 * <p>Profile이 {@code seed}일 때만 활성화된다.</p>
 * <p>흐름: 라인 읽기 → JSON 파싱 → 종류별 배치 변환 → (선택) 전체 삭제 → users → singles → albums → ratings</p>
 */
@Component
@Profile("seed")
public class CatalogNdjsonSeedRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(CatalogNdjsonSeedRunner.class);

    private final NdjsonLineReader lineReader;

    /** 라인(JSON) → {@link CatalogRecordRaw} 변환용 ObjectMapper */
    private final ObjectMapper mapper;

    private final CatalogRecordMapper recordMapper;
    private final CatalogIngestService ingestService;
    private final CatalogResetService resetService;
    private final CatalogProperties props;

    public CatalogNdjsonSeedRunner(
            NdjsonLineReader lineReader,
            ObjectMapper mapper,
            CatalogRecordMapper recordMapper,
            CatalogIngestService ingestService,
            CatalogResetService resetService,
            CatalogProperties props
    ) {
        this.lineReader = lineReader;
        this.mapper = mapper;
        this.recordMapper = recordMapper;
        this.ingestService = ingestService;
        this.resetService = resetService;
        this.props = props;
    }

    /**
     * 시드 파일 전체를 적재할 때까지 {@code block()}으로 대기합니다.
     *
     * @param args 커맨드라인 인자
     */
    @Override
    public void run(String... args) {
        seed().block();
    }

    /**
     * 시드 적재 파이프라인. 종류 간 참조(평점 → 사용자/곡) 때문에 적재 순서를 고정합니다.
     *
     * @return 완료 신호
     * @throws IllegalStateException JSON 파싱 실패 시(에러 신호로 전달)
     */
    Mono<Void> seed() {
        String path = props.seed().path();

        Mono<Void> resetFirst = props.seed().resetFirst() ? Mono.defer(resetService::resetAll) : Mono.empty();

        return lineReader.readLines(path)
                .filter(line -> line != null && !line.isBlank())
                .map(this::parse)
                .collectList()
                .map(recordMapper::map)
                .doOnNext(batch -> log.info("Seed parsed. path={}, users={}, singles={}, albums={}, ratings={}, skipped={}",
                        path, batch.users().size(), batch.singles().size(), batch.albums().size(),
                        batch.ratings().size(), batch.skipped()))
                .flatMap(batch -> resetFirst.then(load(batch)))
                .doOnError(e -> log.error("Seed failed. path={}", path, e));
    }

    private Mono<Void> load(SeedBatch batch) {
        return ingestService.loadUsers(batch.users())
                .doOnNext(r -> logRejects("users", r))
                .then(Mono.defer(() -> ingestService.loadSingles(batch.singles())))
                .doOnNext(r -> logRejects("singles", r))
                .then(Mono.defer(() -> ingestService.loadAlbums(batch.albums())))
                .doOnNext(r -> logRejects("albums", r))
                .then(Mono.defer(() -> ingestService.loadRatings(batch.ratings())))
                .doOnNext(r -> logRejects("ratings", r))
                .then();
    }

    private void logRejects(String kind, IngestReport<?> report) {
        if (report.rejects().isEmpty()) {
            log.info("Seed {} done. accepted={}", kind, report.acceptedCount());
        } else {
            log.info("Seed {} done. accepted={}, rejects={}", kind, report.acceptedCount(), report.rejects());
        }
    }

    /**
     * NDJSON의 한 줄(JSON 문자열)을 {@link CatalogRecordRaw}로 파싱합니다.
     *
     * @param line JSON 한 줄 문자열
     * @return 파싱된 레코드
     * @throws IllegalStateException JSON 파싱 실패 시
     */
    private CatalogRecordRaw parse(String line) {
        try {
            return mapper.readValue(line, CatalogRecordRaw.class);
        } catch (JacksonException e) {
            throw new IllegalStateException("JSON parse error", e);
        }
    }
}
