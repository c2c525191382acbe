package com.musicinsights.librarycatalog.application.ingest;

import com.musicinsights.librarycatalog.application.ingest.dto.request.AlbumRequest;
import com.musicinsights.librarycatalog.application.ingest.dto.request.RatingRequest;
import com.musicinsights.librarycatalog.application.ingest.dto.request.SingleSongRequest;
import com.musicinsights.librarycatalog.application.ingest.outcome.IngestKeys.AlbumKey;
import com.musicinsights.librarycatalog.application.ingest.outcome.IngestKeys.RatingKey;
import com.musicinsights.librarycatalog.application.ingest.outcome.IngestKeys.SongKey;
import com.musicinsights.librarycatalog.application.ingest.outcome.IngestReport;
import com.musicinsights.librarycatalog.application.ingest.outcome.ItemOutcome;
import com.musicinsights.librarycatalog.application.ingest.outcome.RejectReason;
import com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc.row.AlbumRow;
import com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc.row.RatingRow;
import com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc.row.SongRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 싱글/앨범/사용자/평점 배치를 관계형 스키마에 적재(ingest)하는 서비스입니다.
 * <p>
 * 배치는 아이템 단위로 순차 처리하며, 아이템마다 {@link TransactionalOperator}로 독립 트랜잭션을 잡습니다.
 * 한 아이템의 실패는 그 아이템만 롤백하고 reject 집합에 기록하며, 배치 호출 자체는 에러로 끝나지 않습니다.
 */
@Service
public class CatalogIngestService {

    private static final Logger log = LoggerFactory.getLogger(CatalogIngestService.class);

    /** 허용 평점 범위(양 끝 포함) */
    static final int MIN_RATING = 1;
    static final int MAX_RATING = 5;

    /** 아이템 적재에 필요한 Repo들을 묶은 파사드 */
    private final IngestFacade ingestDb;

    /** 리액티브 트랜잭션 적용을 위한 operator */
    private final TransactionalOperator tx;

    public CatalogIngestService(IngestFacade ingestDb, TransactionalOperator tx) {
        this.ingestDb = ingestDb;
        this.tx = tx;
    }

    /**
     * 싱글 곡 배치를 적재합니다.
     * <p>
     * 아이템별로 artist resolve → song INSERT(album 없음) → 장르 resolve + song_genre INSERT 순서로
     * 하나의 트랜잭션에서 처리합니다. 장르 목록이 비어 있으면 DB를 건드리지 않고 거절합니다.
     *
     * @param singles 싱글 곡 목록
     * @return 아이템별 결과. reject 키는 (곡 제목, 아티스트)
     */
    public Mono<IngestReport<SongKey>> loadSingles(List<SingleSongRequest> singles) {
        return runBatch("singles", singles, this::loadSingle);
    }

    /**
     * 앨범 배치를 적재합니다.
     * <p>
     * artist/genre resolve는 별도 트랜잭션으로 먼저 커밋되므로, 이후 아이템이 거절되어도 남습니다.
     * 앨범과 수록곡은 하나의 트랜잭션으로 묶여 수록곡 중 하나라도 실패하면 앨범 전체가 롤백됩니다.
     *
     * @param albums 앨범 목록
     * @return 아이템별 결과. reject 키는 (앨범명, 아티스트)
     */
    public Mono<IngestReport<AlbumKey>> loadAlbums(List<AlbumRequest> albums) {
        return runBatch("albums", albums, this::loadAlbum);
    }

    /**
     * 사용자 배치를 적재합니다. 중복 username은 DB 유일 제약으로 거절됩니다.
     *
     * @param usernames 사용자 이름 목록
     * @return 아이템별 결과. reject 키는 username
     */
    public Mono<IngestReport<String>> loadUsers(List<String> usernames) {
        return runBatch("users", usernames, this::loadUser);
    }

    /**
     * 평점 배치를 적재합니다.
     * <p>
     * 거절 조건은 다음 순서로 검사하며 처음 걸린 조건에서 멈춥니다:
     * 사용자 없음 → (아티스트, 곡) 없음 → 평점 범위(1..5) 밖 → 이미 평가한 곡.
     *
     * @param ratings 평점 목록
     * @return 아이템별 결과. reject 키는 (username, 아티스트, 곡 제목)
     */
    public Mono<IngestReport<RatingKey>> loadRatings(List<RatingRequest> ratings) {
        return runBatch("ratings", ratings, this::loadRating);
    }

    private Mono<ItemOutcome<SongKey>> loadSingle(SingleSongRequest s) {
        if (s == null) {
            return reject(null, RejectReason.INVALID);
        }
        SongKey key = new SongKey(s.title(), s.artist());

        if (s.genres() == null || s.genres().isEmpty()) {
            return reject(key, RejectReason.INVALID);
        }
        if (s.title() == null || s.artist() == null || s.releaseDate() == null
                || s.genres().stream().anyMatch(Objects::isNull)) {
            return reject(key, RejectReason.INVALID);
        }

        return inItemTx(key, () ->
                ingestDb.artist.resolveId(s.artist())
                        .flatMap(artistId -> ingestDb.song.insert(SongRow.single(s.title(), artistId, s.releaseDate())))
                        .flatMap(songId -> linkGenres(songId, s.genres()))
                        .thenReturn(ItemOutcome.accepted(key))
        );
    }

    private Mono<Void> linkGenres(long songId, List<String> genreNames) {
        return Flux.fromIterable(genreNames)
                .concatMap(name -> ingestDb.genre.resolveId(name)
                        .flatMap(genreId -> ingestDb.songGenre.insert(songId, genreId)))
                .then();
    }

    private Mono<ItemOutcome<AlbumKey>> loadAlbum(AlbumRequest a) {
        if (a == null) {
            return reject(null, RejectReason.INVALID);
        }
        AlbumKey key = new AlbumKey(a.title(), a.artist());

        if (a.title() == null || a.artist() == null || a.genre() == null || a.releaseDate() == null) {
            return reject(key, RejectReason.INVALID);
        }

        // resolve 결과는 아이템 거절 여부와 무관하게 커밋한다.
        // 앨범 트랜잭션 밖에서 커밋된 id를 쓰므로 호출자(단일 세션) 외에 artist/genre를 지우는 쓰기가 없어야 한다.
        Mono<AlbumRefs> refs = tx.transactional(Mono.defer(() ->
                ingestDb.artist.resolveId(a.artist())
                        .flatMap(artistId -> ingestDb.genre.resolveId(a.genre())
                                .map(genreId -> new AlbumRefs(artistId, genreId)))
        ));

        return refs
                .flatMap(r -> inItemTx(key, () -> insertAlbumWithSongs(key, a, r)))
                .onErrorResume(e -> storeFailure(key, e));
    }

    private Mono<ItemOutcome<AlbumKey>> insertAlbumWithSongs(AlbumKey key, AlbumRequest a, AlbumRefs refs) {
        List<String> songTitles = (a.songs() == null) ? List.of() : a.songs();

        return ingestDb.album.existsByNameAndArtist(a.title(), refs.artistId())
                .flatMap(exists -> {
                    if (exists) {
                        return Mono.just(ItemOutcome.rejected(key, RejectReason.CONFLICT));
                    }
                    AlbumRow album = new AlbumRow(a.title(), refs.artistId(), a.releaseDate(), refs.genreId());

                    return ingestDb.album.insert(album)
                            .flatMap(albumId -> Flux.fromIterable(songTitles)
                                    .concatMap(title -> ingestDb.song.insert(SongRow.albumTrack(title, refs.artistId(), albumId))
                                            .flatMap(songId -> ingestDb.songGenre.insert(songId, refs.genreId())))
                                    .then())
                            .thenReturn(ItemOutcome.accepted(key));
                });
    }

    private Mono<ItemOutcome<String>> loadUser(String username) {
        if (username == null) {
            return reject(username, RejectReason.INVALID);
        }
        return inItemTx(username, () ->
                ingestDb.userAccount.insert(username)
                        .thenReturn(ItemOutcome.accepted(username))
        );
    }

    private Mono<ItemOutcome<RatingKey>> loadRating(RatingRequest r) {
        if (r == null) {
            return reject(null, RejectReason.INVALID);
        }
        RatingKey key = new RatingKey(r.username(), r.artist(), r.song());
        ItemOutcome<RatingKey> notFound = ItemOutcome.rejected(key, RejectReason.NOT_FOUND);

        return inItemTx(key, () ->
                findUserId(r.username())
                        .flatMap(userId -> findSongId(r.artist(), r.song())
                                .flatMap(songId -> rateIfAllowed(key, userId, songId, r))
                                .defaultIfEmpty(notFound))
                        .defaultIfEmpty(notFound)
        );
    }

    private Mono<ItemOutcome<RatingKey>> rateIfAllowed(RatingKey key, long userId, long songId, RatingRequest r) {
        Integer value = r.rating();
        if (value == null || value < MIN_RATING || value > MAX_RATING) {
            return Mono.just(ItemOutcome.rejected(key, RejectReason.INVALID));
        }

        return ingestDb.rating.existsByUserAndSong(userId, songId)
                .flatMap(alreadyRated -> alreadyRated
                        ? Mono.just(ItemOutcome.rejected(key, RejectReason.CONFLICT))
                        : ingestDb.rating.insert(new RatingRow(userId, songId, value, r.ratedOn()))
                                .thenReturn(ItemOutcome.accepted(key)));
    }

    private Mono<Long> findUserId(String username) {
        return (username == null) ? Mono.empty() : ingestDb.userAccount.findIdByUsername(username);
    }

    private Mono<Long> findSongId(String artist, String title) {
        return (artist == null || title == null) ? Mono.empty() : ingestDb.song.findIdByArtistAndTitle(artist, title);
    }

    /**
     * 아이템 1건을 독립 트랜잭션으로 실행합니다.
     * <p>
     * work가 에러로 끝나면 트랜잭션은 롤백되고, 에러는 거절 결과로 변환됩니다.
     */
    private <K> Mono<ItemOutcome<K>> inItemTx(K key, Supplier<Mono<ItemOutcome<K>>> work) {
        return tx.transactional(Mono.defer(work))
                .onErrorResume(e -> storeFailure(key, e))
                .doOnNext(outcome -> {
                    if (!outcome.isAccepted()) {
                        log.debug("Item rejected. key={}, reason={}", key, outcome.reason());
                    }
                });
    }

    private <K> Mono<ItemOutcome<K>> storeFailure(K key, Throwable e) {
        RejectReason reason = RejectReason.classify(e);
        if (reason == RejectReason.STORE_FAILURE) {
            log.warn("Item rolled back by store failure. key={}, cause={}", key, e.toString());
        }
        return Mono.just(ItemOutcome.rejected(key, reason));
    }

    private <K> Mono<ItemOutcome<K>> reject(K key, RejectReason reason) {
        log.debug("Item rejected before store access. key={}, reason={}", key, reason);
        return Mono.just(ItemOutcome.rejected(key, reason));
    }

    private <T, K> Mono<IngestReport<K>> runBatch(
            String kind,
            List<T> items,
            Function<T, Mono<ItemOutcome<K>>> itemFn
    ) {
        if (items == null || items.isEmpty()) {
            return Mono.just(new IngestReport<>(List.of()));
        }
        // 입력 목록에 null 원소가 있어도 아이템 단위로 거절되도록 인덱스로 순회한다
        return Flux.range(0, items.size())
                .concatMap(i -> Mono.defer(() -> itemFn.apply(items.get(i))))
                .collectList()
                .map(IngestReport::new)
                .doOnNext(report -> log.info("Batch done. kind={}, requested={}, accepted={}, rejected={}",
                        kind, report.requested(), report.acceptedCount(),
                        report.requested() - report.acceptedCount()));
    }

    /**
     * 앨범 아이템의 resolve 결과.
     * <p>
     * 별도 트랜잭션에서 이미 커밋된 artist/genre id이며, 이어지는 앨범 트랜잭션이 롤백되어도 유효하다.
     */
    private record AlbumRefs(long artistId, long genreId) {}
}
