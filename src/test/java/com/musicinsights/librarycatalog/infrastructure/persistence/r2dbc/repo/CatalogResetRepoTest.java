package com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc.repo;

import com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc.row.SongRow;
import com.musicinsights.librarycatalog.support.H2CatalogDatabase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * {@link CatalogResetRepo} 테스트.
 *
 * <p>삭제 순서, FK 검사 복구(성공/실패 경로), 실제 H2에서의 전체 삭제를 검증한다.</p>
 */
@DisplayName("catalog reset repo 테스트")
class CatalogResetRepoTest {

    private static final String OFF = "OFF-SQL";
    private static final String ON = "ON-SQL";

    @Test
    @DisplayName("삭제 순서는 자식 → 부모 순서다")
    void tablesInDeleteOrder_childrenBeforeParents() {
        var order = CatalogResetRepo.TABLES_IN_DELETE_ORDER;

        assertThat(order).containsExactly(
                "rating", "song_genre", "song", "album", "user_account", "genre", "artist");
        assertThat(order.indexOf("song")).isLessThan(order.indexOf("album"));
        assertThat(order.indexOf("album")).isLessThan(order.indexOf("artist"));
        assertThat(order.indexOf("album")).isLessThan(order.indexOf("genre"));
    }

    @Test
    @DisplayName("FK 검사 중지 → 순서대로 TRUNCATE → FK 검사 재개 순으로 실행된다")
    void truncateAll_runsStatementsInOrder() {
        // given
        DatabaseClient db = mock(DatabaseClient.class);
        DatabaseClient.GenericExecuteSpec ok = mock(DatabaseClient.GenericExecuteSpec.class);
        when(ok.then()).thenReturn(Mono.empty());
        when(db.sql(anyString())).thenReturn(ok);

        CatalogResetRepo repo = new CatalogResetRepo(db);

        // when
        StepVerifier.create(repo.truncateAll(OFF, ON))
                .verifyComplete();

        // then
        InOrder inOrder = inOrder(db);
        inOrder.verify(db).sql(OFF);
        for (String table : CatalogResetRepo.TABLES_IN_DELETE_ORDER) {
            inOrder.verify(db).sql("TRUNCATE TABLE " + table);
        }
        inOrder.verify(db).sql(ON);
        verify(db, times(1)).sql(ON);
    }

    @Test
    @DisplayName("중간 TRUNCATE가 실패해도 FK 검사를 재개하고 원래 에러를 전파한다")
    void truncateAll_failure_restoresIntegrity_andPropagates() {
        // given
        DatabaseClient db = mock(DatabaseClient.class);
        DatabaseClient.GenericExecuteSpec ok = mock(DatabaseClient.GenericExecuteSpec.class);
        DatabaseClient.GenericExecuteSpec failing = mock(DatabaseClient.GenericExecuteSpec.class);
        when(ok.then()).thenReturn(Mono.empty());
        when(failing.then()).thenReturn(Mono.error(new DataAccessResourceFailureException("boom")));
        when(db.sql(anyString())).thenReturn(ok);
        when(db.sql("TRUNCATE TABLE song")).thenReturn(failing);

        CatalogResetRepo repo = new CatalogResetRepo(db);

        // when
        StepVerifier.create(repo.truncateAll(OFF, ON))
                .expectError(DataAccessResourceFailureException.class)
                .verify();

        // then
        InOrder inOrder = inOrder(db);
        inOrder.verify(db).sql(OFF);
        inOrder.verify(db).sql("TRUNCATE TABLE song");
        inOrder.verify(db).sql(ON);
        verify(db, never()).sql("TRUNCATE TABLE album");
        verify(db, never()).sql("TRUNCATE TABLE artist");
    }

    @Test
    @DisplayName("H2: 채워진 DB를 비우면 모든 테이블이 0행이고 FK 검사는 다시 켜져 있다")
    void truncateAll_onH2_emptiesEveryTable_andReenablesIntegrity() {
        // given
        H2CatalogDatabase h2 = H2CatalogDatabase.create();
        long artistId = h2.ingestDb.artist.resolveId("A1").block();
        long genreId = h2.ingestDb.genre.resolveId("Pop").block();
        long songId = h2.ingestDb.song.insert(SongRow.single("S1", artistId, LocalDate.of(2008, 10, 1))).block();
        h2.ingestDb.songGenre.insert(songId, genreId).block();
        h2.ingestDb.userAccount.insert("u1").block();

        CatalogResetRepo repo = new CatalogResetRepo(h2.db);

        // when
        StepVerifier.create(h2.tx.transactional(
                        repo.truncateAll(H2CatalogDatabase.INTEGRITY_OFF_SQL, H2CatalogDatabase.INTEGRITY_ON_SQL)))
                .verifyComplete();

        // then
        for (String table : CatalogResetRepo.TABLES_IN_DELETE_ORDER) {
            assertThat(h2.count("SELECT COUNT(*) AS total FROM " + table)).as(table).isZero();
        }

        // FK 검사가 켜져 있으면 없는 artist를 참조하는 곡은 거부된다
        StepVerifier.create(h2.ingestDb.song.insert(SongRow.single("orphan", 9_999L, LocalDate.of(2020, 1, 1))))
                .expectError(DataIntegrityViolationException.class)
                .verify();
    }
}
