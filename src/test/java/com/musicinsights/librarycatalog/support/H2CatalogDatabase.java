package com.musicinsights.librarycatalog.support;

import com.musicinsights.librarycatalog.application.ingest.CatalogIngestService;
import com.musicinsights.librarycatalog.application.ingest.CatalogResetService;
import com.musicinsights.librarycatalog.application.ingest.IngestFacade;
import com.musicinsights.librarycatalog.application.stats.repository.CatalogStatsRepository;
import com.musicinsights.librarycatalog.config.CatalogProperties;
import com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc.repo.*;
import io.r2dbc.spi.ConnectionFactories;
import io.r2dbc.spi.ConnectionFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 테스트용 인메모리 H2(MySQL 모드) 카탈로그 DB.
 *
 * <p>운영 스키마 스크립트({@code db/migration/V1__init_catalog.sql})를 그대로 실행하며,
 * 스프링 컨텍스트 없이 Repo/서비스를 직접 조립한다. 인스턴스마다 별도 DB를 사용한다.</p>
 */
public final class H2CatalogDatabase {

    public static final String INTEGRITY_OFF_SQL = "SET REFERENTIAL_INTEGRITY FALSE";
    public static final String INTEGRITY_ON_SQL = "SET REFERENTIAL_INTEGRITY TRUE";

    private static final AtomicInteger SEQ = new AtomicInteger();

    public final DatabaseClient db;
    public final TransactionalOperator tx;
    public final IngestFacade ingestDb;

    private H2CatalogDatabase(ConnectionFactory cf) {
        this.db = DatabaseClient.create(cf);
        this.tx = TransactionalOperator.create(new R2dbcTransactionManager(cf));
        this.ingestDb = new IngestFacade(
                new ArtistRepo(db),
                new GenreRepo(db),
                new AlbumRepo(db),
                new SongRepo(db),
                new SongGenreRepo(db),
                new UserAccountRepo(db),
                new RatingRepo(db)
        );
    }

    public static H2CatalogDatabase create() {
        String url = "r2dbc:h2:mem:///catalog_" + SEQ.incrementAndGet()
                + "?options=DB_CLOSE_DELAY=-1;MODE=MySQL;DATABASE_TO_LOWER=TRUE";
        ConnectionFactory cf = ConnectionFactories.get(url);

        new ResourceDatabasePopulator(new ClassPathResource("db/migration/V1__init_catalog.sql"))
                .populate(cf)
                .block();

        return new H2CatalogDatabase(cf);
    }

    public CatalogProperties properties() {
        return new CatalogProperties(
                new CatalogProperties.Reset(INTEGRITY_OFF_SQL, INTEGRITY_ON_SQL),
                null
        );
    }

    public CatalogIngestService ingestService() {
        return new CatalogIngestService(ingestDb, tx);
    }

    public CatalogResetService resetService() {
        return new CatalogResetService(new CatalogResetRepo(db), properties(), tx);
    }

    public CatalogStatsRepository statsRepository() {
        return new CatalogStatsRepository(db);
    }

    /**
     * 단순 COUNT 조회.
     *
     * @param sql {@code SELECT COUNT(*) AS total ...} 형태의 SQL
     * @return 행 수
     */
    public long count(String sql) {
        Long n = db.sql(sql)
                .map((row, meta) -> row.get("total", Number.class).longValue())
                .one()
                .block();
        return (n == null) ? 0L : n;
    }
}
