package com.musicinsights.librarycatalog.application.ingest;

import com.musicinsights.librarycatalog.config.CatalogProperties;
import com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc.repo.CatalogResetRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

/**
 * 카탈로그 전체 데이터를 삭제하는 서비스입니다.
 * <p>
 * 하나의 트랜잭션(=하나의 커넥션) 안에서 FK 검사 중지 → 자식→부모 순 삭제 → FK 검사 재개를 수행합니다.
 * 배치 적재와 달리 실패를 삼키지 않고 호출자에게 전파합니다.
 */
@Service
public class CatalogResetService {

    private static final Logger log = LoggerFactory.getLogger(CatalogResetService.class);

    private final CatalogResetRepo resetRepo;
    private final CatalogProperties props;
    private final TransactionalOperator tx;

    public CatalogResetService(CatalogResetRepo resetRepo, CatalogProperties props, TransactionalOperator tx) {
        this.resetRepo = resetRepo;
        this.props = props;
        this.tx = tx;
    }

    /**
     * 모든 엔티티 테이블을 비웁니다.
     *
     * @return 완료 신호. 실패 시 롤백과 FK 검사 복구 후 에러를 그대로 전파
     */
    public Mono<Void> resetAll() {
        CatalogProperties.Reset reset = props.reset();

        return tx.transactional(Mono.defer(() ->
                        resetRepo.truncateAll(reset.integrityOffSql(), reset.integrityOnSql())))
                .doOnSuccess(v -> log.info("Catalog reset done. tables={}", CatalogResetRepo.TABLES_IN_DELETE_ORDER))
                .doOnError(e -> log.error("Catalog reset failed", e));
    }
}
