package com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc.config;

import com.musicinsights.librarycatalog.config.CatalogProperties;
import io.r2dbc.spi.ConnectionFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.transaction.ReactiveTransactionManager;
import org.springframework.transaction.reactive.TransactionalOperator;

/**
 * R2DBC 리액티브 트랜잭션 설정.
 * <p>
 * 적재 서비스는 아이템 1건마다 {@link TransactionalOperator#transactional}으로 트랜잭션 경계를 잡는다.
 * 같은 {@link ConnectionFactory}를 쓰는 DatabaseClient 호출은 해당 트랜잭션의 커넥션에 묶인다.
 */
@Configuration
@EnableConfigurationProperties(CatalogProperties.class)
public class R2dbcTxConfig {

    /**
     * @param cf R2DBC {@link ConnectionFactory}
     * @return 리액티브 트랜잭션 매니저
     */
    @Bean
    public ReactiveTransactionManager reactiveTransactionManager(ConnectionFactory cf) {
        return new R2dbcTransactionManager(cf);
    }

    /**
     * 아이템 단위 트랜잭션(commit/rollback 브래킷)을 코드로 적용하기 위한 operator.
     *
     * @param tm 리액티브 트랜잭션 매니저
     * @return 트랜잭션 적용용 operator
     */
    @Bean
    public TransactionalOperator transactionalOperator(ReactiveTransactionManager tm) {
        return TransactionalOperator.create(tm);
    }
}
