package com.musicinsights.librarycatalog.bootstrap;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.core.env.Environment;

/**
 * 애플리케이션 시작 시점에 카탈로그 스키마(Flyway baseline)를 적용하는 설정 클래스입니다.
 *
 * <p>R2DBC는 Flyway를 직접 지원하지 않으므로 JDBC 접속 정보({@code spring.datasource.*})로
 * 별도 커넥션을 열어 {@link Flyway#migrate()}를 수행합니다.</p>
 */
@Configuration
@Profile("local")
public class FlywayRunner {

    private static final Logger log = LoggerFactory.getLogger(FlywayRunner.class);

    /**
     * 스키마 적용 Runner Bean. 시드 적재보다 먼저 실행되도록 가장 높은 우선순위를 가집니다.
     *
     * @param env application.yml 및 profile 설정을 조회하기 위한 {@link Environment}
     * @return Flyway 마이그레이션을 수행하는 {@link ApplicationRunner}
     */
    @Bean
    @Order(Ordered.HIGHEST_PRECEDENCE)
    ApplicationRunner migrateCatalogSchema(Environment env) {
        return args -> {
            Flyway flyway = Flyway.configure()
                    .dataSource(
                            env.getRequiredProperty("spring.datasource.url"),
                            env.getProperty("spring.datasource.username"),
                            env.getProperty("spring.datasource.password")
                    )
                    .locations(env.getProperty("spring.flyway.locations", "classpath:db/migration"))
                    .baselineOnMigrate(env.getProperty("spring.flyway.baseline-on-migrate", Boolean.class, false))
                    .baselineVersion(env.getProperty("spring.flyway.baseline-version", "0"))
                    .load();

            MigrateResult result = flyway.migrate();
            log.info("Catalog schema ready. executed={}, version={}",
                    result.migrationsExecuted, result.targetSchemaVersion);
        };
    }
}
