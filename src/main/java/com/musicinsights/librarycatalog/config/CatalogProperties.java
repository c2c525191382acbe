package com.musicinsights.librarycatalog.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * {@code catalog.*} 설정값.
 *
 * @param reset 전체 삭제(reset) 관련 설정
 * @param seed  NDJSON 시드 적재 관련 설정
 */
@ConfigurationProperties(prefix = "catalog")
public record CatalogProperties(Reset reset, Seed seed) {

    public CatalogProperties {
        if (reset == null) reset = new Reset(null, null);
        if (seed == null) seed = new Seed(null, false);
    }

    /**
     * 세션 단위 참조 무결성(FK) 검사 on/off 구문.
     *
     * <p>기본값은 MySQL 구문이며, 다른 엔진에서는 해당 엔진의 구문으로 교체한다.</p>
     *
     * @param integrityOffSql FK 검사 중지 구문
     * @param integrityOnSql  FK 검사 재개 구문
     */
    public record Reset(String integrityOffSql, String integrityOnSql) {
        public Reset {
            if (integrityOffSql == null || integrityOffSql.isBlank()) integrityOffSql = "SET FOREIGN_KEY_CHECKS = 0";
            if (integrityOnSql == null || integrityOnSql.isBlank()) integrityOnSql = "SET FOREIGN_KEY_CHECKS = 1";
        }
    }

    /**
     * @param path       시드 파일 위치(classpath 기본, {@code file:} 접두사 허용)
     * @param resetFirst 적재 전에 전체 삭제를 먼저 수행할지 여부
     */
    public record Seed(String path, boolean resetFirst) {
        public Seed {
            if (path == null || path.isBlank()) path = "dataset/catalog-seed.ndjson";
        }
    }
}
