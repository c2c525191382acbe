package com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc.repo;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;

/**
 * genre 테이블 Repository입니다.
 */
@Component
public class GenreRepo extends NameResolverSupport {

    public GenreRepo(DatabaseClient db) {
        super(db, "genre");
    }
}
