package com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc.repo;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;

/**
 * artist 테이블 Repository입니다.
 * <p>
 * 앨범/싱글 적재 시 아티스트 이름을 id로 resolve(없으면 생성)하는 용도로 사용합니다.
 */
@Component
public class ArtistRepo extends NameResolverSupport {

    public ArtistRepo(DatabaseClient db) {
        super(db, "artist");
    }
}
