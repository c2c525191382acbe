package com.musicinsights.librarycatalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 음악 라이브러리 카탈로그 애플리케이션 진입점.
 *
 * <p>아티스트/장르/앨범/싱글/사용자/평점 적재와 분석 조회 API를 제공한다.</p>
 */
@SpringBootApplication
public class LibraryCatalogApplication {

    public static void main(String[] args) {
        SpringApplication.run(LibraryCatalogApplication.class, args);
    }
}
