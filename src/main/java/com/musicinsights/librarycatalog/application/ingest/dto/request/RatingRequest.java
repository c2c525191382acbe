package com.musicinsights.librarycatalog.application.ingest.dto.request;

import java.time.LocalDate;

/**
 * 평점 적재 요청 아이템.
 *
 * @param username 평가자 이름
 * @param artist   곡의 아티스트 이름
 * @param song     곡 제목
 * @param rating   평점(1..5)
 * @param ratedOn  평가일
 */
public record RatingRequest(
        String username,
        String artist,
        String song,
        Integer rating,
        LocalDate ratedOn
) {}
