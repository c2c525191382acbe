package com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc.row;

import java.time.LocalDate;

/**
 * rating 테이블 INSERT용 Row 객체입니다.
 *
 * @param userId      평가한 사용자 id
 * @param songId      평가 대상 곡 id
 * @param ratingValue 평점(1..5)
 * @param ratingDate  평가일
 */
public record RatingRow(long userId,
                        long songId,
                        int ratingValue,
                        LocalDate ratingDate) {}
