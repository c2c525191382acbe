package com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc.row;

import java.time.LocalDate;

/**
 * album 테이블 INSERT용 Row 객체입니다.
 *
 * @param name        앨범명
 * @param artistId    소유 아티스트 id
 * @param releaseDate 앨범 발매일
 * @param genreId     앨범 장르 id
 */
public record AlbumRow(String name,
                       long artistId,
                       LocalDate releaseDate,
                       long genreId) {}
