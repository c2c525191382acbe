package com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc.row;

import java.time.LocalDate;

/**
 * song 테이블 INSERT용 Row 객체입니다.
 * <p>
 * albumId와 singleReleaseDate는 상호 배타적입니다. albumId가 없으면 싱글입니다.
 *
 * @param title             곡 제목
 * @param artistId          소유 아티스트 id
 * @param albumId           소속 앨범 id(싱글이면 null)
 * @param singleReleaseDate 싱글 발매일(앨범 수록곡이면 null)
 */
public record SongRow(String title,
                      long artistId,
                      Long albumId,
                      LocalDate singleReleaseDate) {

    public static SongRow single(String title, long artistId, LocalDate releaseDate) {
        return new SongRow(title, artistId, null, releaseDate);
    }

    public static SongRow albumTrack(String title, long artistId, long albumId) {
        return new SongRow(title, artistId, albumId, null);
    }
}
