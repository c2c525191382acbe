package com.musicinsights.librarycatalog.application.ingest.dto.request;

import java.time.LocalDate;
import java.util.List;

/**
 * 앨범 적재 요청 아이템.
 *
 * @param title       앨범명
 * @param genre       앨범 장르(수록곡 전체에 적용)
 * @param artist      아티스트 이름
 * @param releaseDate 앨범 발매일
 * @param songs       수록곡 제목 목록(순서 유지)
 */
public record AlbumRequest(
        String title,
        String genre,
        String artist,
        LocalDate releaseDate,
        List<String> songs
) {}
