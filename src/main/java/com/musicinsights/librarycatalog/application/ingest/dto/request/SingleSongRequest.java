package com.musicinsights.librarycatalog.application.ingest.dto.request;

import java.time.LocalDate;
import java.util.List;

/**
 * 싱글 곡 적재 요청 아이템.
 *
 * @param title       곡 제목
 * @param genres      장르 이름 목록(1개 이상 필요)
 * @param artist      아티스트 이름
 * @param releaseDate 싱글 발매일
 */
public record SingleSongRequest(
        String title,
        List<String> genres,
        String artist,
        LocalDate releaseDate
) {}
