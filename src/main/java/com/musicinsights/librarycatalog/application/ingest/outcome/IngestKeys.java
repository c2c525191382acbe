package com.musicinsights.librarycatalog.application.ingest.outcome;

/**
 * reject 집합에 담기는 아이템 식별 키 모음.
 */
public final class IngestKeys {
    private IngestKeys() {}

    /**
     * 싱글 곡 키.
     *
     * @param title  곡 제목
     * @param artist 아티스트 이름
     */
    public record SongKey(String title, String artist) {}

    /**
     * 앨범 키.
     *
     * @param title  앨범명
     * @param artist 아티스트 이름
     */
    public record AlbumKey(String title, String artist) {}

    /**
     * 평점 키.
     *
     * @param username 평가자 이름
     * @param artist   아티스트 이름
     * @param song     곡 제목
     */
    public record RatingKey(String username, String artist, String song) {}
}
