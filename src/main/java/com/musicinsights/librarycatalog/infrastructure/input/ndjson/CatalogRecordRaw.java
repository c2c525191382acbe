package com.musicinsights.librarycatalog.infrastructure.input.ndjson;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 시드 NDJSON의 "한 줄(= 한 레코드)"을 매핑하기 위한 원본 DTO입니다.
 * <p>
 * {@code type} 값에 따라 사용하는 필드가 다릅니다.
 * <ul>
 *     <li>{@code user}: username</li>
 *     <li>{@code single}: title, genres, artist, releaseDate</li>
 *     <li>{@code album}: title, genre, artist, releaseDate, songs</li>
 *     <li>{@code rating}: username, artist, song, rating, ratedOn</li>
 * </ul>
 * 추가 컬럼에 대비해 {@link JsonIgnoreProperties#ignoreUnknown()}를 사용합니다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogRecordRaw {

    /** 레코드 종류(user/single/album/rating) */
    @JsonProperty("type")
    public String type;

    /** 곡 또는 앨범 제목 */
    @JsonProperty("title")
    public String title;

    /** 싱글 장르 목록 */
    @JsonProperty("genres")
    public List<String> genres;

    /** 앨범 장르 */
    @JsonProperty("genre")
    public String genre;

    @JsonProperty("artist")
    public String artist;

    /** 발매일(문자열, 예: "2008-10-01") */
    @JsonProperty("releaseDate")
    public String releaseDate;

    /** 앨범 수록곡 제목 목록 */
    @JsonProperty("songs")
    public List<String> songs;

    @JsonProperty("username")
    public String username;

    /** 평가 대상 곡 제목 */
    @JsonProperty("song")
    public String song;

    @JsonProperty("rating")
    public Integer rating;

    /** 평가일(문자열) */
    @JsonProperty("ratedOn")
    public String ratedOn;
}
