package com.musicinsights.librarycatalog.application.ingest;

import com.musicinsights.librarycatalog.infrastructure.persistence.r2dbc.repo.*;
import org.springframework.stereotype.Component;

/**
 * ingest 과정에서 사용하는 Repository들을 한 곳에 모아 제공하는 파사드(Facade) 컴포넌트입니다.
 * <p>
 * 서비스 레이어에서 다수의 Repo 의존성을 줄이고, 아이템 단위 적재 흐름을 읽기 쉽게 구성하기 위한 용도입니다.
 */
@Component
public class IngestFacade {

    /** artist 테이블 resolve */
    public final ArtistRepo artist;

    /** genre 테이블 resolve */
    public final GenreRepo genre;

    /** album 테이블 관련 작업 */
    public final AlbumRepo album;

    /** song 테이블 관련 작업 */
    public final SongRepo song;

    /** song_genre 조인 테이블 관련 작업 */
    public final SongGenreRepo songGenre;

    /** user_account 테이블 관련 작업 */
    public final UserAccountRepo userAccount;

    /** rating 테이블 관련 작업 */
    public final RatingRepo rating;

    public IngestFacade(
            ArtistRepo artist,
            GenreRepo genre,
            AlbumRepo album,
            SongRepo song,
            SongGenreRepo songGenre,
            UserAccountRepo userAccount,
            RatingRepo rating
    ) {
        this.artist = artist;
        this.genre = genre;

        this.album = album;
        this.song = song;
        this.songGenre = songGenre;

        this.userAccount = userAccount;
        this.rating = rating;
    }
}
