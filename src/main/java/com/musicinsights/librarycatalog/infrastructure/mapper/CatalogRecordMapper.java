package com.musicinsights.librarycatalog.infrastructure.mapper;

import com.musicinsights.librarycatalog.application.ingest.dto.request.AlbumRequest;
import com.musicinsights.librarycatalog.application.ingest.dto.request.RatingRequest;
import com.musicinsights.librarycatalog.application.ingest.dto.request.SingleSongRequest;
import com.musicinsights.librarycatalog.infrastructure.input.ndjson.CatalogRecordRaw;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.musicinsights.librarycatalog.infrastructure.input.ndjson.NormalizeUtils.*;

/**
 * {@link CatalogRecordRaw} 목록을 종류별 적재 배치로 변환한다.
 *
 * <p>알 수 없는 type은 건너뛰고 개수만 센다. 날짜 형식 오류 등 값 문제는 그대로 넘겨 적재 단계에서 거절되게 한다.</p>
 */
@Component
public class CatalogRecordMapper {

    /**
     * 종류별 적재 배치.
     *
     * @param users   사용자 이름 목록
     * @param singles 싱글 목록
     * @param albums  앨범 목록
     * @param ratings 평점 목록
     * @param skipped 알 수 없는 type으로 건너뛴 레코드 수
     */
    public record SeedBatch(
            List<String> users,
            List<SingleSongRequest> singles,
            List<AlbumRequest> albums,
            List<RatingRequest> ratings,
            int skipped
    ) {}

    public SeedBatch map(List<CatalogRecordRaw> records) {
        List<String> users = new ArrayList<>();
        List<SingleSongRequest> singles = new ArrayList<>();
        List<AlbumRequest> albums = new ArrayList<>();
        List<RatingRequest> ratings = new ArrayList<>();
        int skipped = 0;

        for (CatalogRecordRaw r : records) {
            String type = norm(r.type);
            switch (type == null ? "" : type.toLowerCase(Locale.ROOT)) {
                case "user" -> users.add(norm(r.username));
                case "single" -> singles.add(new SingleSongRequest(
                        norm(r.title),
                        (r.genres == null) ? null : normAll(r.genres),
                        norm(r.artist),
                        parseDateOrNull(r.releaseDate)
                ));
                case "album" -> albums.add(new AlbumRequest(
                        norm(r.title),
                        norm(r.genre),
                        norm(r.artist),
                        parseDateOrNull(r.releaseDate),
                        normAll(r.songs)
                ));
                case "rating" -> ratings.add(new RatingRequest(
                        norm(r.username),
                        norm(r.artist),
                        norm(r.song),
                        r.rating,
                        parseDateOrNull(r.ratedOn)
                ));
                default -> skipped++;
            }
        }

        return new SeedBatch(users, singles, albums, ratings, skipped);
    }
}
