package com.musicinsights.librarycatalog.infrastructure.input.ndjson;

import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * NDJSON 파일을 "한 줄씩" 읽기 위한 라인 리더입니다.
 * <p>
 * {@link BufferedReader#lines()}의 lazy 스트림을 {@link Flux#using}으로 감싸
 * 리더 생성 → 사용 → close를 Flux 라이프사이클에 맞춰 처리합니다.
 * <p>
 * 파일 I/O는 blocking 작업이므로 {@link Schedulers#boundedElastic()}에서 실행합니다.
 */
@Component
public class NdjsonLineReader {

    private final ResourceLoader resourceLoader;

    public NdjsonLineReader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    /**
     * NDJSON 파일을 한 줄씩 {@link Flux}로 반환합니다.
     *
     * @param location 파일 위치. 접두사가 없으면 classpath 기준이며 {@code file:}, {@code classpath:} 접두사를 허용
     * @return 파일의 각 라인을 순차적으로 방출하는 Flux
     */
    public Flux<String> readLines(String location) {
        return Flux.using(
                () -> open(location),
                br -> Flux.fromStream(br.lines()),
                NdjsonLineReader::close
        ).subscribeOn(Schedulers.boundedElastic());
    }

    private BufferedReader open(String location) throws IOException {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IOException("NDJSON resource not found: " + location);
        }
        return new BufferedReader(new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8));
    }

    private static void close(BufferedReader br) {
        try {
            br.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
