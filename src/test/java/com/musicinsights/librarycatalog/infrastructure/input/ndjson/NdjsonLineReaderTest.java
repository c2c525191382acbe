package com.musicinsights.librarycatalog.infrastructure.input.ndjson;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link NdjsonLineReader} 단위 테스트.
 *
 * <p>classpath/파일 경로의 NDJSON을 라인 단위로 읽는 동작과 존재하지 않는 경로의 에러 처리를 검증한다.</p>
 */
@DisplayName("ndjson line reader 테스트")
class NdjsonLineReaderTest {

    private final NdjsonLineReader reader = new NdjsonLineReader(new DefaultResourceLoader());

    @DisplayName("classpath NDJSON을 빈 줄 포함 라인 단위로 읽는지 검증")
    @Test
    void readLines_classpathResource_emitsEveryLine() {
        StepVerifier.create(reader.readLines("dataset/catalog-sample.ndjson"))
                .assertNext(line -> {
                    assertTrue(line.startsWith("{"));
                    assertTrue(line.contains("\"user\""));
                })
                .assertNext(line -> assertTrue(line.isBlank()))
                .assertNext(line -> assertTrue(line.contains("\"single\"")))
                .verifyComplete();
    }

    @DisplayName("file: 접두사 경로를 UTF-8로 읽는지 검증")
    @Test
    void readLines_filePrefix_readsUtf8(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("seed.ndjson");
        Files.writeString(file, "{\"type\":\"user\",\"username\":\"지민\"}\n{\"type\":\"user\",\"username\":\"u2\"}\n",
                StandardCharsets.UTF_8);

        StepVerifier.create(reader.readLines("file:" + file.toAbsolutePath()).collectList())
                .assertNext(lines -> {
                    assertEquals(2, lines.size());
                    assertTrue(lines.get(0).contains("지민"));
                })
                .verifyComplete();
    }

    @DisplayName("존재하지 않는 파일 경로를 전달하면 에러 시그널을 방출하는지 검증")
    @Test
    void readLines_nonExistingFile_emitsError() {
        StepVerifier.create(reader.readLines("dataset/not-exist.ndjson"))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(IOException.class, e);
                    assertTrue(e.getMessage().contains("not-exist.ndjson"));
                })
                .verify();
    }

    @DisplayName("구독 전에는 파일을 열지 않는지 검증")
    @Test
    void readLines_isLazy() {
        // 구독하지 않으면 존재하지 않는 경로라도 예외가 나지 않는다.
        assertDoesNotThrow(() -> reader.readLines("dataset/not-exist.ndjson"));

        StepVerifier.create(reader.readLines("dataset/catalog-sample.ndjson").collectList())
                .assertNext(lines -> assertEquals(List.of(true, false, true),
                        lines.stream().map(l -> !l.isBlank()).toList()))
                .verifyComplete();
    }
}
