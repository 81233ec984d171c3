package com.ryuqq.lockfile.adapter.filesystem.marker;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * FileMarkerStore 단위 테스트.
 *
 * @author Lockfile Team
 * @since 1.0.0
 */
class FileMarkerStoreTest {

    @TempDir
    Path tempDir;

    private final FileMarkerStore markerStore = new FileMarkerStore();

    @Test
    void 마커를_생성하면_PID만_기록된다() throws IOException {
        // Given
        Path marker = tempDir.resolve("myfile.txt.lock");

        // When
        boolean created = markerStore.createExclusive(marker, "12345");

        // Then
        assertThat(created).isTrue();
        assertThat(Files.readString(marker, StandardCharsets.UTF_8)).isEqualTo("12345");
        assertThat(markerStore.read(marker)).contains("12345");
    }

    @Test
    void 이미_존재하면_생성에_실패하고_내용은_유지된다() throws IOException {
        // Given
        Path marker = tempDir.resolve("myfile.txt.lock");
        markerStore.createExclusive(marker, "111");

        // When
        boolean created = markerStore.createExclusive(marker, "222");

        // Then
        assertThat(created).isFalse();
        assertThat(markerStore.read(marker)).contains("111");
    }

    @Test
    void 생성_후_임시_파일이_남지_않는다() throws IOException {
        // Given
        Path marker = tempDir.resolve("myfile.txt.lock");

        // When
        markerStore.createExclusive(marker, "111");
        markerStore.createExclusive(marker, "222");

        // Then
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files).containsExactly(marker);
        }
    }

    @Test
    void 상위_디렉토리가_없으면_생성한다() throws IOException {
        // Given
        Path marker = tempDir.resolve("nested").resolve("deeper").resolve("data.json.lock");

        // When
        boolean created = markerStore.createExclusive(marker, "7");

        // Then
        assertThat(created).isTrue();
        assertThat(marker).exists();
    }

    @Test
    void 없는_마커를_읽으면_빈_값이다() throws IOException {
        assertThat(markerStore.read(tempDir.resolve("missing.lock"))).isEmpty();
    }

    @Test
    void 내용이_다르면_조건부_삭제하지_않는다() throws IOException {
        // Given
        Path marker = tempDir.resolve("myfile.txt.lock");
        markerStore.createExclusive(marker, "111");

        // When
        boolean deleted = markerStore.deleteIfContentEquals(marker, "999");

        // Then
        assertThat(deleted).isFalse();
        assertThat(marker).exists();

        assertThat(markerStore.deleteIfContentEquals(marker, "111")).isTrue();
        assertThat(marker).doesNotExist();
        assertThat(markerStore.deleteIfContentEquals(marker, "111")).isFalse();
    }

    @Test
    void 무조건_삭제는_존재_여부를_반환한다() throws IOException {
        // Given
        Path marker = tempDir.resolve("myfile.txt.lock");
        markerStore.createExclusive(marker, "111");

        // When & Then
        assertThat(markerStore.delete(marker)).isTrue();
        assertThat(markerStore.delete(marker)).isFalse();
    }

    @Test
    void 삭제하면_오래된_임시_파일만_정리한다() throws IOException {
        // Given: 강제 종료된 생성 시도가 남긴 임시 파일과 진행 중인 생성의 임시 파일
        Path marker = tempDir.resolve("myfile.txt.lock");
        FileTime longAgo = FileTime.from(Instant.now().minus(Duration.ofHours(1)));
        Path abandoned = Files.createFile(tempDir.resolve("myfile.txt.lock1234.staging"));
        Files.setLastModifiedTime(abandoned, longAgo);
        Path inFlight = Files.createFile(tempDir.resolve("myfile.txt.lock5678.staging"));
        Path otherMarkers = Files.createFile(tempDir.resolve("other.txt.lock9.staging"));
        Files.setLastModifiedTime(otherMarkers, longAgo);
        markerStore.createExclusive(marker, "111");

        // When
        markerStore.delete(marker);

        // Then
        assertThat(marker).doesNotExist();
        assertThat(abandoned).doesNotExist();
        assertThat(inFlight).exists();
        assertThat(otherMarkers).exists();
    }

    @Test
    void 회수하면_오래된_임시_파일도_정리한다() throws IOException {
        // Given
        Path marker = tempDir.resolve("myfile.txt.lock");
        Path abandoned = Files.createFile(tempDir.resolve("myfile.txt.lock1234.staging"));
        Files.setLastModifiedTime(abandoned, FileTime.from(Instant.now().minus(Duration.ofHours(1))));
        markerStore.createExclusive(marker, "111");

        // When
        assertThat(markerStore.deleteIfContentEquals(marker, "111")).isTrue();

        // Then
        assertThat(abandoned).doesNotExist();
    }

    @Test
    void 상위_디렉토리가_없어도_삭제는_false를_반환한다() throws IOException {
        assertThat(markerStore.delete(tempDir.resolve("missing").resolve("x.lock"))).isFalse();
    }

    @Test
    void 동시에_생성하면_하나만_성공한다() throws Exception {
        // Given
        int contenders = 16;
        Path marker = tempDir.resolve("contended.lock");
        ExecutorService executorService = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        // When
        for (int i = 0; i < contenders; i++) {
            String content = String.valueOf(1000 + i);
            Callable<Boolean> attempt = () -> {
                start.await();
                return markerStore.createExclusive(marker, content);
            };
            results.add(executorService.submit(attempt));
        }
        start.countDown();

        int winners = 0;
        for (Future<Boolean> result : results) {
            if (result.get(30, TimeUnit.SECONDS)) {
                winners++;
            }
        }
        executorService.shutdown();

        // Then
        assertThat(winners).isEqualTo(1);
        assertThat(markerStore.read(marker).orElseThrow()).matches("10[0-9]{2}");
    }

    @Test
    void null_인자는_거부한다() {
        assertThatThrownBy(() -> markerStore.createExclusive(null, "1"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("marker cannot be null");
        assertThatThrownBy(() -> markerStore.createExclusive(tempDir.resolve("a.lock"), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("content cannot be null");
    }
}
