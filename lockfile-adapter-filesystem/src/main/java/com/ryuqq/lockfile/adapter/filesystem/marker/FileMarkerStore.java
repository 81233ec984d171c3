package com.ryuqq.lockfile.adapter.filesystem.marker;

import com.ryuqq.lockfile.core.spi.MarkerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 파일시스템 기반 {@link MarkerStore} 구현체.
 *
 * <p>마커는 대상 파일 옆의 일반 파일이며, 내용은 소유 프로세스의 10진수 PID입니다.</p>
 *
 * <p><strong>원자적 생성:</strong></p>
 * <pre>
 * 1. 같은 디렉토리에 임시 파일 생성 후 PID 기록
 * 2. Files.createLink(marker, staging) - 마커가 이미 있으면 FileAlreadyExistsException
 * 3. 임시 파일 삭제 (finally)
 * </pre>
 *
 * <p>하드 링크는 완전히 기록된 파일에 대해 한 번에 생성되므로, 다른 프로세스가
 * 내용 없는 마커를 관측하는 일이 없습니다. 하드 링크를 지원하지 않는 파일시스템에서는
 * {@link StandardOpenOption#CREATE_NEW}로 직접 생성합니다 (이 경우 생성 직후 잠시 빈 마커가 보일 수 있음).</p>
 *
 * <p><strong>임시 파일 정리:</strong> 1~2단계 사이에 프로세스가 강제 종료되면
 * {@code <marker>*.staging} 파일이 남습니다. 마커를 삭제할 때(해제, 회수) 같은 마커 이름의
 * 임시 파일 중 {@link #ABANDONED_STAGING_AGE}보다 오래된 것을 함께 지웁니다.
 * 진행 중인 생성의 임시 파일은 수 밀리초만 존재하므로 건드리지 않습니다.</p>
 *
 * @author Lockfile Team
 * @since 1.0.0
 */
public class FileMarkerStore implements MarkerStore {

    private static final Logger log = LoggerFactory.getLogger(FileMarkerStore.class);

    private static final String STAGING_SUFFIX = ".staging";

    /**
     * 이보다 오래된 임시 파일은 종료된 프로세스가 남긴 것으로 간주.
     */
    static final Duration ABANDONED_STAGING_AGE = Duration.ofMinutes(1);

    @Override
    public boolean createExclusive(Path marker, String content) throws IOException {
        if (marker == null) {
            throw new IllegalArgumentException("marker cannot be null");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }

        Path directory = directoryOf(marker);
        Files.createDirectories(directory);

        Path staging = Files.createTempFile(directory, marker.getFileName().toString(), STAGING_SUFFIX);
        try {
            Files.write(staging, content.getBytes(StandardCharsets.UTF_8));
            Files.createLink(marker, staging);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        } catch (UnsupportedOperationException e) {
            log.debug("Hard links not supported in {}, creating marker directly", directory);
            return createDirect(marker, content);
        } finally {
            Files.deleteIfExists(staging);
        }
    }

    @Override
    public Optional<String> read(Path marker) throws IOException {
        if (marker == null) {
            throw new IllegalArgumentException("marker cannot be null");
        }
        try {
            // 잘못된 바이트는 치환 문자로 읽혀 MALFORMED 판정으로 이어짐
            return Optional.of(new String(Files.readAllBytes(marker), StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    /**
     * 내용이 일치할 때만 마커 삭제.
     *
     * <p>비교와 삭제 사이에는 간격이 있으므로 경쟁 조건을 완전히 없애지는 못하고 줄이기만 합니다.</p>
     */
    @Override
    public boolean deleteIfContentEquals(Path marker, String expectedContent) throws IOException {
        if (expectedContent == null) {
            throw new IllegalArgumentException("expectedContent cannot be null");
        }
        Optional<String> current = read(marker);
        if (current.isEmpty() || !current.get().equals(expectedContent)) {
            return false;
        }
        boolean deleted = Files.deleteIfExists(marker);
        sweepAbandonedStaging(marker);
        return deleted;
    }

    @Override
    public boolean delete(Path marker) throws IOException {
        if (marker == null) {
            throw new IllegalArgumentException("marker cannot be null");
        }
        boolean deleted = Files.deleteIfExists(marker);
        sweepAbandonedStaging(marker);
        return deleted;
    }

    /**
     * 강제 종료된 생성 시도가 남긴 임시 파일 정리.
     *
     * <p>정리 실패는 마커 삭제 결과에 영향을 주지 않으며 경고 로그만 남깁니다.</p>
     */
    private void sweepAbandonedStaging(Path marker) {
        Path directory = directoryOf(marker);
        if (!Files.isDirectory(directory)) {
            return;
        }
        String prefix = marker.getFileName().toString();
        Instant cutoff = Instant.now().minus(ABANDONED_STAGING_AGE);
        DirectoryStream.Filter<Path> stagingOfMarker = candidate -> {
            String name = candidate.getFileName().toString();
            return name.startsWith(prefix) && name.endsWith(STAGING_SUFFIX);
        };

        try (DirectoryStream<Path> candidates = Files.newDirectoryStream(directory, stagingOfMarker)) {
            for (Path candidate : candidates) {
                removeIfOlderThan(candidate, cutoff);
            }
        } catch (IOException | DirectoryIteratorException e) {
            log.warn("Failed to scan {} for abandoned staging files", directory, e);
        }
    }

    private void removeIfOlderThan(Path staging, Instant cutoff) {
        try {
            if (Files.getLastModifiedTime(staging).toInstant().isBefore(cutoff) && Files.deleteIfExists(staging)) {
                log.debug("Removed abandoned staging file {}", staging);
            }
        } catch (NoSuchFileException e) {
            log.debug("Staging file {} already removed", staging);
        } catch (IOException e) {
            log.warn("Failed to remove abandoned staging file {}", staging, e);
        }
    }

    private static boolean createDirect(Path marker, String content) throws IOException {
        try {
            Files.write(marker, content.getBytes(StandardCharsets.UTF_8),
                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        }
    }

    private static Path directoryOf(Path marker) {
        return marker.toAbsolutePath().getParent();
    }
}
