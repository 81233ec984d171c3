package com.ryuqq.lockfile.core.lock;

import com.ryuqq.lockfile.core.model.ProcessId;
import com.ryuqq.lockfile.core.spi.MarkerStore;
import com.ryuqq.lockfile.core.spi.ProcessLivenessOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * PID 기반 파일시스템 뮤텍스.
 *
 * <p>대상 경로 {@code target}에 대해 마커 파일 {@code target.lock}을 원자적으로 생성하여
 * 프로세스 간 상호 배제를 보장합니다. 마커의 존재가 잠금 상태이며, 내용은 생성한 프로세스의 PID입니다.</p>
 *
 * <p><strong>획득 흐름:</strong></p>
 * <pre>
 * 1. createExclusive(marker, pid) 성공 → heldBySelf = true, 반환
 * 2. 이미 존재 → 마커 판정 ({@link MarkerState})
 *    - ABSENT    → 즉시 재시도
 *    - MALFORMED → 삭제 후 즉시 재시도 (대기 시간 소모 없음)
 *    - STALE     → 삭제 후 즉시 재시도 (대기 시간 소모 없음)
 *    - LIVE      → non-blocking: false 반환
 *                  blocking: 경과 시간 ≥ timeout 이면 AcquisitionException,
 *                            아니면 retryInterval 대기 후 재시도
 * </pre>
 *
 * <p><strong>재진입 불가:</strong> 이미 보유한 잠금을 다시 획득하면 다른 경쟁과 동일하게
 * non-blocking은 false, blocking은 timeout 후 예외가 발생합니다.</p>
 *
 * <p><strong>스레드 안전성:</strong></p>
 * <ul>
 *   <li>동일 인스턴스의 acquire 시도는 내부 {@link ReentrantLock}으로 직렬화
 *       (non-blocking은 tryLock, blocking은 남은 timeout 만큼만 대기)</li>
 *   <li>release는 직렬화 잠금을 사용하지 않음 (대기 중인 스레드가 있어도 보유자가 해제 가능)</li>
 *   <li>보유 표시 변경과 마커 삭제는 별도 상태 잠금으로 보호하며, 해제 시 표시를 먼저 지운 뒤 삭제</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * MarkerLock lock = new MarkerLock(target, new LockConfig(), markerStore, oracle);
 * try (LockHandle ignored = lock.lock()) {
 *     // target 파일 읽기/수정/쓰기
 * }
 * </pre>
 *
 * @author Lockfile Team
 * @since 1.0.0
 */
public class MarkerLock implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MarkerLock.class);

    private final Path targetPath;
    private final Path markerPath;
    private final LockConfig config;
    private final MarkerStore markerStore;
    private final ProcessLivenessOracle livenessOracle;
    private final ProcessId owner;
    private final String ownerText;

    private final ReentrantLock attemptLock = new ReentrantLock();
    private final ReentrantLock stateLock = new ReentrantLock();
    private volatile boolean heldBySelf;

    /**
     * 현재 프로세스를 소유자로 하는 생성자.
     *
     * @param targetPath 보호 대상 경로 (존재하지 않아도 됨)
     * @param config 설정
     * @param markerStore 마커 저장소
     * @param livenessOracle 프로세스 생존 확인
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public MarkerLock(Path targetPath, LockConfig config, MarkerStore markerStore, ProcessLivenessOracle livenessOracle) {
        this(targetPath, config, markerStore, livenessOracle, ProcessId.current());
    }

    /**
     * 소유자 PID를 지정하는 생성자.
     *
     * <p>인메모리 어댑터로 여러 프로세스를 한 JVM 안에서 시뮬레이션할 때 사용합니다.</p>
     *
     * @param targetPath 보호 대상 경로
     * @param config 설정
     * @param markerStore 마커 저장소
     * @param livenessOracle 프로세스 생존 확인
     * @param owner 마커에 기록할 PID
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public MarkerLock(Path targetPath, LockConfig config, MarkerStore markerStore,
                      ProcessLivenessOracle livenessOracle, ProcessId owner) {
        if (targetPath == null) {
            throw new IllegalArgumentException("targetPath cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (markerStore == null) {
            throw new IllegalArgumentException("markerStore cannot be null");
        }
        if (livenessOracle == null) {
            throw new IllegalArgumentException("livenessOracle cannot be null");
        }
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
        this.targetPath = targetPath;
        this.markerPath = markerPathFor(targetPath);
        this.config = config;
        this.markerStore = markerStore;
        this.livenessOracle = livenessOracle;
        this.owner = owner;
        this.ownerText = owner.toString();
    }

    /**
     * 대상 경로에 대응하는 마커 경로.
     *
     * @param targetPath 보호 대상 경로
     * @return {@code targetPath + ".lock"}
     */
    public static Path markerPathFor(Path targetPath) {
        return targetPath.resolveSibling(targetPath.getFileName() + LockConfig.MARKER_SUFFIX);
    }

    /**
     * 잠금 획득.
     *
     * @param blocking true이면 timeout까지 대기, false이면 경쟁 시 즉시 false 반환
     * @return 획득 성공 여부 (blocking 모드에서는 항상 true)
     * @throws AcquisitionException blocking 모드에서 timeout 초과 또는 인터럽트 시
     * @throws UncheckedIOException 마커 파일 입출력 실패 시
     */
    public boolean acquire(boolean blocking) {
        long startedAt = System.nanoTime();
        long timeoutNanos = TimeUnit.MILLISECONDS.toNanos(config.timeoutMs());

        if (!enterAttempt(blocking, timeoutNanos)) {
            return false;
        }
        try {
            while (true) {
                if (markerStore.createExclusive(markerPath, ownerText)) {
                    markHeld();
                    log.debug("Lock acquired: {} by {}", markerPath, owner);
                    return true;
                }

                Optional<String> content = markerStore.read(markerPath);
                MarkerState state = inspect(content);
                if (state == MarkerState.ABSENT) {
                    continue;
                }
                if (state.isReclaimable()) {
                    reclaim(state, content.get());
                    continue;
                }

                // LIVE
                if (!blocking) {
                    return false;
                }

                long elapsedNanos = System.nanoTime() - startedAt;
                if (elapsedNanos >= timeoutNanos) {
                    log.debug("Lock acquisition timed out: {} held by {}", markerPath, content.get().strip());
                    throw timedOut();
                }
                sleep(Math.min(TimeUnit.MILLISECONDS.toNanos(config.retryIntervalMs()), timeoutNanos - elapsedNanos));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to acquire lock: " + markerPath, e);
        } finally {
            attemptLock.unlock();
        }
    }

    /**
     * 설정된 timeout으로 blocking 획득 후 범위 핸들 반환.
     *
     * @return 닫을 때 잠금을 해제하는 핸들
     * @throws AcquisitionException timeout 초과 시
     */
    public LockHandle lock() {
        acquire(true);
        return new LockHandle(this);
    }

    /**
     * 잠금을 보유한 상태로 작업 실행.
     *
     * <p>작업이 예외를 던져도 잠금은 해제되며, 예외는 해제 후 그대로 전파됩니다.</p>
     *
     * @param action 임계 구역 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws AcquisitionException timeout 초과 시
     */
    public <T> T withLock(Supplier<T> action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        try (LockHandle ignored = lock()) {
            return action.get();
        }
    }

    /**
     * 잠금을 보유한 상태로 작업 실행 (결과 없음).
     *
     * @param action 임계 구역 작업
     * @throws AcquisitionException timeout 초과 시
     */
    public void runLocked(Runnable action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        try (LockHandle ignored = lock()) {
            action.run();
        }
    }

    /**
     * 잠금 해제.
     *
     * <p>이 인스턴스가 마커를 보유한 경우에만 삭제합니다. 보유하지 않은 경우 아무 동작도 하지 않습니다.</p>
     *
     * @throws UncheckedIOException 마커 삭제 실패 시
     */
    public void release() {
        stateLock.lock();
        try {
            if (!heldBySelf) {
                return;
            }
            // 소유 표시를 먼저 해제: 삭제 직후 같은 인스턴스의 대기 스레드가 획득해도 그 소유권을 지우지 않음
            heldBySelf = false;
            try {
                markerStore.delete(markerPath);
            } catch (IOException e) {
                heldBySelf = true;
                throw new UncheckedIOException("Failed to release lock: " + markerPath, e);
            }
        } finally {
            stateLock.unlock();
        }
        log.debug("Lock released: {} by {}", markerPath, owner);
    }

    /**
     * 보유 중인 마커가 있으면 해제.
     */
    @Override
    public void close() {
        release();
    }

    /**
     * 이 인스턴스가 잠금을 보유 중인지 확인.
     *
     * @return 보유 여부
     */
    public boolean isLocked() {
        return heldBySelf;
    }

    public Path getTargetPath() {
        return targetPath;
    }

    public Path getMarkerPath() {
        return markerPath;
    }

    public LockConfig getConfig() {
        return config;
    }

    public ProcessId getOwner() {
        return owner;
    }

    MarkerState inspect(Optional<String> content) {
        if (content.isEmpty()) {
            return MarkerState.ABSENT;
        }
        ProcessId holder;
        try {
            holder = ProcessId.parse(content.get());
        } catch (IllegalArgumentException e) {
            return MarkerState.MALFORMED;
        }
        return livenessOracle.isAlive(holder) ? MarkerState.LIVE : MarkerState.STALE;
    }

    /**
     * 같은 인스턴스의 획득 시도 직렬화 잠금 진입.
     *
     * <p>non-blocking은 대기하지 않고, blocking은 남은 timeout 안에서만 대기합니다.</p>
     */
    private boolean enterAttempt(boolean blocking, long timeoutNanos) {
        if (!blocking) {
            return attemptLock.tryLock();
        }
        try {
            if (!attemptLock.tryLock(timeoutNanos, TimeUnit.NANOSECONDS)) {
                log.debug("Lock acquisition timed out waiting for another thread of this instance: {}", markerPath);
                throw timedOut();
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AcquisitionException("Interrupted while acquiring lock: " + markerPath, e);
        }
    }

    private void markHeld() {
        stateLock.lock();
        try {
            heldBySelf = true;
        } finally {
            stateLock.unlock();
        }
    }

    private AcquisitionException timedOut() {
        return new AcquisitionException(
            "Lock acquisition timed out after " + config.timeoutMs() + "ms: " + markerPath
        );
    }

    private void reclaim(MarkerState state, String observed) throws IOException {
        if (markerStore.deleteIfContentEquals(markerPath, observed)) {
            log.warn("Removed {} lock marker {} (content: '{}')", state, markerPath, observed);
        }
    }

    private void sleep(long nanos) {
        try {
            TimeUnit.NANOSECONDS.sleep(nanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AcquisitionException("Interrupted while acquiring lock: " + markerPath, e);
        }
    }

    @Override
    public String toString() {
        return "MarkerLock{" + markerPath + ", locked=" + heldBySelf + '}';
    }
}
