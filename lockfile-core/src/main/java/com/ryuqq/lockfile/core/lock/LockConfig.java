package com.ryuqq.lockfile.core.lock;

/**
 * MarkerLock 설정 (불변 record).
 *
 * <p>이 record는 MarkerLock의 대기 동작을 제어하는 설정값을 담고 있습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>timeoutMs: blocking acquire 최대 대기 시간 (기본 5000ms)</li>
 *   <li>retryIntervalMs: 획득 재시도 폴링 간격 (기본 50ms)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>낮은 지연: retryIntervalMs 감소 (50 → 10), 단 파일시스템 호출 증가</li>
 *   <li>긴 임계 구역: timeoutMs 증가</li>
 * </ul>
 *
 * @author Lockfile Team
 * @since 1.0.0
 * @param timeoutMs 최대 대기 시간 (밀리초, 양수여야 함)
 * @param retryIntervalMs 재시도 간격 (밀리초, 양수여야 함)
 */
public record LockConfig(long timeoutMs, long retryIntervalMs) {

    /**
     * 마커 파일 접미사. 마커 경로는 대상 경로 + 이 접미사.
     */
    public static final String MARKER_SUFFIX = ".lock";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: timeoutMs=5000ms, retryIntervalMs=50ms</p>
     */
    public LockConfig() {
        this(5000, 50);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException(
                "timeoutMs must be positive (current: " + timeoutMs + ")"
            );
        }
        if (retryIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "retryIntervalMs must be positive (current: " + retryIntervalMs + ")"
            );
        }
    }

    /**
     * timeoutMs만 변경한 새 인스턴스 생성.
     *
     * @param timeoutMs 새로운 최대 대기 시간 (밀리초)
     * @return 새 LockConfig 인스턴스
     */
    public LockConfig withTimeoutMs(long timeoutMs) {
        return new LockConfig(timeoutMs, retryIntervalMs);
    }

    /**
     * retryIntervalMs만 변경한 새 인스턴스 생성.
     *
     * @param retryIntervalMs 새로운 재시도 간격 (밀리초)
     * @return 새 LockConfig 인스턴스
     */
    public LockConfig withRetryIntervalMs(long retryIntervalMs) {
        return new LockConfig(timeoutMs, retryIntervalMs);
    }
}
