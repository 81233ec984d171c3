package com.ryuqq.lockfile.core.store;

import com.ryuqq.lockfile.core.lock.LockConfig;

/**
 * AtomicStore 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>lockConfig: 모든 저장소 연산이 사용하는 잠금 설정 (기본 timeout 2000ms, 재시도 50ms)</li>
 * </ul>
 *
 * @author Lockfile Team
 * @since 1.0.0
 * @param lockConfig 잠금 설정 (null 불가)
 */
public record StoreConfig(LockConfig lockConfig) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: timeoutMs=2000ms, retryIntervalMs=50ms</p>
     */
    public StoreConfig() {
        this(new LockConfig(2000, 50));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException lockConfig가 null인 경우
     */
    public StoreConfig {
        if (lockConfig == null) {
            throw new IllegalArgumentException("lockConfig cannot be null");
        }
    }

    /**
     * lockConfig만 변경한 새 인스턴스 생성.
     *
     * @param lockConfig 새로운 잠금 설정
     * @return 새 StoreConfig 인스턴스
     */
    public StoreConfig withLockConfig(LockConfig lockConfig) {
        return new StoreConfig(lockConfig);
    }
}
