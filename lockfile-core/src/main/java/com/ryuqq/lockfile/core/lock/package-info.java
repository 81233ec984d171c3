/**
 * 파일시스템 기반 프로세스 간 잠금 패키지.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lockfile.core.lock.MarkerLock} - PID 기반 마커 파일 뮤텍스</li>
 *   <li>{@link com.ryuqq.lockfile.core.lock.LockHandle} - try-with-resources 범위 획득 핸들</li>
 *   <li>{@link com.ryuqq.lockfile.core.lock.LockConfig} - timeout / 재시도 간격 설정</li>
 *   <li>{@link com.ryuqq.lockfile.core.lock.MarkerState} - 기존 마커 판정 결과</li>
 *   <li>{@link com.ryuqq.lockfile.core.lock.AcquisitionException} - blocking 획득 timeout</li>
 * </ul>
 *
 * <h2>원자성 전제</h2>
 * <p>유일한 원자성 원시 연산은 "이미 존재하면 실패하는 생성"
 * ({@link com.ryuqq.lockfile.core.spi.MarkerStore#createExclusive})입니다.
 * 존재 확인 후 생성하는 방식은 사용하지 않습니다.</p>
 *
 * @author Lockfile Team
 * @since 1.0.0
 */
package com.ryuqq.lockfile.core.lock;
