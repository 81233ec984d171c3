/**
 * 프로세스 간 갱신 손실이 없는 영속 키-값 저장소 패키지.
 *
 * <p><strong>주요 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.lockfile.core.store.AtomicStore}: 잠금 하에 읽기-수정-쓰기 수행</li>
 *   <li>{@link com.ryuqq.lockfile.core.store.StoreConfig}: 저장소 잠금 설정</li>
 *   <li>{@link com.ryuqq.lockfile.core.store.DocumentParseException}: 손상된 백업 문서</li>
 * </ul>
 *
 * @see com.ryuqq.lockfile.core.lock.MarkerLock
 * @author Lockfile Team
 * @since 1.0.0
 */
package com.ryuqq.lockfile.core.store;
