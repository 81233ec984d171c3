/**
 * 파일시스템 마커 어댑터 패키지.
 *
 * <p><strong>주요 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.lockfile.adapter.filesystem.marker.FileMarkerStore}:
 *       하드 링크 기반 원자적 마커 생성</li>
 *   <li>{@link com.ryuqq.lockfile.adapter.filesystem.marker.ProcessHandleLivenessOracle}:
 *       {@link java.lang.ProcessHandle} 기반 프로세스 생존 확인</li>
 * </ul>
 *
 * @author Lockfile Team
 * @since 1.0.0
 */
package com.ryuqq.lockfile.adapter.filesystem.marker;
