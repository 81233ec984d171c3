package com.ryuqq.lockfile.core.lock;

/**
 * 이미 존재하는 마커 파일의 판정 결과.
 *
 * <p><strong>판정 순서 (고정):</strong></p>
 * <pre>
 * 마커 읽기
 *    │
 *    ├─► 파일 없음            → ABSENT    (즉시 재시도)
 *    │
 *    ├─► PID 파싱 실패         → MALFORMED (삭제 후 즉시 재시도)
 *    │
 *    ├─► 살아있는 프로세스 없음 → STALE     (삭제 후 즉시 재시도)
 *    │
 *    └─► 살아있는 프로세스     → LIVE      (대기 또는 실패)
 * </pre>
 *
 * <p>파싱 검사는 항상 생존 검사보다 먼저 수행됩니다.
 * 손상된 마커를 살아있는 소유자로 오인하지 않기 위함입니다.</p>
 *
 * @author Lockfile Team
 * @since 1.0.0
 */
public enum MarkerState {

    /**
     * 생성 시도와 읽기 사이에 마커가 사라짐.
     */
    ABSENT,

    /**
     * 내용이 프로세스 식별자가 아님 (잘린 쓰기, 숫자가 아닌 텍스트).
     */
    MALFORMED,

    /**
     * 소유 프로세스가 더 이상 존재하지 않음.
     */
    STALE,

    /**
     * 살아있는 프로세스가 보유 중.
     */
    LIVE;

    /**
     * 대기 없이 삭제 후 재시도 가능한 상태인지 확인.
     *
     * @return MALFORMED 또는 STALE인 경우 true
     */
    public boolean isReclaimable() {
        return this == MALFORMED || this == STALE;
    }
}
