package com.ryuqq.lockfile.core.model;

/**
 * 운영체제 프로세스 식별자 (PID).
 *
 * <p>마커 파일의 내용은 이 값의 10진수 문자열 표현 그대로이며,
 * 개행이나 공백을 포함하지 않습니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>양수만 허용 (0 및 음수 불가)</li>
 *   <li>{@link #parse(String)}: 10진수 숫자만 허용, 앞뒤 공백은 무시</li>
 * </ul>
 *
 * @author Lockfile Team
 * @since 1.0.0
 */
public final class ProcessId {

    private final long value;

    private ProcessId(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("ProcessId must be positive (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * ProcessId 생성.
     *
     * @param value PID 값
     * @return ProcessId 인스턴스
     * @throws IllegalArgumentException 양수가 아닌 경우
     */
    public static ProcessId of(long value) {
        return new ProcessId(value);
    }

    /**
     * 현재 JVM 프로세스의 ProcessId.
     *
     * @return 현재 프로세스 식별자
     */
    public static ProcessId current() {
        return new ProcessId(ProcessHandle.current().pid());
    }

    /**
     * 마커 파일 내용을 ProcessId로 해석.
     *
     * @param text 마커 파일 내용
     * @return ProcessId 인스턴스
     * @throws IllegalArgumentException 10진수 양수 PID가 아닌 경우 (손상된 마커)
     */
    public static ProcessId parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("ProcessId text cannot be null or blank");
        }
        String trimmed = text.strip();
        if (!trimmed.matches("^[0-9]+$")) {
            throw new IllegalArgumentException("ProcessId contains invalid characters: '" + trimmed + "'");
        }
        try {
            return new ProcessId(Long.parseLong(trimmed));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("ProcessId is out of range: '" + trimmed + "'", e);
        }
    }

    /**
     * PID 값 조회.
     *
     * @return PID 값
     */
    public long getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProcessId processId = (ProcessId) o;
        return value == processId.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    /**
     * 마커 파일에 기록되는 10진수 문자열.
     */
    @Override
    public String toString() {
        return Long.toString(value);
    }
}
