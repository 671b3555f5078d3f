package com.ryuqq.steward.adapter.runner;

/**
 * JobReaper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 만료 Job 정리 주기 (기본 60000ms = 1분)</li>
 *   <li>retentionMs: 종료된 Job을 조회 가능하게 유지할 기간 (기본 300000ms = 5분)</li>
 * </ul>
 *
 * @author Steward Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수여야 함)
 * @param retentionMs 보존 기간 (밀리초, 0 이상)
 */
public record JobReaperConfig(
    long scanIntervalMs,
    long retentionMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scanIntervalMs=60000ms (1분), retentionMs=300000ms (5분)</p>
     */
    public JobReaperConfig() {
        this(60000, 300000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public JobReaperConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
        if (retentionMs < 0) {
            throw new IllegalArgumentException(
                "retentionMs cannot be negative (current: " + retentionMs + ")"
            );
        }
    }

    /**
     * scanIntervalMs만 변경한 새 인스턴스 생성.
     */
    public JobReaperConfig withScanIntervalMs(long scanIntervalMs) {
        return new JobReaperConfig(scanIntervalMs, retentionMs);
    }

    /**
     * retentionMs만 변경한 새 인스턴스 생성.
     */
    public JobReaperConfig withRetentionMs(long retentionMs) {
        return new JobReaperConfig(scanIntervalMs, retentionMs);
    }
}
