package com.ryuqq.steward.adapter.runner;

import java.util.Properties;

/**
 * 전체 설정 묶음 (불변 record).
 *
 * <p>{@link #fromProperties(Properties)}는 다음 키를 읽으며, 없는 키는 기본값을 사용합니다.</p>
 *
 * <table>
 *   <caption>설정 키</caption>
 *   <tr><th>키</th><th>기본값</th></tr>
 *   <tr><td>steward.identity</td><td>steward@호스트:PID</td></tr>
 *   <tr><td>steward.unit-concurrency</td><td>0 (제한 없음)</td></tr>
 *   <tr><td>steward.job-workers</td><td>4</td></tr>
 *   <tr><td>steward.shutdown-timeout-ms</td><td>30000</td></tr>
 *   <tr><td>steward.job-retention-ms</td><td>300000</td></tr>
 *   <tr><td>steward.reaper.scan-interval-ms</td><td>60000</td></tr>
 * </table>
 *
 * @author Steward Team
 * @since 1.0.0
 * @param orchestrator Orchestrator 설정
 * @param reaper JobReaper 설정 (보존 기간 포함)
 */
public record StewardConfig(
    OrchestratorConfig orchestrator,
    JobReaperConfig reaper
) {

    public static final String IDENTITY = "steward.identity";
    public static final String UNIT_CONCURRENCY = "steward.unit-concurrency";
    public static final String JOB_WORKERS = "steward.job-workers";
    public static final String SHUTDOWN_TIMEOUT_MS = "steward.shutdown-timeout-ms";
    public static final String JOB_RETENTION_MS = "steward.job-retention-ms";
    public static final String REAPER_SCAN_INTERVAL_MS = "steward.reaper.scan-interval-ms";

    /**
     * 기본 설정 생성자.
     */
    public StewardConfig() {
        this(new OrchestratorConfig(), new JobReaperConfig());
    }

    public StewardConfig {
        if (orchestrator == null) {
            throw new IllegalArgumentException("orchestrator cannot be null");
        }
        if (reaper == null) {
            throw new IllegalArgumentException("reaper cannot be null");
        }
    }

    /**
     * Properties로부터 설정 생성.
     *
     * @param properties 설정 원본
     * @return StewardConfig
     * @throws IllegalArgumentException 값이 숫자가 아니거나 검증에 실패한 경우
     */
    public static StewardConfig fromProperties(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        OrchestratorConfig defaults = new OrchestratorConfig();
        JobReaperConfig reaperDefaults = new JobReaperConfig();

        OrchestratorConfig orchestrator = new OrchestratorConfig(
            properties.getProperty(IDENTITY, defaults.identity()).trim(),
            intValue(properties, UNIT_CONCURRENCY, defaults.unitConcurrency()),
            intValue(properties, JOB_WORKERS, defaults.jobWorkers()),
            longValue(properties, SHUTDOWN_TIMEOUT_MS, defaults.shutdownTimeoutMs())
        );
        JobReaperConfig reaper = new JobReaperConfig(
            longValue(properties, REAPER_SCAN_INTERVAL_MS, reaperDefaults.scanIntervalMs()),
            longValue(properties, JOB_RETENTION_MS, reaperDefaults.retentionMs())
        );
        return new StewardConfig(orchestrator, reaper);
    }

    /**
     * 시스템 프로퍼티(-Dsteward.*)로부터 설정 생성.
     *
     * @return StewardConfig
     */
    public static StewardConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    public StewardConfig withOrchestrator(OrchestratorConfig orchestrator) {
        return new StewardConfig(orchestrator, reaper);
    }

    public StewardConfig withReaper(JobReaperConfig reaper) {
        return new StewardConfig(orchestrator, reaper);
    }

    private static int intValue(Properties properties, String key, int defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": '" + raw + "'", e);
        }
    }

    private static long longValue(Properties properties, String key, long defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": '" + raw + "'", e);
        }
    }
}
