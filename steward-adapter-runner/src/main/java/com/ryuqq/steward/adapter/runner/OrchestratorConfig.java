package com.ryuqq.steward.adapter.runner;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * EnvironmentOrchestrator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>identity: 락 소유자로 기록될 이 프로세스의 식별자 (기본 steward@호스트:PID)</li>
 *   <li>unitConcurrency: 동시에 실행할 유닛 작업 수 (기본 0 = 제한 없음)</li>
 *   <li>jobWorkers: 오케스트레이션을 실행할 워커 스레드 수 (기본 4)</li>
 *   <li>shutdownTimeoutMs: 종료 시 실행 중 Job을 기다릴 최대 시간 (기본 30000ms)</li>
 * </ul>
 *
 * <p><strong>identity 주의사항:</strong> 서로 다른 프로세스가 같은 identity를 쓰면
 * 락이 재진입으로 간주되어 상호 배제가 깨집니다.</p>
 *
 * @author Steward Team
 * @since 1.0.0
 * @param identity 락 소유자 식별자 (null 또는 빈 문자열 불가)
 * @param unitConcurrency 유닛 동시 실행 수 (0 이상, 0은 제한 없음)
 * @param jobWorkers Job 워커 수 (1 이상)
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 양수)
 */
public record OrchestratorConfig(
    String identity,
    int unitConcurrency,
    int jobWorkers,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: identity=steward@호스트:PID, unitConcurrency=0 (제한 없음),
     * jobWorkers=4, shutdownTimeoutMs=30000ms</p>
     */
    public OrchestratorConfig() {
        this(defaultIdentity(), 0, 4, 30000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public OrchestratorConfig {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("identity cannot be null or blank");
        }
        if (unitConcurrency < 0) {
            throw new IllegalArgumentException(
                "unitConcurrency cannot be negative (current: " + unitConcurrency + ")"
            );
        }
        if (jobWorkers <= 0) {
            throw new IllegalArgumentException(
                "jobWorkers must be positive (current: " + jobWorkers + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * 유닛 동시 실행 수 제한이 없는지 확인.
     *
     * @return unitConcurrency가 0이면 true
     */
    public boolean isUnboundedFanOut() {
        return unitConcurrency == 0;
    }

    /**
     * identity만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withIdentity(String identity) {
        return new OrchestratorConfig(identity, unitConcurrency, jobWorkers, shutdownTimeoutMs);
    }

    /**
     * unitConcurrency만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withUnitConcurrency(int unitConcurrency) {
        return new OrchestratorConfig(identity, unitConcurrency, jobWorkers, shutdownTimeoutMs);
    }

    /**
     * jobWorkers만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withJobWorkers(int jobWorkers) {
        return new OrchestratorConfig(identity, unitConcurrency, jobWorkers, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new OrchestratorConfig(identity, unitConcurrency, jobWorkers, shutdownTimeoutMs);
    }

    static String defaultIdentity() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "localhost";
        }
        return "steward@" + host + ":" + ProcessHandle.current().pid();
    }
}
