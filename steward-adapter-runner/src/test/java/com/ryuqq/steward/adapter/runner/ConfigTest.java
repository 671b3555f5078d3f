package com.ryuqq.steward.adapter.runner;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * OrchestratorConfig / JobReaperConfig / StewardConfig 테스트.
 *
 * @author Steward Team
 * @since 1.0.0
 */
class ConfigTest {

    @Test
    void orchestratorConfig_기본값() {
        // when
        OrchestratorConfig config = new OrchestratorConfig();

        // then
        assertThat(config.identity()).startsWith("steward@");
        assertThat(config.unitConcurrency()).isZero();
        assertThat(config.isUnboundedFanOut()).isTrue();
        assertThat(config.jobWorkers()).isEqualTo(4);
        assertThat(config.shutdownTimeoutMs()).isEqualTo(30000);
    }

    @Test
    void orchestratorConfig_with_메서드는_해당_값만_변경함() {
        // given
        OrchestratorConfig config = new OrchestratorConfig("a", 0, 4, 30000);

        // when
        OrchestratorConfig changed = config.withUnitConcurrency(8).withIdentity("b");

        // then
        assertThat(changed).isEqualTo(new OrchestratorConfig("b", 8, 4, 30000));
        assertThat(changed.isUnboundedFanOut()).isFalse();
    }

    @Test
    void orchestratorConfig_유효하지_않은_값이면_IllegalArgumentException() {
        // when & then
        assertThatThrownBy(() -> new OrchestratorConfig(" ", 0, 4, 30000))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new OrchestratorConfig("a", -1, 4, 30000))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("unitConcurrency");
        assertThatThrownBy(() -> new OrchestratorConfig("a", 0, 0, 30000))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("jobWorkers");
    }

    @Test
    void jobReaperConfig_기본값과_검증() {
        // when
        JobReaperConfig config = new JobReaperConfig();

        // then
        assertThat(config.scanIntervalMs()).isEqualTo(60000);
        assertThat(config.retentionMs()).isEqualTo(300000);
        assertThatThrownBy(() -> config.withScanIntervalMs(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.withRetentionMs(-1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fromProperties_steward_키를_읽고_없는_키는_기본값() {
        // given
        Properties properties = new Properties();
        properties.setProperty(StewardConfig.IDENTITY, "steward@ops-1");
        properties.setProperty(StewardConfig.UNIT_CONCURRENCY, "16");
        properties.setProperty(StewardConfig.JOB_RETENTION_MS, " 1000 ");

        // when
        StewardConfig config = StewardConfig.fromProperties(properties);

        // then
        assertThat(config.orchestrator().identity()).isEqualTo("steward@ops-1");
        assertThat(config.orchestrator().unitConcurrency()).isEqualTo(16);
        assertThat(config.orchestrator().jobWorkers()).isEqualTo(4);
        assertThat(config.reaper().retentionMs()).isEqualTo(1000);
        assertThat(config.reaper().scanIntervalMs()).isEqualTo(60000);
    }

    @Test
    void fromProperties_숫자가_아니면_키_이름을_포함한_IllegalArgumentException() {
        // given
        Properties properties = new Properties();
        properties.setProperty(StewardConfig.JOB_WORKERS, "many");

        // when & then
        assertThatThrownBy(() -> StewardConfig.fromProperties(properties))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("steward.job-workers");
    }

    @Test
    void fromProperties_int_범위를_넘는_값이면_잘리지_않고_IllegalArgumentException() {
        // given
        Properties properties = new Properties();
        properties.setProperty(StewardConfig.JOB_WORKERS, "4294967300");

        // when & then
        assertThatThrownBy(() -> StewardConfig.fromProperties(properties))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Invalid value for steward.job-workers: '4294967300'");
    }
}
