package com.ryuqq.steward.adapter.runner;

import com.ryuqq.steward.core.spi.JobRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * JobReaper 유닛 테스트.
 *
 * @author Steward Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class JobReaperTest {

    @Mock
    private JobRegistry registry;

    @Mock
    private ScheduledExecutorService scheduler;

    private JobReaper reaper;

    @BeforeEach
    void setUp() {
        reaper = new JobReaper(registry, new JobReaperConfig());
    }

    @Test
    void scan_만료된_Job을_제거하고_개수를_반환함() {
        // given
        when(registry.purgeExpired()).thenReturn(3);
        when(registry.size()).thenReturn(1);

        // when
        int purged = reaper.scan();

        // then
        assertThat(purged).isEqualTo(3);
        verify(registry).purgeExpired();
    }

    @Test
    void scan_제거할_Job이_없으면_0() {
        // given
        when(registry.purgeExpired()).thenReturn(0);

        // when & then
        assertThat(reaper.scan()).isZero();
        verify(registry, never()).size();
    }

    @Test
    void scan_예외가_발생해도_전파하지_않고_0을_반환함() {
        // given
        when(registry.purgeExpired()).thenThrow(new IllegalStateException("registry unavailable"));

        // when & then
        assertThat(reaper.scan()).isZero();
    }

    @Test
    void start_설정된_주기로_스케줄링함() {
        // given
        JobReaper configured = new JobReaper(registry, new JobReaperConfig().withScanIntervalMs(1000));

        // when
        configured.start(scheduler);

        // then
        verify(scheduler).scheduleWithFixedDelay(any(Runnable.class), eq(1000L), eq(1000L), eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void constructor_의존성이_null이면_IllegalArgumentException() {
        // when & then
        assertThatThrownBy(() -> new JobReaper(null, new JobReaperConfig()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("registry cannot be null");
    }
}
