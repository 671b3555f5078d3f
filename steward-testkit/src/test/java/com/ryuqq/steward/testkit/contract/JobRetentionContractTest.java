package com.ryuqq.steward.testkit.contract;

import com.ryuqq.steward.adapter.runner.JobReaper;
import com.ryuqq.steward.adapter.runner.JobReaperConfig;
import com.ryuqq.steward.application.job.JobManager;
import com.ryuqq.steward.application.job.JobSubmission;
import com.ryuqq.steward.core.error.JobNotFoundException;
import com.ryuqq.steward.core.job.JobKind;
import com.ryuqq.steward.core.job.JobState;
import com.ryuqq.steward.core.job.Ticket;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: Job Retention.
 *
 * <p>A ticket keeps resolving after its job terminates until the retention period has
 * elapsed; afterwards the job is gone, whether removed lazily on lookup or by the reaper.</p>
 *
 * @author Steward Team
 * @since 1.0.0
 */
class JobRetentionContractTest extends AbstractContractTest {

    private JobManager jobManager;

    @BeforeEach
    void setUpManager() {
        jobManager = new JobManager(jobRegistry, clock);
    }

    private Ticket runToCompletion(JobKind kind) {
        JobSubmission submission = jobManager.submit(kind);
        submission.job().markRunning("Working");
        submission.job().succeed("Done");
        jobManager.terminate(submission.job());
        return submission.ticket();
    }

    @Test
    void testRetention_WithinPeriod_TicketResolves() {
        // Given
        Ticket ticket = runToCompletion(JobKind.ENVIRONMENT_CONFIGURE);

        // When
        clock.advance(Duration.ofMinutes(4));

        // Then
        assertEquals(JobState.SUCCESS, ticket.poll().state());
        assertTrue(ticket.await(Duration.ZERO).isPresent());
        assertTrue(jobManager.active().isEmpty(), "Terminated job must not be listed as active");
    }

    @Test
    void testRetention_AfterPeriod_TicketNotFound() {
        // Given
        Ticket ticket = runToCompletion(JobKind.ENVIRONMENT_BOOTSTRAP);

        // When
        clock.advance(Duration.ofMinutes(5));

        // Then
        assertThrows(JobNotFoundException.class, ticket::poll);
        assertThrows(JobNotFoundException.class, () -> jobManager.ticket(ticket.getJobId()));
    }

    @Test
    void testRetention_ActiveJob_NeverExpires() {
        // Given
        JobSubmission submission = jobManager.submit(JobKind.ENVIRONMENT_DESTROY);
        submission.job().markRunning("Working");

        // When
        clock.advance(Duration.ofHours(1));

        // Then
        assertEquals(JobState.RUNNING, submission.ticket().poll().state());
        assertEquals(1, jobManager.active().size());
    }

    @Test
    void testReaper_Scan_PurgesOnlyExpiredJobs() {
        // Given
        runToCompletion(JobKind.ENVIRONMENT_CONFIGURE);
        runToCompletion(JobKind.ENVIRONMENT_CONFIGURE);
        clock.advance(Duration.ofMinutes(3));
        Ticket recent = runToCompletion(JobKind.ENVIRONMENT_BOOTSTRAP);
        clock.advance(Duration.ofMinutes(3));
        JobReaper reaper = new JobReaper(jobRegistry, new JobReaperConfig());

        // When
        int purged = reaper.scan();

        // Then
        assertEquals(2, purged);
        assertEquals(1, jobRegistry.size());
        assertEquals(JobState.SUCCESS, recent.poll().state());
        assertEquals(0, reaper.scan(), "Second scan should be a no-op");
    }
}
