package com.ryuqq.steward.testkit.contract;

import com.ryuqq.steward.adapter.runner.OrchestratorConfig;
import com.ryuqq.steward.adapter.runner.StewardConfig;
import com.ryuqq.steward.adapter.runner.StewardContext;
import com.ryuqq.steward.core.job.FinalStatus;
import com.ryuqq.steward.core.job.JobResult;
import com.ryuqq.steward.core.job.JobState;
import com.ryuqq.steward.core.lock.LockConflictException;
import com.ryuqq.steward.core.model.ResourceId;
import com.ryuqq.steward.core.request.OrchestrationRequest;
import com.ryuqq.steward.core.unit.UnitOperation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: environment lifecycle scenarios end to end.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>A: destroy of an environment locked by another owner → LOCK-409, environment kept</li>
 *   <li>B: same with force → SUCCESS, environment gone</li>
 *   <li>C: configure 3 nodes with one failing → FAILURE 2/1, attributes persisted</li>
 *   <li>Bootstrap of every member, lock released afterwards</li>
 * </ul>
 *
 * @author Steward Team
 * @since 1.0.0
 */
class LifecycleScenarioContractTest extends AbstractContractTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private StewardContext context;

    @BeforeEach
    void setUpContext() {
        StewardConfig config = new StewardConfig()
                .withOrchestrator(new OrchestratorConfig("steward-B", 0, 2, 5000));
        context = StewardContext.create(config, recordStore, repository, unitExecutor, clock);
    }

    @AfterEach
    void closeContext() {
        if (context != null) {
            context.close();
        }
    }

    @Test
    void testScenarioA_DestroyLockedByOther_FailsWithConflict() {
        // Given
        ResourceId env = createEnvironment("destroy_me", "n1");
        assertTrue(lock.acquire(env, owner("A")));

        // When
        FinalStatus status = context.orchestrator()
                .destroy(OrchestrationRequest.forResource(env))
                .await(TIMEOUT).orElseThrow();

        // Then
        assertEquals(JobState.FAILURE, status.state());
        assertEquals(LockConflictException.ERROR_CODE, status.errorCode());
        assertEnvironmentExists(env, true);
        assertLockHeldBy(env, owner("A"));
        assertEquals(0, unitExecutor.callCount(), "No unit may be touched without the lock");
    }

    @Test
    void testScenarioB_DestroyLockedByOtherWithForce_Succeeds() {
        // Given
        ResourceId env = createEnvironment("destroy_me", "n1", "n2");
        assertTrue(lock.acquire(env, owner("A")));

        // When
        FinalStatus status = context.orchestrator()
                .destroy(OrchestrationRequest.forResource(env).withForce(true))
                .await(TIMEOUT).orElseThrow();

        // Then
        assertEquals(JobState.SUCCESS, status.state(), status.message());
        assertEquals(2, status.successCount());
        assertEnvironmentExists(env, false);
        assertUnlocked(env);
        assertTrue(unitExecutor.calls().stream()
                .allMatch(call -> call.operation() == UnitOperation.DESTROY));
    }

    @Test
    void testScenarioC_ConfigureWithOneFailingNode_PartialFailure() {
        // Given
        ResourceId env = createEnvironment("production", "n1", "n2", "n3");
        unitExecutor.failOn(unit("n2"));

        // When
        FinalStatus status = context.orchestrator()
                .configure(OrchestrationRequest.forResource(env).withAttributes(Map.of("x", "1")))
                .await(TIMEOUT).orElseThrow();

        // Then
        assertEquals(JobState.FAILURE, status.state());
        assertEquals(2, status.successCount());
        assertEquals(1, status.failureCount());
        assertEquals(List.of(unit("n2")), status.failedUnits());
        assertEquals(JobResult.UNIT_FAILURE, status.errorCode());
        assertEquals("1", repository.find(env).attributes().get("x"));
        assertEquals(3, unitExecutor.calledUnits().size(), "Every node must be attempted");
        assertUnlocked(env);
    }

    @Test
    void testBootstrap_AllNodesSucceed_LockReleased() {
        // Given
        ResourceId env = createEnvironment("staging", "web-1", "web-2");

        // When
        FinalStatus status = context.orchestrator()
                .bootstrap(OrchestrationRequest.forResource(env))
                .await(TIMEOUT).orElseThrow();

        // Then
        assertTrue(status.isSuccess());
        assertEquals("Finished bootstrap on 2 nodes", status.message());
        assertEnvironmentExists(env, true);
        assertUnlocked(env);
    }
}
