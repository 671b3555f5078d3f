package com.ryuqq.steward.application.orchestrator;

import com.ryuqq.steward.core.job.JobKind;
import com.ryuqq.steward.core.unit.UnitOperation;

/**
 * 환경에 대해 수행할 수 있는 수명주기 작업.
 *
 * <table>
 *   <caption>작업별 동작</caption>
 *   <tr><th>작업</th><th>속성 저장</th><th>유닛 작업</th><th>전원 성공 시 환경 삭제</th></tr>
 *   <tr><td>CONFIGURE</td><td>O</td><td>CONVERGE</td><td>X</td></tr>
 *   <tr><td>BOOTSTRAP</td><td>O</td><td>BOOTSTRAP</td><td>X</td></tr>
 *   <tr><td>DESTROY</td><td>X</td><td>DESTROY</td><td>O</td></tr>
 * </table>
 *
 * @author Steward Team
 * @since 1.0.0
 */
public enum LifecycleOperation {

    CONFIGURE(JobKind.ENVIRONMENT_CONFIGURE, UnitOperation.CONVERGE, "configuration run", true, false),

    BOOTSTRAP(JobKind.ENVIRONMENT_BOOTSTRAP, UnitOperation.BOOTSTRAP, "bootstrap", true, false),

    DESTROY(JobKind.ENVIRONMENT_DESTROY, UnitOperation.DESTROY, "destroy", false, true);

    private final JobKind jobKind;
    private final UnitOperation unitOperation;
    private final String displayName;
    private final boolean persistsAttributes;
    private final boolean deletesOnSuccess;

    LifecycleOperation(JobKind jobKind, UnitOperation unitOperation, String displayName,
                       boolean persistsAttributes, boolean deletesOnSuccess) {
        this.jobKind = jobKind;
        this.unitOperation = unitOperation;
        this.displayName = displayName;
        this.persistsAttributes = persistsAttributes;
        this.deletesOnSuccess = deletesOnSuccess;
    }

    public JobKind jobKind() {
        return jobKind;
    }

    public UnitOperation unitOperation() {
        return unitOperation;
    }

    public boolean persistsAttributes() {
        return persistsAttributes;
    }

    public boolean deletesOnSuccess() {
        return deletesOnSuccess;
    }

    /**
     * 성공 메시지 (예: "Finished configuration run on 3 nodes").
     *
     * @param nodeCount 유닛 수
     * @return 메시지
     */
    public String successMessage(int nodeCount) {
        return "Finished " + displayName + " on " + nodeCount + " nodes";
    }

    /**
     * 실패 메시지 (예: "Configuration run failed on 1 nodes").
     *
     * @param failureCount 실패한 유닛 수
     * @return 메시지
     */
    public String failureMessage(int failureCount) {
        return Character.toUpperCase(displayName.charAt(0)) + displayName.substring(1)
            + " failed on " + failureCount + " nodes";
    }
}
