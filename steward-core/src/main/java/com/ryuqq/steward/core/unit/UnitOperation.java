package com.ryuqq.steward.core.unit;

/**
 * 유닛(노드)에서 실행되는 원격 작업 종류.
 *
 * @author Steward Team
 * @since 1.0.0
 */
public enum UnitOperation {

    /**
     * 설정 관리 클라이언트 실행 (chef-client run 등).
     */
    CONVERGE("converge"),

    /**
     * 노드 부트스트랩.
     */
    BOOTSTRAP("bootstrap"),

    /**
     * 노드 제거.
     */
    DESTROY("destroy");

    private final String verb;

    UnitOperation(String verb) {
        this.verb = verb;
    }

    /**
     * 상태 메시지에 사용하는 동사.
     *
     * @return 소문자 동사 (예: converge)
     */
    public String verb() {
        return verb;
    }
}
