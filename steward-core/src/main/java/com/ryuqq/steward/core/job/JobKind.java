package com.ryuqq.steward.core.job;

/**
 * Job 종류.
 *
 * @author Steward Team
 * @since 1.0.0
 */
public enum JobKind {

    ENVIRONMENT_CONFIGURE,

    ENVIRONMENT_BOOTSTRAP,

    ENVIRONMENT_DESTROY
}
