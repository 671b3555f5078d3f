/**
 * 환경(리소스) 조회 서비스.
 *
 * @since 1.0.0
 */
package com.ryuqq.steward.application.resource;
