/**
 * Caller-facing request model and its explicit validation result.
 *
 * @since 1.0.0
 * @author Steward Team
 */
package com.ryuqq.steward.core.request;
