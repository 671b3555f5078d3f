/**
 * Unit (node) operation kinds and per-unit results.
 *
 * @since 1.0.0
 * @author Steward Team
 */
package com.ryuqq.steward.core.unit;
