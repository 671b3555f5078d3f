/**
 * Orchestrated resource model and attribute merge rules.
 *
 * @since 1.0.0
 * @author Steward Team
 */
package com.ryuqq.steward.core.resource;
