/**
 * Retry contracts for calls to quota-constrained external services.
 *
 * @since 1.0.0
 * @author JobHub Team
 */
package com.ryuqq.jobhub.application.retry;
