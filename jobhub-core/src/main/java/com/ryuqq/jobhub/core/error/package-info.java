/**
 * Failure taxonomy for calls to quota-constrained external services.
 *
 * <h2>Taxonomy</h2>
 * <pre>
 * AUTHENTICATION  fatal, never retried
 * AUTHORIZATION   fatal unless explicitly flagged as a rate-limit signal
 * VALIDATION      fatal, caller bug
 * RATE_LIMITED    retryable, drives backoff
 * TRANSIENT       retryable, drives backoff
 * </pre>
 *
 * <p>Exhaustion is not a category: the executor reports the original last error unchanged.</p>
 *
 * @since 1.0.0
 * @author JobHub Team
 */
package com.ryuqq.jobhub.core.error;
