/**
 * Protection SPIs for quota-constrained external calls.
 *
 * <p>{@link com.ryuqq.jobhub.core.protection.RateLimiter} gates each attempt against
 * second, minute and day windows. The {@code noop} subpackage contains a pass-through
 * implementation.</p>
 *
 * @since 1.0.0
 * @author JobHub Team
 */
package com.ryuqq.jobhub.core.protection;
