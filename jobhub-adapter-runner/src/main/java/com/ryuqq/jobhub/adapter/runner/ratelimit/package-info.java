/**
 * Fixed-window admission control.
 *
 * <p>{@link com.ryuqq.jobhub.adapter.runner.ratelimit.FixedWindowRateLimiter} keeps
 * second, minute and day windows and suspends callers asynchronously until every
 * window has room.</p>
 *
 * @since 1.0.0
 * @author JobHub Team
 */
package com.ryuqq.jobhub.adapter.runner.ratelimit;
