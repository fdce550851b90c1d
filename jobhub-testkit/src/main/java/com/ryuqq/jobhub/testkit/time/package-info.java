/**
 * Deterministic time for tests.
 *
 * <p>{@link com.ryuqq.jobhub.testkit.time.VirtualTime} replaces both the wall clock and
 * the delay scheduler so rate-limit waits and retry backoff can be asserted to the
 * millisecond without sleeping.</p>
 */
package com.ryuqq.jobhub.testkit.time;
