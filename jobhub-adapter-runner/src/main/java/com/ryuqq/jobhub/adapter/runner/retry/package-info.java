/**
 * Retry executor with rate-limit admission and exponential backoff.
 *
 * @since 1.0.0
 * @author JobHub Team
 */
package com.ryuqq.jobhub.adapter.runner.retry;
