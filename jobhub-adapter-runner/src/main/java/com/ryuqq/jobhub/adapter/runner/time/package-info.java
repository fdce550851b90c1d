/**
 * Scheduler-backed {@link com.ryuqq.jobhub.core.time.Delayer}.
 *
 * @since 1.0.0
 * @author JobHub Team
 */
package com.ryuqq.jobhub.adapter.runner.time;
