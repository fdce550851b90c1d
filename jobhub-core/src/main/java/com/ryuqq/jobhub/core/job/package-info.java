/**
 * Agent job status model.
 *
 * <p>{@link com.ryuqq.jobhub.core.job.JobRecord} snapshots are immutable; each transition
 * produces a new record validated by {@link com.ryuqq.jobhub.core.job.JobStatusTransition}.</p>
 *
 * @since 1.0.0
 * @author JobHub Team
 */
package com.ryuqq.jobhub.core.job;
