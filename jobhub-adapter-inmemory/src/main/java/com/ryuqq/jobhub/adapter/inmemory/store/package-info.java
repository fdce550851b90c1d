/**
 * In-memory {@link com.ryuqq.jobhub.core.spi.JobStatusStore} implementation.
 *
 * <p>Intended for tests, local runs and single-node deployments where job history
 * does not need to survive a restart.</p>
 */
package com.ryuqq.jobhub.adapter.inmemory.store;
