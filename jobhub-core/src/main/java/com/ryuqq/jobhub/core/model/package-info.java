/**
 * Core domain value types.
 *
 * <ul>
 *   <li>{@link com.ryuqq.jobhub.core.model.UserId} - authenticated owning identity of a connection</li>
 *   <li>{@link com.ryuqq.jobhub.core.model.ConnectionId} - transport channel identifier</li>
 *   <li>{@link com.ryuqq.jobhub.core.model.JobId} - background job identifier</li>
 *   <li>{@link com.ryuqq.jobhub.core.model.AgentType} - background agent kinds</li>
 * </ul>
 *
 * @since 1.0.0
 * @author JobHub Team
 */
package com.ryuqq.jobhub.core.model;
