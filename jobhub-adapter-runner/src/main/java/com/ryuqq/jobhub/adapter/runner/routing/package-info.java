/**
 * Inbound control frame routing.
 *
 * <p>Recognized types are {@code ping}, {@code subscribe_to_jobs} and {@code get_agent_status};
 * everything else is logged and dropped.</p>
 *
 * @since 1.0.0
 * @author JobHub Team
 */
package com.ryuqq.jobhub.adapter.runner.routing;
