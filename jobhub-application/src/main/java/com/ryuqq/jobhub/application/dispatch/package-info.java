/**
 * Outbound fan-out contract.
 *
 * <p>Callers hand a {@link com.ryuqq.jobhub.core.contract.Notification} to the
 * {@link com.ryuqq.jobhub.application.dispatch.BroadcastDispatcher}; the dispatcher stamps
 * the send time, serializes once and writes to each open connection.</p>
 *
 * @since 1.0.0
 * @author JobHub Team
 */
package com.ryuqq.jobhub.application.dispatch;
