/**
 * Wire contracts exchanged over a real-time connection.
 *
 * <p>Outbound messages are built by callers as
 * {@link com.ryuqq.jobhub.core.contract.Notification} (type + data) and stamped into a
 * {@link com.ryuqq.jobhub.core.contract.NotificationEnvelope} by the dispatcher at send time.
 * Inbound control frames decode into {@link com.ryuqq.jobhub.core.contract.InboundFrame}.</p>
 *
 * <h2>Wire format</h2>
 * <pre>
 * inbound:  { "type": "ping", "data": { } }
 * outbound: { "type": "pong", "data": { "timestamp": "..." }, "timestamp": "2025-01-01T00:00:00Z" }
 * </pre>
 *
 * @since 1.0.0
 * @author JobHub Team
 */
package com.ryuqq.jobhub.core.contract;
