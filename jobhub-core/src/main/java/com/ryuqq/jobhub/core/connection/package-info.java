/**
 * Connection lifecycle and liveness markers.
 *
 * <p>A {@link com.ryuqq.jobhub.core.connection.Connection} wraps a transport
 * {@link com.ryuqq.jobhub.core.spi.ConnectionChannel} and owns its state machine
 * and liveness marker. Writes are serialized per connection.</p>
 *
 * @since 1.0.0
 * @author JobHub Team
 */
package com.ryuqq.jobhub.core.connection;
