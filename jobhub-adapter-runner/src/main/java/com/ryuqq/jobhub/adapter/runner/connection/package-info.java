/**
 * Connection registry, handshake authentication and heartbeat liveness.
 *
 * @since 1.0.0
 * @author JobHub Team
 */
package com.ryuqq.jobhub.adapter.runner.connection;
