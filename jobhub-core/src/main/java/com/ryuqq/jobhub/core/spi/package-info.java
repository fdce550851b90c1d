/**
 * Service Provider Interfaces for the notification hub.
 *
 * <ul>
 *   <li>{@link com.ryuqq.jobhub.core.spi.ConnectionChannel} - transport handle of one live connection</li>
 *   <li>{@link com.ryuqq.jobhub.core.spi.CredentialVerifier} - handshake credential verification</li>
 *   <li>{@link com.ryuqq.jobhub.core.spi.EnvelopeCodec} - JSON wire codec</li>
 *   <li>{@link com.ryuqq.jobhub.core.spi.JobStatusStore} - durable job state, the reconciliation fallback</li>
 *   <li>{@link com.ryuqq.jobhub.core.spi.AgentStatusProvider} - synchronous agent status query</li>
 * </ul>
 *
 * @since 1.0.0
 * @author JobHub Team
 */
package com.ryuqq.jobhub.core.spi;
