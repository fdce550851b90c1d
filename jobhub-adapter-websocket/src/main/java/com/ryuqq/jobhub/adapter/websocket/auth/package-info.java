/**
 * JWT based {@link com.ryuqq.jobhub.core.spi.CredentialVerifier} (JJWT).
 */
package com.ryuqq.jobhub.adapter.websocket.auth;
