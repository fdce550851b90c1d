/**
 * Runtime implementations of the job-notification pipeline.
 *
 * <h2>Packages</h2>
 * <ul>
 *   <li>{@code ratelimit}: fixed-window admission</li>
 *   <li>{@code retry}: rate-limited retry executor and backoff</li>
 *   <li>{@code connection}: registry, handshake authentication, liveness</li>
 *   <li>{@code routing}: inbound frame handlers</li>
 *   <li>{@code dispatch}: registry-backed fan-out</li>
 *   <li>{@code job}, {@code notify}: notification producers</li>
 *   <li>{@code codec}, {@code time}: JSON wire codec and scheduler-backed delays</li>
 * </ul>
 *
 * @since 1.0.0
 * @author JobHub Team
 */
package com.ryuqq.jobhub.adapter.runner;
