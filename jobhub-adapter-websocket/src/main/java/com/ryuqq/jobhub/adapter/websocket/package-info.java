/**
 * Runnable WebSocket notification hub.
 *
 * <p>{@link com.ryuqq.jobhub.adapter.websocket.HubApplication} is the composition root:
 * it builds every component once and hands the notifiers and the resilient executor
 * to the code that reports job progress.</p>
 */
package com.ryuqq.jobhub.adapter.websocket;
