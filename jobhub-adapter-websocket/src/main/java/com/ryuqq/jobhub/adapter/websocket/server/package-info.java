/**
 * Netty WebSocket transport.
 *
 * <p>{@link com.ryuqq.jobhub.adapter.websocket.server.HubServer} binds the endpoint;
 * {@link com.ryuqq.jobhub.adapter.websocket.server.WebSocketFrameHandler} adapts each Netty
 * channel to a {@link com.ryuqq.jobhub.core.connection.Connection} and feeds the runner's
 * registry and router.</p>
 */
package com.ryuqq.jobhub.adapter.websocket.server;
