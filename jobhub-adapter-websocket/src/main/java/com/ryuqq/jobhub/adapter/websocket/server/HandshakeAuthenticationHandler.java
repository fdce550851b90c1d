package com.ryuqq.jobhub.adapter.websocket.server;

import com.ryuqq.jobhub.adapter.runner.connection.ConnectionAuthenticator;
import com.ryuqq.jobhub.core.error.AuthenticationException;
import com.ryuqq.jobhub.core.model.UserId;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.util.AttributeKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * WebSocket 업그레이드 요청의 토큰 검증.
 *
 * <p>{@code WebSocketServerProtocolHandler} 앞에 위치하여 101 응답 전에 자격 증명을 검증하고,
 * 결과를 채널 속성으로 남긴 뒤 파이프라인에서 스스로 제거됩니다.</p>
 *
 * <ul>
 *   <li>성공: {@link #AUTHENTICATED_USER}</li>
 *   <li>실패: {@link #REJECTION_REASON} → {@link WebSocketFrameHandler}가 1008로 종료</li>
 * </ul>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
final class HandshakeAuthenticationHandler extends ChannelInboundHandlerAdapter {

    private static final Logger log = LoggerFactory.getLogger(HandshakeAuthenticationHandler.class);

    static final AttributeKey<UserId> AUTHENTICATED_USER = AttributeKey.valueOf("jobhub.authenticatedUser");
    static final AttributeKey<String> REJECTION_REASON = AttributeKey.valueOf("jobhub.rejectionReason");

    private final ConnectionAuthenticator authenticator;

    HandshakeAuthenticationHandler(ConnectionAuthenticator authenticator) {
        if (authenticator == null) {
            throw new IllegalArgumentException("authenticator cannot be null");
        }
        this.authenticator = authenticator;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (msg instanceof FullHttpRequest && isUpgrade((FullHttpRequest) msg)) {
            authenticate(ctx, ((FullHttpRequest) msg).uri());
            ctx.pipeline().remove(this);
        }
        ctx.fireChannelRead(msg);
    }

    private void authenticate(ChannelHandlerContext ctx, String requestUri) {
        try {
            UserId userId = authenticator.authenticate(requestUri);
            ctx.channel().attr(AUTHENTICATED_USER).set(userId);
        } catch (AuthenticationException e) {
            log.info("Refusing upgrade from {}: {}", ctx.channel().remoteAddress(), e.getMessage());
            ctx.channel().attr(REJECTION_REASON).set(e.getMessage());
        }
    }

    private static boolean isUpgrade(FullHttpRequest request) {
        return request.headers().containsValue(HttpHeaderNames.UPGRADE, HttpHeaderValues.WEBSOCKET, true);
    }
}
