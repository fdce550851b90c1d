package com.ryuqq.jobhub.adapter.websocket.server;

import com.ryuqq.jobhub.adapter.runner.connection.ConnectionRegistry;
import com.ryuqq.jobhub.adapter.runner.routing.MessageRouter;
import com.ryuqq.jobhub.application.dispatch.BroadcastDispatcher;
import com.ryuqq.jobhub.core.connection.Connection;
import com.ryuqq.jobhub.core.contract.MessageTypes;
import com.ryuqq.jobhub.core.contract.Notification;
import com.ryuqq.jobhub.core.model.UserId;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.util.AttributeKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 채널 단위 WebSocket 수명주기 처리.
 *
 * <p><strong>이벤트별 동작:</strong></p>
 * <ul>
 *   <li>핸드셰이크 완료: {@link HandshakeAuthenticationHandler}의 검증 결과가 없거나 실패면 1008 close,
 *       성공이면 Connection 등록 및 connection_established 전송</li>
 *   <li>텍스트 프레임: {@link MessageRouter}로 전달</li>
 *   <li>pong 프레임: Liveness 갱신</li>
 *   <li>채널 종료: Registry에서 제거</li>
 *   <li>WebSocket 경로가 아닌 HTTP 요청: 404</li>
 * </ul>
 *
 * <p>채널마다 새 인스턴스를 사용합니다.</p>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public final class WebSocketFrameHandler extends SimpleChannelInboundHandler<Object> {

    private static final Logger log = LoggerFactory.getLogger(WebSocketFrameHandler.class);

    static final AttributeKey<Connection> CONNECTION = AttributeKey.valueOf("jobhub.connection");
    static final String WELCOME_MESSAGE = "Real-time updates enabled";
    static final String AUTHENTICATION_REQUIRED = "Authentication required";

    private final ConnectionRegistry registry;
    private final BroadcastDispatcher dispatcher;
    private final MessageRouter router;

    public WebSocketFrameHandler(ConnectionRegistry registry, BroadcastDispatcher dispatcher, MessageRouter router) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        }
        if (router == null) {
            throw new IllegalArgumentException("router cannot be null");
        }
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.router = router;
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            onHandshakeComplete(ctx);
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    private void onHandshakeComplete(ChannelHandlerContext ctx) {
        UserId userId = ctx.channel().attr(HandshakeAuthenticationHandler.AUTHENTICATED_USER).get();
        if (userId == null) {
            String reason = ctx.channel().attr(HandshakeAuthenticationHandler.REJECTION_REASON).get();
            ctx.writeAndFlush(new CloseWebSocketFrame(
                    WebSocketCloseStatus.POLICY_VIOLATION.code(), reason == null ? AUTHENTICATION_REQUIRED : reason))
                .addListener(ChannelFutureListener.CLOSE);
            return;
        }

        Connection connection = Connection.of(userId, new NettyConnectionChannel(ctx.channel()));
        connection.markOpen();
        ctx.channel().attr(CONNECTION).set(connection);
        registry.register(userId, connection);
        log.info("{} connected as {} ({} connections for user)",
            connection.getId(), userId, registry.connectionCount(userId));

        Map<String, Object> welcome = new LinkedHashMap<>();
        welcome.put("userId", userId.getValue());
        welcome.put("message", WELCOME_MESSAGE);
        dispatcher.sendTo(connection, Notification.of(MessageTypes.CONNECTION_ESTABLISHED, welcome));
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        if (msg instanceof FullHttpRequest) {
            respondNotFound(ctx);
            return;
        }
        if (!(msg instanceof WebSocketFrame)) {
            return;
        }
        Connection connection = ctx.channel().attr(CONNECTION).get();
        if (connection == null) {
            // 인증 전 또는 거부된 채널
            return;
        }
        if (msg instanceof TextWebSocketFrame) {
            router.route(connection, ((TextWebSocketFrame) msg).text());
        } else if (msg instanceof PongWebSocketFrame) {
            connection.onPong();
        } else {
            log.debug("Ignoring {} from {}", msg.getClass().getSimpleName(), connection.getId());
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        Connection connection = ctx.channel().attr(CONNECTION).getAndSet(null);
        if (connection != null) {
            connection.markClosed();
            registry.unregister(connection.getUserId(), connection);
            log.info("{} of {} disconnected", connection.getId(), connection.getUserId());
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("Closing channel {} after error", ctx.channel().id().asShortText(), cause);
        ctx.close();
    }

    private static void respondNotFound(ChannelHandlerContext ctx) {
        FullHttpResponse response = new DefaultFullHttpResponse(
            HttpVersion.HTTP_1_1, HttpResponseStatus.NOT_FOUND, Unpooled.EMPTY_BUFFER);
        response.headers().set(HttpHeaderNames.CONTENT_LENGTH, 0);
        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
    }
}
