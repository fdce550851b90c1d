package com.ryuqq.jobhub.adapter.websocket.server;

import com.ryuqq.jobhub.adapter.runner.codec.JacksonEnvelopeCodec;
import com.ryuqq.jobhub.adapter.runner.connection.ConnectionAuthenticator;
import com.ryuqq.jobhub.adapter.runner.connection.ConnectionRegistry;
import com.ryuqq.jobhub.adapter.runner.dispatch.RegistryBroadcastDispatcher;
import com.ryuqq.jobhub.adapter.runner.routing.MessageRouter;
import com.ryuqq.jobhub.core.connection.Connection;
import com.ryuqq.jobhub.core.connection.ConnectionState;
import com.ryuqq.jobhub.core.connection.Liveness;
import com.ryuqq.jobhub.core.contract.InboundFrame;
import com.ryuqq.jobhub.core.contract.MessageTypes;
import com.ryuqq.jobhub.core.error.AuthenticationException;
import com.ryuqq.jobhub.core.model.UserId;
import com.ryuqq.jobhub.testkit.time.VirtualTime;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.EmptyHttpHeaders;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.util.ReferenceCountUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * HandshakeAuthenticationHandler + WebSocketFrameHandler 유닛 테스트 (EmbeddedChannel).
 *
 * @author JobHub Team
 * @since 1.0.0
 */
class WebSocketFrameHandlerTest {

    private static final UserId ALICE = UserId.of("alice");

    private final JacksonEnvelopeCodec codec = new JacksonEnvelopeCodec();
    private ConnectionRegistry registry;
    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        VirtualTime time = new VirtualTime(1_700_000_000_000L);
        registry = new ConnectionRegistry();
        RegistryBroadcastDispatcher dispatcher = new RegistryBroadcastDispatcher(registry, codec, time);
        MessageRouter router = MessageRouter.withDefaultHandlers(
            codec, dispatcher, time, userId -> Map.of("leadgenAgent", Map.of("status", "idle")));
        ConnectionAuthenticator authenticator = new ConnectionAuthenticator(credential -> {
            if ("good-token".equals(credential)) {
                return ALICE;
            }
            throw new AuthenticationException("Invalid token");
        });
        channel = new EmbeddedChannel(
            new HandshakeAuthenticationHandler(authenticator),
            new UpgradeCompletingHandler(),
            new WebSocketFrameHandler(registry, dispatcher, router)
        );
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    private void completeHandshake(String uri) {
        FullHttpRequest upgrade = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, uri);
        upgrade.headers().set(HttpHeaderNames.UPGRADE, HttpHeaderValues.WEBSOCKET);
        channel.writeInbound(upgrade);
    }

    /**
     * WebSocketServerProtocolHandler 대역: 업그레이드 요청을 소비하고 HandshakeComplete 이벤트 발생.
     */
    private static final class UpgradeCompletingHandler extends ChannelInboundHandlerAdapter {

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg) {
            if (msg instanceof FullHttpRequest && ((FullHttpRequest) msg).headers().contains(HttpHeaderNames.UPGRADE)) {
                String uri = ((FullHttpRequest) msg).uri();
                ReferenceCountUtil.release(msg);
                ctx.fireUserEventTriggered(
                    new WebSocketServerProtocolHandler.HandshakeComplete(uri, EmptyHttpHeaders.INSTANCE, null));
                return;
            }
            ctx.fireChannelRead(msg);
        }
    }

    private InboundFrame readEnvelope() {
        TextWebSocketFrame frame = channel.readOutbound();
        try {
            return codec.decode(frame.text());
        } finally {
            frame.release();
        }
    }

    // ===================================================================
    // 핸드셰이크
    // ===================================================================

    @Test
    void 유효한_토큰이면_등록_후_환영_메시지_전송() {
        // when
        completeHandshake("/ws?token=good-token");

        // then
        assertThat(registry.connectionCount(ALICE)).isEqualTo(1);
        InboundFrame welcome = readEnvelope();
        assertThat(welcome.type()).isEqualTo(MessageTypes.CONNECTION_ESTABLISHED);
        assertThat(welcome.data())
            .containsEntry("userId", "alice")
            .containsEntry("message", "Real-time updates enabled");
    }

    @Test
    void 잘못된_토큰이면_1008로_종료하고_등록하지_않음() {
        // when
        completeHandshake("/ws?token=forged");

        // then
        CloseWebSocketFrame close = channel.readOutbound();
        assertThat(close.statusCode()).isEqualTo(1008);
        assertThat(close.reasonText()).isEqualTo("Invalid token");
        close.release();
        assertThat(channel.isOpen()).isFalse();
        assertThat(registry.connectionCount()).isZero();
    }

    @Test
    void 토큰은_업그레이드_요청에서_검증하고_검증_처리기는_제거됨() {
        // when
        completeHandshake("/ws?token=good-token");

        // then
        assertThat(channel.attr(HandshakeAuthenticationHandler.AUTHENTICATED_USER).get()).isEqualTo(ALICE);
        assertThat(channel.pipeline().get(HandshakeAuthenticationHandler.class)).isNull();
    }

    @Test
    void 거부_사유는_업그레이드_전에_기록됨() {
        // when
        FullHttpRequest upgrade = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/ws?token=forged");
        upgrade.headers().set(HttpHeaderNames.UPGRADE, HttpHeaderValues.WEBSOCKET);
        channel.pipeline().remove(UpgradeCompletingHandler.class);
        channel.pipeline().remove(WebSocketFrameHandler.class);
        channel.writeInbound(upgrade);

        // then
        assertThat(channel.attr(HandshakeAuthenticationHandler.REJECTION_REASON).get()).isEqualTo("Invalid token");
        assertThat(channel.attr(HandshakeAuthenticationHandler.AUTHENTICATED_USER).get()).isNull();
        FullHttpRequest forwarded = channel.readInbound();
        assertThat(forwarded.uri()).isEqualTo("/ws?token=forged");
        forwarded.release();
    }

    @Test
    void 검증_없이_핸드셰이크가_완료되면_1008로_종료() {
        // when
        channel.pipeline().fireUserEventTriggered(
            new WebSocketServerProtocolHandler.HandshakeComplete("/ws?token=good-token", EmptyHttpHeaders.INSTANCE, null));

        // then
        CloseWebSocketFrame close = channel.readOutbound();
        assertThat(close.statusCode()).isEqualTo(1008);
        assertThat(close.reasonText()).isEqualTo("Authentication required");
        close.release();
        assertThat(registry.connectionCount()).isZero();
    }

    @Test
    void 토큰이_없으면_1008로_종료() {
        completeHandshake("/ws");

        CloseWebSocketFrame close = channel.readOutbound();
        assertThat(close.statusCode()).isEqualTo(1008);
        assertThat(close.reasonText()).isEqualTo("Authentication required");
        close.release();
    }

    // ===================================================================
    // 프레임 처리
    // ===================================================================

    @Test
    void ping_메시지에_pong_응답() {
        // given
        completeHandshake("/ws?token=good-token");
        readEnvelope();

        // when
        channel.writeInbound(new TextWebSocketFrame("{\"type\":\"ping\"}"));

        // then
        InboundFrame pong = readEnvelope();
        assertThat(pong.type()).isEqualTo(MessageTypes.PONG);
        assertThat(pong.data()).containsEntry("timestamp", "2023-11-14T22:13:20Z");
    }

    @Test
    void 잘못된_JSON은_무시하고_연결_유지() {
        completeHandshake("/ws?token=good-token");
        readEnvelope();

        channel.writeInbound(new TextWebSocketFrame("{not json"));

        assertThat((Object) channel.readOutbound()).isNull();
        assertThat(channel.isOpen()).isTrue();
        assertThat(registry.connectionCount(ALICE)).isEqualTo(1);
    }

    @Test
    void pong_프레임은_Liveness_갱신() {
        // given
        completeHandshake("/ws?token=good-token");
        readEnvelope();
        Connection connection = registry.lookup(ALICE).iterator().next();
        connection.awaitPong();

        // when
        channel.writeInbound(new PongWebSocketFrame());

        // then
        assertThat(connection.getLiveness()).isEqualTo(Liveness.ALIVE);
    }

    @Test
    void 인증_전_프레임은_무시() {
        channel.writeInbound(new TextWebSocketFrame("{\"type\":\"ping\"}"));

        assertThat((Object) channel.readOutbound()).isNull();
    }

    // ===================================================================
    // 종료
    // ===================================================================

    @Test
    void 채널이_닫히면_Registry에서_제거() {
        // given
        completeHandshake("/ws?token=good-token");
        readEnvelope();
        Connection connection = registry.lookup(ALICE).iterator().next();

        // when
        channel.close();

        // then
        assertThat(registry.connectionCount()).isZero();
        assertThat(connection.getState()).isEqualTo(ConnectionState.CLOSED);
    }

    @Test
    void WebSocket_경로가_아닌_HTTP_요청은_404() {
        // when
        channel.writeInbound(new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/health"));

        // then
        FullHttpResponse response = channel.readOutbound();
        assertThat(response.status()).isEqualTo(HttpResponseStatus.NOT_FOUND);
        response.release();
    }
}
