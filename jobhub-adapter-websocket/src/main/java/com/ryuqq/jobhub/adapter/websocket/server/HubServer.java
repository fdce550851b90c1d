package com.ryuqq.jobhub.adapter.websocket.server;

import com.ryuqq.jobhub.adapter.runner.connection.ConnectionAuthenticator;
import com.ryuqq.jobhub.adapter.runner.connection.ConnectionRegistry;
import com.ryuqq.jobhub.adapter.runner.connection.LivenessMonitor;
import com.ryuqq.jobhub.adapter.runner.routing.MessageRouter;
import com.ryuqq.jobhub.adapter.websocket.config.HubServerConfig;
import com.ryuqq.jobhub.application.dispatch.BroadcastDispatcher;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Netty 기반 실시간 알림 WebSocket 서버.
 *
 * <p><strong>파이프라인 (채널별):</strong></p>
 * <ol>
 *   <li>{@link HttpServerCodec} / {@link HttpObjectAggregator}: 업그레이드 요청 수신</li>
 *   <li>{@link WebSocketServerProtocolHandler}: 핸드셰이크, ping 응답, close 처리</li>
 *   <li>{@link WebSocketFrameHandler}: 인증, 등록, 라우팅, 정리</li>
 * </ol>
 *
 * <p><strong>종료 순서 ({@link #stop()}):</strong> Liveness Monitor 중단 → 모든 연결 종료
 * → 서버 채널 닫기 → 이벤트 루프 종료.</p>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public final class HubServer {

    private static final Logger log = LoggerFactory.getLogger(HubServer.class);

    private static final long HANDSHAKE_TIMEOUT_MS = 10_000L;

    private final HubServerConfig config;
    private final ConnectionAuthenticator authenticator;
    private final ConnectionRegistry registry;
    private final BroadcastDispatcher dispatcher;
    private final MessageRouter router;
    private final LivenessMonitor livenessMonitor;
    private final ScheduledExecutorService scheduler;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    /**
     * 생성자.
     *
     * @param config 서버 설정
     * @param authenticator 핸드셰이크 인증기
     * @param registry 연결 Registry
     * @param dispatcher 전송 창구 (환영 메시지용)
     * @param router 수신 메시지 라우터
     * @param livenessMonitor 하트비트 감시자
     * @param scheduler 하트비트 tick 실행기 (수명은 호출자가 관리)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public HubServer(
        HubServerConfig config,
        ConnectionAuthenticator authenticator,
        ConnectionRegistry registry,
        BroadcastDispatcher dispatcher,
        MessageRouter router,
        LivenessMonitor livenessMonitor,
        ScheduledExecutorService scheduler
    ) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (authenticator == null) {
            throw new IllegalArgumentException("authenticator cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        }
        if (router == null) {
            throw new IllegalArgumentException("router cannot be null");
        }
        if (livenessMonitor == null) {
            throw new IllegalArgumentException("livenessMonitor cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.config = config;
        this.authenticator = authenticator;
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.router = router;
        this.livenessMonitor = livenessMonitor;
        this.scheduler = scheduler;
    }

    /**
     * 포트 바인드 및 하트비트 시작.
     *
     * @throws IllegalStateException 이미 실행 중인 경우
     * @throws InterruptedException 바인드 대기 중 인터럽트된 경우
     */
    public synchronized void start() throws InterruptedException {
        if (serverChannel != null) {
            throw new IllegalStateException("HubServer already started");
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        try {
            ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        configurePipeline(ch.pipeline());
                    }
                });
            serverChannel = bootstrap.bind(config.host(), config.port()).sync().channel();
        } catch (InterruptedException | RuntimeException e) {
            shutdownGroups();
            throw e;
        }
        livenessMonitor.start(scheduler);
        log.info("HubServer listening on {}:{}{}", config.host(), boundPort(), config.path());
    }

    void configurePipeline(ChannelPipeline pipeline) {
        WebSocketServerProtocolConfig protocolConfig = WebSocketServerProtocolConfig.newBuilder()
            .websocketPath(config.path())
            .checkStartsWith(true)
            .allowExtensions(true)
            .maxFramePayloadLength(config.maxFrameBytes())
            .handshakeTimeoutMillis(HANDSHAKE_TIMEOUT_MS)
            .dropPongFrames(false)
            .build();

        pipeline.addLast(new HttpServerCodec());
        pipeline.addLast(new HttpObjectAggregator(config.maxFrameBytes()));
        pipeline.addLast(new HandshakeAuthenticationHandler(authenticator));
        pipeline.addLast(new WebSocketServerProtocolHandler(protocolConfig));
        pipeline.addLast(new WebSocketFrameHandler(registry, dispatcher, router));
    }

    /**
     * 실제 바인드된 포트 (설정 포트가 0인 경우 확인용).
     *
     * @return 포트
     * @throws IllegalStateException 시작 전인 경우
     */
    public synchronized int boundPort() {
        if (serverChannel == null) {
            throw new IllegalStateException("HubServer not started");
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public synchronized boolean isRunning() {
        return serverChannel != null;
    }

    /**
     * 정상 종료. 여러 번 호출해도 안전합니다.
     */
    public synchronized void stop() {
        if (serverChannel == null) {
            return;
        }
        livenessMonitor.stop();
        int closed = registry.closeAll();
        serverChannel.close().syncUninterruptibly();
        serverChannel = null;
        shutdownGroups();
        log.info("HubServer stopped ({} connections closed)", closed);
    }

    private void shutdownGroups() {
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
            workerGroup = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
            bossGroup = null;
        }
    }
}
