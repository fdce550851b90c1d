package com.ryuqq.jobhub.adapter.websocket.server;

import com.ryuqq.jobhub.core.model.ConnectionId;
import com.ryuqq.jobhub.core.spi.ConnectionChannel;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;

/**
 * Netty Channel 기반 {@link ConnectionChannel}.
 *
 * <p>쓰기는 Netty 이벤트 루프에 위임되며 채널 단위 FIFO 순서가 유지됩니다.</p>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
final class NettyConnectionChannel implements ConnectionChannel {

    private final Channel channel;
    private final ConnectionId id;

    NettyConnectionChannel(Channel channel) {
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        this.channel = channel;
        this.id = ConnectionId.of(channel.id().asLongText());
    }

    @Override
    public ConnectionId id() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return channel.isActive();
    }

    @Override
    public void sendText(String payload) {
        channel.writeAndFlush(new TextWebSocketFrame(payload));
    }

    @Override
    public void ping() {
        channel.writeAndFlush(new PingWebSocketFrame());
    }

    @Override
    public void terminate() {
        channel.close();
    }

    @Override
    public void close(int code, String reason) {
        channel.writeAndFlush(new CloseWebSocketFrame(code, reason)).addListener(ChannelFutureListener.CLOSE);
    }
}
