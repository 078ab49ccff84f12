package com.questrail.homeshadow.protocol.isy.transport.netty;

import com.questrail.homeshadow.protocol.isy.config.IsyConnectionConfig;
import com.questrail.homeshadow.protocol.isy.transport.EventStreamProtocolException;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;

import java.nio.channels.ClosedChannelException;
import java.nio.charset.StandardCharsets;

/**
 * NettyWebSocketEventStreamEndpoint
 * =============================================================================
 * Event stream over the controller's {@code /rest/subscribe} websocket.
 *
 * <p>The upgrade request carries Basic authorization, the {@code ISYSUB}
 * sub-protocol and the controller's expected origin. A completed handshake is
 * the subscription; every text frame afterwards is one event frame. Ping,
 * pong and close frames are handled by Netty's protocol handler.</p>
 */
public final class NettyWebSocketEventStreamEndpoint extends AbstractNettyEventStreamEndpoint
{
    static final String SUBPROTOCOL = "ISYSUB";
    static final String ORIGIN = "com.universal-devices.websockets.isy";
    static final int MAX_FRAME_BYTES = 1024 * 1024;

    public NettyWebSocketEventStreamEndpoint(IsyConnectionConfig config) {
        super(config);
    }

    @Override
    protected void configurePipeline(ChannelPipeline pipeline) {
        HttpHeaders headers = new DefaultHttpHeaders();
        headers.set(HttpHeaderNames.AUTHORIZATION, config.basicAuthorization());
        headers.set(HttpHeaderNames.ORIGIN, ORIGIN);

        pipeline.addLast(new HttpClientCodec());
        pipeline.addLast(new HttpObjectAggregator(64 * 1024));
        pipeline.addLast(new WebSocketClientProtocolHandler(
                WebSocketClientHandshakerFactory.newHandshaker(
                        config.websocketUri(), WebSocketVersion.V13, SUBPROTOCOL, false, headers, MAX_FRAME_BYTES),
                true));
        pipeline.addLast(new WebSocketFrameAggregator(MAX_FRAME_BYTES));
        pipeline.addLast(new InboundHandler());
    }

    @Override
    protected void onConnected(Channel channel) {
        // the protocol handler starts the handshake when the channel becomes active
    }

    private final class InboundHandler extends SimpleChannelInboundHandler<WebSocketFrame>
    {
        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
            if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_COMPLETE) {
                fireTransportUp();
            } else if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_TIMEOUT) {
                fireTransportDown(new EventStreamProtocolException("Websocket handshake timed out"));
                ctx.close();
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
            if (frame instanceof TextWebSocketFrame) {
                fireFrame(((TextWebSocketFrame) frame).text());
            } else if (frame instanceof BinaryWebSocketFrame) {
                fireFrame(frame.content().toString(StandardCharsets.UTF_8));
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            fireTransportDown(new ClosedChannelException());
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            fireTransportDown(cause);
            ctx.close();
        }
    }
}
