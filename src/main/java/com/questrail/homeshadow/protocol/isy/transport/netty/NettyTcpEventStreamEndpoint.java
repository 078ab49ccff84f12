package com.questrail.homeshadow.protocol.isy.transport.netty;

import com.questrail.homeshadow.protocol.isy.config.IsyConnectionConfig;
import com.questrail.homeshadow.protocol.isy.transport.EventStreamProtocolException;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.SimpleChannelInboundHandler;

import java.nio.channels.ClosedChannelException;
import java.nio.charset.StandardCharsets;

/**
 * NettyTcpEventStreamEndpoint
 * =============================================================================
 * Event stream over a raw (optionally TLS) socket.
 *
 * <p>On connect a SOAP {@code Subscribe} with {@code REUSE_SOCKET} is written;
 * the controller then streams HTTP-framed messages on the same socket, split by
 * {@link EventStreamFrameDecoder}. On close an {@code Unsubscribe} is written
 * first when the stream id is known.</p>
 *
 * <p>A controller with no free subscriber slot may accept the subscription and
 * then drop the connection; an end of stream before a second frame arrives is
 * reported as that condition.</p>
 */
public final class NettyTcpEventStreamEndpoint extends AbstractNettyEventStreamEndpoint
{
    private volatile String streamId;
    private volatile int framesReceived;

    public NettyTcpEventStreamEndpoint(IsyConnectionConfig config) {
        super(config);
    }

    @Override
    public void streamIdAssigned(String streamId) {
        this.streamId = streamId;
    }

    @Override
    protected void configurePipeline(ChannelPipeline pipeline) {
        pipeline.addLast(new EventStreamFrameDecoder());
        pipeline.addLast(new InboundHandler());
    }

    @Override
    protected void onConnected(Channel channel) {
        String request = SubscriptionMessages.subscribe(config);
        channel.writeAndFlush(Unpooled.copiedBuffer(request, StandardCharsets.UTF_8))
                .addListener((ChannelFutureListener) f -> {
                    if (f.isSuccess()) {
                        fireTransportUp();
                    } else {
                        fireTransportDown(f.cause());
                    }
                });
    }

    @Override
    protected ChannelFuture beforeClose(Channel channel) {
        String sid = streamId;
        if (sid == null || sid.isEmpty()) {
            return null;
        }
        return channel.writeAndFlush(Unpooled.copiedBuffer(
                SubscriptionMessages.unsubscribe(config, sid), StandardCharsets.UTF_8));
    }

    private final class InboundHandler extends SimpleChannelInboundHandler<String>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, String frame) {
            framesReceived++;
            fireFrame(frame);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            if (framesReceived <= 1) {
                fireTransportDown(new EventStreamProtocolException(
                        "Event stream closed after subscribing; controller may have no free subscriber slot"));
            } else {
                fireTransportDown(new ClosedChannelException());
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            fireTransportDown(cause);
            ctx.close();
        }
    }
}
