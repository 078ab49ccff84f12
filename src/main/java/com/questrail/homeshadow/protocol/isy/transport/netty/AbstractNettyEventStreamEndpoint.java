package com.questrail.homeshadow.protocol.isy.transport.netty;

import com.questrail.homeshadow.protocol.isy.config.IsyConnectionConfig;
import com.questrail.homeshadow.protocol.isy.transport.EventStreamEndpoint;
import com.questrail.homeshadow.protocol.isy.transport.EventStreamEndpointListener;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * AbstractNettyEventStreamEndpoint
 * =============================================================================
 * Connection lifecycle shared by the Netty event-stream endpoints.
 *
 * <h2>Architectural Role</h2>
 * Subclasses are <strong>pure transport adapters</strong>: they contribute the
 * protocol-specific pipeline and the subscription step. They MUST NOT decode
 * event frames, retry, or schedule timeouts.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Frames leave as {@code String}s.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #open()} connects asynchronously on a dedicated single-thread
 *       event loop group.</li>
 *   <li>{@link #close()} closes the channel and shuts the group down. It is
 *       idempotent, and suppresses every later listener callback.</li>
 *   <li>{@code onTransportDown} is delivered at most once.</li>
 * </ul>
 */
abstract class AbstractNettyEventStreamEndpoint implements EventStreamEndpoint
{
    private final Logger log = LoggerFactory.getLogger(getClass());

    protected final IsyConnectionConfig config;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;
    private final SslContext sslContext;

    private final AtomicBoolean opened = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicBoolean upNotified = new AtomicBoolean();
    private final AtomicBoolean downNotified = new AtomicBoolean();

    private volatile EventStreamEndpointListener listener;
    private volatile Channel channel;

    protected AbstractNettyEventStreamEndpoint(IsyConnectionConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.sslContext = config.secure() ? clientTls(config.trustAllCertificates()) : null;

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.connectTimeout().toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        if (sslContext != null) {
                            p.addLast(sslContext.newHandler(ch.alloc(), config.host(), config.port()));
                        }
                        configurePipeline(p);
                    }
                });
    }

    /**
     * Adds the protocol handlers after the optional TLS handler.
     */
    protected abstract void configurePipeline(ChannelPipeline pipeline);

    /**
     * Called on the event loop once the TCP connection is established.
     * Implementations send their subscription request and call
     * {@link #fireTransportUp()} when it is out.
     */
    protected abstract void onConnected(Channel channel);

    /**
     * Called from {@link #close()} while the channel is still open.
     *
     * @return a future the close waits on, or {@code null} to close immediately
     */
    protected ChannelFuture beforeClose(Channel channel) {
        return null;
    }

    @Override
    public void setListener(EventStreamEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void open() {
        if (listener == null) {
            throw new IllegalStateException("EventStreamEndpointListener must be set before open()");
        }
        if (!opened.compareAndSet(false, true)) {
            throw new IllegalStateException("Endpoint already opened");
        }

        log.debug("Connecting to {}:{}", config.host(), config.port());
        ChannelFuture f = bootstrap.connect(config.host(), config.port());
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channel = future.channel();
                if (closed.get()) {
                    future.channel().close();
                    return;
                }
                onConnected(future.channel());
            } else {
                fireTransportDown(future.cause());
            }
        });
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        Channel ch = channel;
        if (ch != null && ch.isActive()) {
            ChannelFuture pending = beforeClose(ch);
            if (pending != null) {
                pending.addListener((ChannelFutureListener) f -> f.channel().close());
            } else {
                ch.close();
            }
        } else if (ch != null) {
            ch.close();
        }

        group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }

    protected boolean isClosed() {
        return closed.get();
    }

    protected void fireTransportUp() {
        EventStreamEndpointListener l = listener;
        if (!closed.get() && l != null && upNotified.compareAndSet(false, true)) {
            l.onTransportUp();
        }
    }

    protected void fireFrame(String frame) {
        EventStreamEndpointListener l = listener;
        if (!closed.get() && l != null) {
            l.onFrame(frame);
        }
    }

    protected void fireTransportDown(Throwable cause) {
        EventStreamEndpointListener l = listener;
        if (!closed.get() && l != null && downNotified.compareAndSet(false, true)) {
            l.onTransportDown(unwrap(cause));
        }
    }

    private static Throwable unwrap(Throwable cause) {
        if (cause instanceof DecoderException && cause.getCause() != null) {
            return cause.getCause();
        }
        return cause;
    }

    private static SslContext clientTls(boolean trustAll) {
        try {
            SslContextBuilder builder = SslContextBuilder.forClient();
            if (trustAll) {
                builder.trustManager(InsecureTrustManagerFactory.INSTANCE);
            }
            return builder.build();
        } catch (SSLException e) {
            throw new IllegalStateException("Cannot create TLS context for event stream", e);
        }
    }
}
