package com.questrail.lcn.protocol.pck.transport.tcp.netty;

import com.questrail.lcn.protocol.pck.transport.LineEndpoint;
import com.questrail.lcn.protocol.pck.transport.LineEndpointListener;
import com.questrail.lcn.protocol.pck.transport.PckCharsets;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.TooLongFrameException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyTcpLineEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link LineEndpoint} port for a TCP
 * connection to a PCK gateway.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It frames the
 * stream into lines ({@link LineBasedFrameDecoder}, which also strips a
 * preceding {@code \r}), decodes them with {@link PckCharsets} and forwards
 * them to the port listener. Lines longer than {@value #MAX_LINE_LENGTH}
 * bytes are dropped with a warning; the connection stays up. Outbound
 * lines are encoded as UTF-8 and terminated with {@code \n}.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #start()} creates a fresh event loop group and connects.</li>
 *   <li>{@link #stop()} closes the channel and shuts the group down.</li>
 *   <li>The endpoint can be started again after it went down.</li>
 * </ul>
 */
public final class NettyTcpLineEndpoint implements LineEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyTcpLineEndpoint.class);

    /** Longest accepted inbound line; longer lines are discarded. */
    private static final int MAX_LINE_LENGTH = 1024;

    private final InetSocketAddress remoteAddress;
    private final Duration connectTimeout;

    private volatile LineEndpointListener listener;
    private volatile EventLoopGroup group;
    private volatile Channel channel;

    private final AtomicBoolean up = new AtomicBoolean(false);

    public NettyTcpLineEndpoint(InetSocketAddress remoteAddress, Duration connectTimeout)
    {
        this.remoteAddress = Objects.requireNonNull(remoteAddress, "remoteAddress");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    }

    @Override
    public void setListener(LineEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public synchronized void start()
    {
        LineEndpointListener l = requireListener();
        if (group != null) {
            throw new IllegalStateException("Endpoint already started");
        }

        EventLoopGroup g = new NioEventLoopGroup(1);
        group = g;

        Bootstrap bootstrap = new Bootstrap()
                .group(g)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new LineBasedFrameDecoder(MAX_LINE_LENGTH, true, false));
                        p.addLast(new InboundHandler());
                    }
                });

        log.info("Connecting to PCK gateway at {}", remoteAddress);
        ChannelFuture f = bootstrap.connect(remoteAddress);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channel = future.channel();
                up.set(true);
                l.onTransportUp();
            }
            else {
                log.warn("Connection to {} failed: {}", remoteAddress, future.cause().toString());
                shutdownGroup();
                l.onTransportDown(future.cause());
            }
        });
    }

    @Override
    public synchronized void stop()
    {
        Channel ch = channel;
        channel = null;
        if (ch != null) {
            ch.close();
        }
        shutdownGroup();
        notifyDown(null);
    }

    @Override
    public void send(String line)
    {
        Objects.requireNonNull(line, "line");

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            log.debug("Transport down; dropping line {}", line);
            return;
        }

        ByteBuf buf = Unpooled.wrappedBuffer(PckCharsets.encode(line + "\n"));
        ch.writeAndFlush(buf);
    }

    private void notifyDown(Throwable cause)
    {
        if (!up.compareAndSet(true, false)) {
            return;
        }
        LineEndpointListener l = listener;
        if (l != null) {
            l.onTransportDown(cause);
        }
    }

    private synchronized void shutdownGroup()
    {
        EventLoopGroup g = group;
        group = null;
        if (g != null) {
            g.shutdownGracefully();
        }
    }

    private LineEndpointListener requireListener()
    {
        LineEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("LineEndpointListener must be set before start()");
        }
        return l;
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Receives framed lines and forwards them decoded to the port listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame)
        {
            LineEndpointListener l = listener;
            if (l == null) {
                return;
            }

            byte[] bytes = new byte[frame.readableBytes()];
            frame.getBytes(frame.readerIndex(), bytes);

            String line = PckCharsets.decode(bytes);
            if (!line.isEmpty()) {
                l.onLine(line);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            channel = null;
            notifyDown(null);
            shutdownGroup();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            if (cause instanceof TooLongFrameException) {
                // The decoder already skipped the line.
                log.warn("Discarding overlong line from {}: {}", remoteAddress, cause.getMessage());
                return;
            }
            log.warn("Transport error on {}", remoteAddress, cause);
            channel = null;
            notifyDown(cause);
            ctx.close();
        }
    }
}
