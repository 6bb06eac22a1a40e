package com.questrail.bhumi.relay.transport.tcp.netty;

import com.questrail.bhumi.relay.transport.StreamConnection;
import com.questrail.bhumi.relay.transport.StreamEndpoint;
import com.questrail.bhumi.relay.transport.StreamEndpointListener;
import com.questrail.bhumi.relay.transport.TransportException;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.GlobalEventExecutor;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyTcpRelayEndpoint
 * =============================================================================
 * Netty-backed implementation of the relay {@link StreamEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It does not decode
 * frames, interpret messages or schedule timeouts.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound bytes are copied into {@code byte[]};
 * reference-counted buffers are released by {@link SimpleChannelInboundHandler}.
 *
 * <h2>Threading</h2>
 * Each accepted channel is pinned to one worker event loop, so listener
 * callbacks for a given connection are serialized on that loop.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds the server socket and waits for the bind to finish.
 * - {@link #stop()} closes every channel and shuts down both event loop groups.
 */
public final class NettyTcpRelayEndpoint implements StreamEndpoint {
    private final InetSocketAddress bindAddress;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ServerBootstrap bootstrap;
    private final ChannelGroup channels = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);
    private final AtomicBoolean down = new AtomicBoolean();

    private volatile StreamEndpointListener listener;
    private volatile Channel serverChannel;

    /**
     * @param workerThreads event loop threads for accepted connections; {@code 0}
     *                      lets Netty pick its default
     */
    public NettyTcpRelayEndpoint(InetSocketAddress bindAddress, int workerThreads) {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        if (workerThreads < 0) {
            throw new IllegalArgumentException("workerThreads must be >= 0");
        }

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup(workerThreads);
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        channels.add(ch);
                        ch.pipeline().addLast(new InboundHandler(new NettyStreamConnection(ch)));
                    }
                });
    }

    @Override
    public void setListener(StreamEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start() {
        StreamEndpointListener l = requireListener();

        ChannelFuture f = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!f.isSuccess()) {
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
            throw new TransportException("Failed to bind " + bindAddress, f.cause());
        }
        serverChannel = f.channel();
        l.onTransportUp(serverChannel.localAddress());
    }

    @Override
    public void stop() {
        Channel ch = serverChannel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }
        channels.close().awaitUninterruptibly();

        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();

        StreamEndpointListener l = listener;
        if (l != null && down.compareAndSet(false, true)) {
            l.onTransportDown(null);
        }
    }

    @Override
    public Optional<SocketAddress> localAddress() {
        Channel ch = serverChannel;
        return ch == null ? Optional.empty() : Optional.ofNullable(ch.localAddress());
    }

    private StreamEndpointListener requireListener() {
        StreamEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("StreamEndpointListener must be set before start()");
        }
        return l;
    }

    /**
     * StreamConnection view of one accepted channel.
     */
    private static final class NettyStreamConnection implements StreamConnection {
        private final Channel channel;

        NettyStreamConnection(Channel channel) {
            this.channel = channel;
        }

        @Override
        public String id() {
            return channel.id().asLongText();
        }

        @Override
        public SocketAddress remoteAddress() {
            return channel.remoteAddress();
        }

        @Override
        public void write(byte[] bytes) {
            Objects.requireNonNull(bytes, "bytes");
            if (!channel.isActive()) {
                return;
            }
            channel.writeAndFlush(Unpooled.wrappedBuffer(bytes));
        }

        @Override
        public void close() {
            channel.close();
        }

        @Override
        public boolean isOpen() {
            return channel.isActive();
        }

        @Override
        public String toString() {
            return "tcp[" + channel.id().asShortText() + " " + channel.remoteAddress() + "]";
        }
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Forwards the lifecycle and raw bytes of one channel to the port listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf> {
        private final NettyStreamConnection connection;
        private Throwable failure;

        InboundHandler(NettyStreamConnection connection) {
            this.connection = connection;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx) {
            StreamEndpointListener l = listener;
            if (l != null) {
                l.onConnectionOpened(connection);
            }
            ctx.fireChannelActive();
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf content) {
            StreamEndpointListener l = listener;
            if (l == null) {
                return;
            }

            // Copy into a plain byte[] (Netty containment rule).
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);
            l.onBytes(connection, bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            StreamEndpointListener l = listener;
            if (l != null) {
                l.onConnectionClosed(connection, failure);
            }
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            failure = cause;
            ctx.close();
        }
    }
}
