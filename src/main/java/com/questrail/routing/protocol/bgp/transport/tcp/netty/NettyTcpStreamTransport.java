package com.questrail.routing.protocol.bgp.transport.tcp.netty;

import com.questrail.routing.protocol.bgp.codec.impl.BgpFraming;
import com.questrail.routing.protocol.bgp.transport.StreamChannel;
import com.questrail.routing.protocol.bgp.transport.StreamTransport;
import com.questrail.routing.protocol.bgp.transport.StreamTransportListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.util.concurrent.GlobalEventExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * NettyTcpStreamTransport
 * =============================================================================
 * Netty-backed implementation of the {@link StreamTransport} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Decode BGP messages beyond splitting the stream on the header length</li>
 *   <li>Interpret protocol semantics</li>
 *   <li>Emit {@code BgpEvent} instances</li>
 *   <li>Schedule retries or timeouts</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Each framed message is copied into a
 * {@code byte[]} before it reaches the listener.
 *
 * <h2>Framing</h2>
 * A {@link LengthFieldBasedFrameDecoder} cuts the stream at the 2-byte length
 * field that follows the 16-byte marker. The length counts the whole message,
 * so the adjustment is minus the header prefix. Lengths above 4096 surface as
 * {@link StreamTransportListener#onFramingError}; everything else about the
 * header is checked by the frame decoder.
 */
public final class NettyTcpStreamTransport implements StreamTransport
{
    private static final Logger log = LoggerFactory.getLogger(NettyTcpStreamTransport.class);

    private static final int CONNECT_TIMEOUT_MILLIS = 10_000;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ChannelGroup channels = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);

    /**
     * Uses dedicated event loop groups so the transport stays self-contained.
     */
    public NettyTcpStreamTransport()
    {
        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup();
    }

    @Override
    public void connect(InetSocketAddress remote, StreamTransportListener listener)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(listener, "listener");

        Bootstrap bootstrap = new Bootstrap()
                .group(workerGroup)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(initializer(listener));

        bootstrap.connect(remote).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                log.debug("Connect to {} failed", remote, future.cause());
                listener.onConnectFailed(future.cause());
            }
        });
    }

    @Override
    public InetSocketAddress listen(InetSocketAddress bindAddress, InboundConnectionAcceptor acceptor)
    {
        Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(acceptor, "acceptor");

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .handler(new LoggingHandler(LogLevel.TRACE))
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        StreamTransportListener listener = acceptor.accept(ch.remoteAddress());
                        if (listener == null) {
                            log.info("Refusing connection from {}", ch.remoteAddress());
                            ch.close();
                            return;
                        }
                        configure(ch, listener);
                    }
                });

        try {
            Channel serverChannel = bootstrap.bind(bindAddress).sync().channel();
            channels.add(serverChannel);
            InetSocketAddress bound = (InetSocketAddress) serverChannel.localAddress();
            log.info("Listening for BGP connections on {}", bound);
            return bound;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while binding " + bindAddress, e);
        }
    }

    @Override
    public void stop()
    {
        channels.close().awaitUninterruptibly();
        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();
    }

    private ChannelInitializer<SocketChannel> initializer(StreamTransportListener listener)
    {
        return new ChannelInitializer<>() {
            @Override
            protected void initChannel(SocketChannel ch)
            {
                configure(ch, listener);
            }
        };
    }

    private void configure(SocketChannel ch, StreamTransportListener listener)
    {
        channels.add(ch);
        ChannelPipeline p = ch.pipeline();
        p.addLast(new LoggingHandler(LogLevel.TRACE));
        p.addLast(new LengthFieldBasedFrameDecoder(
                BgpFraming.MAX_MESSAGE_LENGTH,
                BgpFraming.LENGTH_OFFSET,
                BgpFraming.LENGTH_FIELD_SIZE,
                -(BgpFraming.LENGTH_OFFSET + BgpFraming.LENGTH_FIELD_SIZE),
                0,
                true));
        p.addLast(new InboundHandler(listener, new NettyStreamChannel(ch)));
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Forwards framed messages and connection lifecycle to the port listener.
     */
    private static final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        private final StreamTransportListener listener;
        private final StreamChannel channel;
        private Throwable failure;

        InboundHandler(StreamTransportListener listener, StreamChannel channel)
        {
            this.listener = listener;
            this.channel = channel;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            listener.onConnected(channel);
            ctx.fireChannelActive();
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame)
        {
            byte[] bytes = new byte[frame.readableBytes()];
            frame.getBytes(frame.readerIndex(), bytes);
            listener.onMessage(channel, bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            listener.onDisconnected(channel, failure);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            if (cause instanceof DecoderException) {
                // Stream is no longer in sync; the session sends a NOTIFICATION and closes.
                listener.onFramingError(channel, cause.getMessage());
                return;
            }
            failure = cause;
            ctx.close();
        }
    }

    /**
     * StreamChannel view of a Netty {@link Channel}.
     */
    private static final class NettyStreamChannel implements StreamChannel
    {
        private final Channel channel;

        NettyStreamChannel(Channel channel)
        {
            this.channel = channel;
        }

        @Override
        public void send(byte[] message)
        {
            Objects.requireNonNull(message, "message");
            channel.writeAndFlush(Unpooled.wrappedBuffer(message));
        }

        @Override
        public void close()
        {
            channel.close();
        }

        @Override
        public boolean isOpen()
        {
            return channel.isActive();
        }

        @Override
        public InetSocketAddress remoteAddress()
        {
            return (InetSocketAddress) channel.remoteAddress();
        }
    }
}
