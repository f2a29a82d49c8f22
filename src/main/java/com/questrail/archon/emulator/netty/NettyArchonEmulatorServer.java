package com.questrail.archon.emulator.netty;

import com.questrail.archon.emulator.ArchonEmulator;
import com.questrail.archon.emulator.EmulatorOutput;
import com.questrail.archon.emulator.FetchReply;
import com.questrail.archon.observability.ArchonErrorEvent;
import com.questrail.archon.observability.ArchonObservabilitySink;
import com.questrail.archon.observability.ArchonTransportEvent;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.stream.ChunkedInput;
import io.netty.handler.stream.ChunkedWriteHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;

/**
 * NettyArchonEmulatorServer
 * =============================================================================
 * TCP listener that feeds host command lines into an {@link ArchonEmulator}.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It splits the byte
 * stream into lines and writes back whatever the dispatcher produces. It does
 * not interpret commands.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound lines are decoded to {@code String}
 * and replies handed over as {@code byte[]}.
 *
 * <h2>FETCH streaming</h2>
 * A FETCH reply can run to hundreds of megabytes. It is written as a
 * {@link ChunkedInput} of one block per chunk, so {@link ChunkedWriteHandler}
 * produces blocks only while the channel is writable.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds the listening socket and returns once it is bound.
 * - {@link #stop()} closes every channel and shuts down the event loop groups.
 */
public final class NettyArchonEmulatorServer
{
    private static final Logger log = LoggerFactory.getLogger(NettyArchonEmulatorServer.class);

    /** Longest command line accepted; longer lines close the connection. */
    static final int MAX_LINE_LENGTH = 4096;

    private final InetSocketAddress bindAddress;
    private final ArchonEmulator emulator;
    private final ArchonObservabilitySink sink;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ServerBootstrap bootstrap;

    private volatile Channel serverChannel;

    public NettyArchonEmulatorServer(InetSocketAddress bindAddress,
                                     ArchonEmulator emulator,
                                     ArchonObservabilitySink sink)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.emulator = Objects.requireNonNull(emulator, "emulator");
        this.sink = Objects.requireNonNull(sink, "sink");

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup();
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new LineBasedFrameDecoder(MAX_LINE_LENGTH));
                        p.addLast(new ChunkedWriteHandler());
                        p.addLast(new CommandHandler());
                    }
                });
    }

    /**
     * Bind and start accepting connections.
     *
     * @throws IllegalStateException if the address cannot be bound
     */
    public void start()
    {
        ChannelFuture f = bootstrap.bind(bindAddress).syncUninterruptibly();
        if (!f.isSuccess()) {
            stop();
            throw new IllegalStateException("cannot bind " + bindAddress, f.cause());
        }
        serverChannel = f.channel();
        log.info("Archon emulator listening on {}", serverChannel.localAddress());
        sink.onTransportEvent(new ArchonTransportEvent(Instant.now(), ArchonTransportEvent.Kind.LISTENING,
                String.valueOf(serverChannel.localAddress())));
    }

    public void stop()
    {
        Channel ch = serverChannel;
        if (ch != null) {
            ch.close().syncUninterruptibly();
        }
        workerGroup.shutdownGracefully().syncUninterruptibly();
        bossGroup.shutdownGracefully().syncUninterruptibly();
    }

    /**
     * Port actually bound; differs from the configured one when that was 0.
     */
    public int port()
    {
        Channel ch = serverChannel;
        if (ch == null) {
            throw new IllegalStateException("server not started");
        }
        return ((InetSocketAddress) ch.localAddress()).getPort();
    }

    /**
     * Blocks until the listening channel is closed.
     */
    public void awaitClose() throws InterruptedException
    {
        Channel ch = serverChannel;
        if (ch != null) {
            ch.closeFuture().sync();
        }
    }

    /**
     * CommandHandler
     * -------------------------------------------------------------------------
     * One per connection. Receives whole lines from {@link LineBasedFrameDecoder}
     * and passes them to the dispatcher.
     */
    private final class CommandHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            sink.onTransportEvent(new ArchonTransportEvent(Instant.now(), ArchonTransportEvent.Kind.CLIENT_ACCEPTED,
                    String.valueOf(ctx.channel().remoteAddress())));
            ctx.fireChannelActive();
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg)
        {
            String line = msg.toString(StandardCharsets.US_ASCII);
            emulator.handle(line, new EmulatorOutput() {
                @Override
                public void write(byte[] bytes)
                {
                    ctx.write(Unpooled.wrappedBuffer(bytes));
                }

                @Override
                public void stream(FetchReply reply)
                {
                    ctx.write(new FetchBlockInput(reply));
                }
            });
            ctx.flush();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            sink.onTransportEvent(new ArchonTransportEvent(Instant.now(), ArchonTransportEvent.Kind.CLIENT_CLOSED,
                    String.valueOf(ctx.channel().remoteAddress())));
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            sink.onError(new ArchonErrorEvent(Instant.now(),
                    "emulator connection " + ctx.channel().remoteAddress() + " failed", cause));
            ctx.close();
        }
    }

    /**
     * Adapts a {@link FetchReply} to Netty's chunked write path, one block per chunk.
     */
    static final class FetchBlockInput implements ChunkedInput<ByteBuf>
    {
        private final FetchReply reply;

        FetchBlockInput(FetchReply reply)
        {
            this.reply = reply;
        }

        @Override
        public boolean isEndOfInput()
        {
            return !reply.hasNext();
        }

        @Override
        public void close()
        {
            // blocks are computed on demand; nothing to release
        }

        @Deprecated
        @Override
        public ByteBuf readChunk(ChannelHandlerContext ctx)
        {
            return readChunk(ctx.alloc());
        }

        @Override
        public ByteBuf readChunk(ByteBufAllocator allocator)
        {
            if (!reply.hasNext()) {
                return null;
            }
            byte[] block = reply.next();
            return allocator.buffer(block.length).writeBytes(block);
        }

        @Override
        public long length()
        {
            return reply.length();
        }

        @Override
        public long progress()
        {
            return reply.bytesProduced();
        }
    }
}
