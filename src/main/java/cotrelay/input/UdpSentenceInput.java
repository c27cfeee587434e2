package cotrelay.input;

import cotrelay.domain.ParseResult;
import cotrelay.domain.PositionRecord;
import cotrelay.observability.NullRelayObserver;
import cotrelay.observability.RelayObserver;
import cotrelay.parser.GpggaSentenceParser;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.FixedRecvByteBufAllocator;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.BindException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * UDP listener for GPGGA sentences, one sentence per datagram.
 *
 * <p>Datagrams are decoded and parsed on the Netty event loop; parsed reports are handed
 * to the {@link PositionHandler} on a separate worker pool so a slow handler never holds
 * up socket reads. The pool size caps concurrent handler invocations; work beyond it
 * waits in the pool's queue.</p>
 */
public class UdpSentenceInput implements PositionInput {
    private static final Logger logger = LoggerFactory.getLogger(UdpSentenceInput.class);

    private static final long SHUTDOWN_WAIT_SECONDS = 2L;

    /** Largest UDP payload over IPv4; Netty's datagram default of 2048 would truncate. */
    static final int MAX_DATAGRAM_SIZE = 65535;

    private final InetSocketAddress bindAddress;
    private final int receiveBufferSize;
    private final int maxConcurrentMessages;
    private final GpggaSentenceParser parser;
    private final RelayObserver observer;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private final AtomicLong messagesReceived = new AtomicLong();
    private final AtomicLong parseErrors = new AtomicLong();
    private final AtomicLong decodeErrors = new AtomicLong();

    private volatile PositionHandler positionHandler;
    private EventLoopGroup group;
    private ExecutorService dispatcher;
    private volatile Channel channel;

    public UdpSentenceInput(InetSocketAddress bindAddress, int receiveBufferSize, int maxConcurrentMessages) {
        this(bindAddress, receiveBufferSize, maxConcurrentMessages,
                new GpggaSentenceParser(), NullRelayObserver.INSTANCE);
    }

    public UdpSentenceInput(InetSocketAddress bindAddress,
                            int receiveBufferSize,
                            int maxConcurrentMessages,
                            GpggaSentenceParser parser,
                            RelayObserver observer) {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress cannot be null");
        this.parser = Objects.requireNonNull(parser, "parser cannot be null");
        this.observer = Objects.requireNonNull(observer, "observer cannot be null");
        if (maxConcurrentMessages < 1) {
            throw new IllegalArgumentException("maxConcurrentMessages must be positive");
        }
        this.receiveBufferSize = receiveBufferSize;
        this.maxConcurrentMessages = maxConcurrentMessages;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            logger.warn("UDP listener already running");
            return;
        }
        if (positionHandler == null) {
            running.set(false);
            throw new IllegalStateException("PositionHandler must be set before start()");
        }

        group = new NioEventLoopGroup(1);
        dispatcher = Executors.newFixedThreadPool(maxConcurrentMessages, new HandlerThreadFactory());

        // SO_RCVBUF / SO_REUSEADDR failures are logged by Netty and otherwise ignored.
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_RCVBUF, receiveBufferSize)
                .option(ChannelOption.SO_REUSEADDR, true)
                .option(ChannelOption.SO_BROADCAST, false)
                .option(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(MAX_DATAGRAM_SIZE))
                .handler(new InboundHandler());

        ChannelFuture bind = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!bind.isSuccess()) {
            running.set(false);
            releaseResources();
            UdpBindException failure = classifyBindFailure(bindAddress, bind.cause());
            logger.error(failure.getMessage());
            throw failure;
        }
        channel = bind.channel();
        logger.info("UDP listener started successfully on {}", channel.localAddress());
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Channel ch = channel;
            if (ch != null) {
                ch.close().awaitUninterruptibly(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS);
                channel = null;
            }
            releaseResources();
            logger.info("UDP listener stopped. {}", getStatistics());
        }
    }

    @Override
    public boolean isRunning() {
        return running.get() && channel != null;
    }

    @Override
    public void setPositionHandler(PositionHandler handler) {
        this.positionHandler = handler;
    }

    @Override
    public InputStatistics getStatistics() {
        return new InputStatistics(messagesReceived.get(), parseErrors.get(), decodeErrors.get());
    }

    /**
     * Bound address, useful when binding to port 0.
     */
    public InetSocketAddress localAddress() {
        Channel ch = channel;
        return ch != null ? (InetSocketAddress) ch.localAddress() : null;
    }

    /**
     * Decode, parse and dispatch one datagram payload.
     */
    void handleDatagram(byte[] payload, InetSocketAddress sender) {
        messagesReceived.incrementAndGet();
        observer.onDatagramReceived(sender, payload.length);

        String message;
        try {
            message = utf8Decoder().decode(ByteBuffer.wrap(payload)).toString().strip();
        } catch (CharacterCodingException e) {
            decodeErrors.incrementAndGet();
            observer.onDecodeError(sender, e);
            return;
        }
        logger.debug("Received UDP message from {}: {}", sender, message);

        ParseResult result = parser.parse(message);
        if (!result.isSuccess()) {
            parseErrors.incrementAndGet();
            observer.onParseError(sender, result.error(), message);
            logger.debug("Parse failure detail: {}", result.detail());
            return;
        }
        observer.onPositionParsed(result.position(), sender);
        dispatch(result.position(), sender);
    }

    private void dispatch(PositionRecord record, InetSocketAddress sender) {
        PositionHandler handler = positionHandler;
        ExecutorService pool = dispatcher;
        if (handler == null || pool == null) {
            return;
        }
        try {
            pool.execute(() -> {
                try {
                    handler.onPosition(record, sender);
                } catch (Exception e) {
                    logger.error("Error in message handler for device {} from {}",
                            record.deviceId(), sender, e);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.debug("Listener stopping, dropping report from device {}", record.deviceId());
        }
    }

    private void releaseResources() {
        if (group != null) {
            group.shutdownGracefully(0, SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)
                    .awaitUninterruptibly(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS);
            group = null;
        }
        if (dispatcher != null) {
            dispatcher.shutdown();
            try {
                if (!dispatcher.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                    dispatcher.shutdownNow();
                }
            } catch (InterruptedException e) {
                dispatcher.shutdownNow();
                Thread.currentThread().interrupt();
            }
            dispatcher = null;
        }
    }

    static UdpBindException classifyBindFailure(InetSocketAddress address, Throwable cause) {
        String message = cause != null && cause.getMessage() != null
                ? cause.getMessage().toLowerCase(Locale.ROOT)
                : "";
        UdpBindException.Reason reason;
        if (message.contains("permission denied") || message.contains("access denied")) {
            reason = UdpBindException.Reason.PERMISSION_DENIED;
        } else if (cause instanceof BindException && message.contains("in use")) {
            reason = UdpBindException.Reason.ADDRESS_IN_USE;
        } else {
            reason = UdpBindException.Reason.OTHER;
        }
        return new UdpBindException(reason, address, cause);
    }

    private static CharsetDecoder utf8Decoder() {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }

    private final class InboundHandler extends SimpleChannelInboundHandler<DatagramPacket> {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet) {
            ByteBuf content = packet.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);
            handleDatagram(bytes, packet.sender());
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            // A datagram socket stays usable after a receive error
            logger.error("UDP protocol error", cause);
        }
    }

    private static final class HandlerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "position-handler-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
