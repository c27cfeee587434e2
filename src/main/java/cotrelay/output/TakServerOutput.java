package cotrelay.output;

import cotrelay.observability.NullRelayObserver;
import cotrelay.observability.RelayObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.SocketFactory;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * CotOutput that streams CoT XML to a TAK server over TCP or TLS with auto-reconnect.
 *
 * <p>Producers only ever touch the bounded queue, so a dead server costs them at most the
 * send timeout. A supervisor thread owns the socket: it connects, starts a writer that
 * drains the queue and a reader that watches for the server hanging up, checks both on
 * every health-check interval, and reconnects after a fixed wait when anything fails.</p>
 */
public class TakServerOutput implements CotOutput {
    private static final Logger logger = LoggerFactory.getLogger(TakServerOutput.class);

    private static final long WRITER_POLL_MS = 250L;
    private static final long SHUTDOWN_WAIT_MS = 2000L;

    private final LinkSettings settings;
    private final RelayObserver observer;
    private final BlockingQueue<byte[]> queue;

    private final AtomicReference<ConnectionState> state =
            new AtomicReference<>(ConnectionState.DISCONNECTED);
    private final AtomicLong messagesSent = new AtomicLong();
    private final AtomicLong sendErrors = new AtomicLong();

    private final Object stateLock = new Object();
    private volatile boolean running = false;
    private volatile boolean closed = false;
    private volatile SocketFactory socketFactory;
    private Thread supervisorThread;

    // Guarded by stateLock
    private Socket socket;
    private ExecutorService connectionTasks;
    private Future<?> writerTask;
    private Future<?> readerTask;

    public TakServerOutput(LinkSettings settings) {
        this(settings, NullRelayObserver.INSTANCE);
    }

    public TakServerOutput(LinkSettings settings, RelayObserver observer) {
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
        this.observer = Objects.requireNonNull(observer, "observer cannot be null");
        this.queue = new ArrayBlockingQueue<>(settings.queueCapacity());
    }

    @Override
    public void initialize() {
        if (closed) {
            throw new IllegalStateException("TAK output already closed");
        }
        if (running) {
            logger.warn("TAK client already running");
            return;
        }
        socketFactory = settings.isTls()
                ? TlsContextFactory.create(settings.tls()).getSocketFactory()
                : SocketFactory.getDefault();

        running = true;
        supervisorThread = new Thread(this::supervise, "tak-link-supervisor");
        supervisorThread.setDaemon(true);
        supervisorThread.start();
        logger.info("TAK client started for {}", describeServer());
    }

    @Override
    public SendResult send(byte[] payload) {
        if (closed) {
            sendErrors.incrementAndGet();
            return SendResult.CLOSED;
        }
        if (payload == null || payload.length == 0) {
            sendErrors.incrementAndGet();
            return SendResult.ERROR;
        }
        try {
            if (queue.offer(payload, settings.sendTimeout().toNanos(), TimeUnit.NANOSECONDS)) {
                return SendResult.ACCEPTED;
            }
            sendErrors.incrementAndGet();
            logger.debug("Outbound queue full ({} events), dropping CoT", settings.queueCapacity());
            return SendResult.TIMEOUT;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sendErrors.incrementAndGet();
            return SendResult.ERROR;
        }
    }

    @Override
    public boolean isConnected() {
        return state.get() == ConnectionState.CONNECTED;
    }

    public ConnectionState getState() {
        return state.get();
    }

    @Override
    public LinkStatistics getStatistics() {
        return new LinkStatistics(state.get(), messagesSent.get(), sendErrors.get(),
                queue.size(), settings.queueCapacity());
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        running = false;

        Thread supervisor = supervisorThread;
        if (supervisor != null) {
            supervisor.interrupt();
            try {
                supervisor.join(SHUTDOWN_WAIT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (supervisor.isAlive()) {
                logger.warn("TAK link supervisor did not stop within {} ms", SHUTDOWN_WAIT_MS);
            }
        }
        closeConnection();
        transition(ConnectionState.DISCONNECTED);

        List<byte[]> discarded = new ArrayList<>();
        queue.drainTo(discarded);
        if (!discarded.isEmpty()) {
            logger.warn("Discarded {} undelivered CoT event(s) on shutdown", discarded.size());
        }
        logger.info("TAK client stopped. {}", getStatistics());
    }

    private void supervise() {
        logger.info("Connecting to TAK server at {}", describeServer());
        try {
            while (running) {
                if (state.get() == ConnectionState.DISCONNECTED) {
                    transition(ConnectionState.CONNECTING);
                    try {
                        if (attemptConnect()) {
                            transition(ConnectionState.CONNECTED);
                            logger.info("Connected to TAK server {}", describeServer());
                        }
                    } catch (IOException | RuntimeException e) {
                        transition(ConnectionState.DISCONNECTED);
                        logger.warn("Failed to connect to TAK server {}: {}. Retrying in {} ms",
                                describeServer(), e.toString(), settings.reconnectInterval().toMillis());
                        sleep(settings.reconnectInterval().toMillis());
                    }
                } else {
                    sleep(settings.healthCheckInterval().toMillis());
                    if (running && !isConnectionAlive()) {
                        logger.warn("TAK connection lost - reconnecting");
                        closeConnection();
                        transition(ConnectionState.DISCONNECTED);
                    }
                }
            }
        } catch (RuntimeException e) {
            logger.error("Unexpected error in TAK link supervisor", e);
        } finally {
            closeConnection();
        }
    }

    /**
     * @return false if the link was closed while connecting
     */
    private boolean attemptConnect() throws IOException {
        int timeoutMs = (int) settings.connectTimeout().toMillis();
        Socket s = socketFactory.createSocket();
        try {
            s.setTcpNoDelay(true);
            s.setKeepAlive(true);
            s.connect(new InetSocketAddress(settings.host(), settings.port()), timeoutMs);
            if (s instanceof SSLSocket sslSocket) {
                handshake(sslSocket, timeoutMs);
            }
        } catch (IOException e) {
            closeQuietly(s);
            throw e;
        }

        OutputStream out = new BufferedOutputStream(s.getOutputStream());
        InputStream in = s.getInputStream();
        ExecutorService tasks = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "tak-link-io");
            t.setDaemon(true);
            return t;
        });

        synchronized (stateLock) {
            if (!running) {
                tasks.shutdownNow();
                closeQuietly(s);
                return false;
            }
            socket = s;
            connectionTasks = tasks;
            writerTask = tasks.submit(() -> writeLoop(out));
            readerTask = tasks.submit(() -> readLoop(in));
        }
        return true;
    }

    private void handshake(SSLSocket sslSocket, int timeoutMs) throws IOException {
        if (settings.tls().verifiesServer()) {
            SSLParameters params = sslSocket.getSSLParameters();
            params.setEndpointIdentificationAlgorithm("HTTPS");
            sslSocket.setSSLParameters(params);
        } else {
            logger.warn("TLS connection to {} is not verifying the server certificate", describeServer());
        }
        sslSocket.setSoTimeout(timeoutMs);
        sslSocket.startHandshake();
        sslSocket.setSoTimeout(0);
    }

    /**
     * Drain the queue into {@code out} until interrupted or a write fails. The event being
     * written when a write fails is dropped.
     */
    void writeLoop(OutputStream out) {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                byte[] event = queue.poll(WRITER_POLL_MS, TimeUnit.MILLISECONDS);
                if (event == null) {
                    continue;
                }
                try {
                    out.write(event);
                    out.flush();
                    messagesSent.incrementAndGet();
                } catch (IOException e) {
                    sendErrors.incrementAndGet();
                    logger.warn("Failed to send CoT message, dropping it ({} bytes): {}",
                            event.length, e.toString());
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void readLoop(InputStream in) {
        byte[] buffer = new byte[4096];
        try {
            // The server may push its own CoT traffic; it is not used.
            while (in.read(buffer) >= 0) {
                if (Thread.currentThread().isInterrupted()) {
                    return;
                }
            }
            logger.info("TAK server closed the connection");
        } catch (IOException e) {
            logger.debug("TAK connection read ended: {}", e.toString());
        }
    }

    private boolean isConnectionAlive() {
        synchronized (stateLock) {
            return socket != null
                    && !socket.isClosed()
                    && writerTask != null && !writerTask.isDone()
                    && readerTask != null && !readerTask.isDone();
        }
    }

    private void closeConnection() {
        synchronized (stateLock) {
            if (connectionTasks != null) {
                connectionTasks.shutdownNow();
                connectionTasks = null;
            }
            writerTask = null;
            readerTask = null;
            if (socket != null) {
                closeQuietly(socket);
                socket = null;
            }
        }
    }

    private void transition(ConnectionState to) {
        ConnectionState from = state.getAndSet(to);
        if (from != to) {
            observer.onConnectionStateChanged(from, to);
        }
    }

    private String describeServer() {
        return (settings.isTls() ? "tls://" : "tcp://") + settings.host() + ":" + settings.port();
    }

    private static void closeQuietly(Socket s) {
        try {
            s.close();
        } catch (IOException e) {
            logger.debug("Error closing TAK socket: {}", e.toString());
        }
    }

    private void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }
}
