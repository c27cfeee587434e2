package cotrelay.config;

import cotrelay.output.LinkSettings;
import cotrelay.output.TlsSettings;

import java.net.InetSocketAddress;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Relay settings, read once from the process environment.
 *
 * @param tls         TLS files; {@code null} unless the server URL uses {@code tls://}
 * @param udpListenPort 0 picks an ephemeral port (only reachable through the constructor)
 */
public record RelayConfig(
        String udpListenHost,
        int udpListenPort,
        int udpBufferSize,
        ServerEndpoint takServer,
        Duration takReconnectInterval,
        Duration takSendTimeout,
        TlsSettings tls,
        String deviceType,
        Duration staleTime,
        int messageQueueSize,
        Duration healthCheckInterval,
        int maxConcurrentMessages,
        Duration deviceCleanupInterval
) {
    public static final String UDP_LISTEN_HOST = "UDP_LISTEN_HOST";
    public static final String UDP_LISTEN_PORT = "UDP_LISTEN_PORT";
    public static final String UDP_BUFFER_SIZE = "UDP_BUFFER_SIZE";
    public static final String TAK_SERVER_URL = "TAK_SERVER_URL";
    public static final String TAK_RECONNECT_INTERVAL = "TAK_RECONNECT_INTERVAL";
    public static final String TAK_SEND_TIMEOUT = "TAK_SEND_TIMEOUT";
    public static final String TAK_CERT_FILE = "TAK_CERT_FILE";
    public static final String TAK_KEY_FILE = "TAK_KEY_FILE";
    public static final String TAK_CA_FILE = "TAK_CA_FILE";
    public static final String DEVICE_TYPE = "DEVICE_TYPE";
    public static final String STALE_TIME_SECONDS = "STALE_TIME_SECONDS";
    public static final String MESSAGE_QUEUE_SIZE = "MESSAGE_QUEUE_SIZE";
    public static final String HEALTH_CHECK_INTERVAL = "HEALTH_CHECK_INTERVAL";
    public static final String MAX_CONCURRENT_MESSAGES = "MAX_CONCURRENT_MESSAGES";
    public static final String DEVICE_CLEANUP_INTERVAL = "DEVICE_CLEANUP_INTERVAL";

    public RelayConfig {
        Objects.requireNonNull(udpListenHost, "udpListenHost cannot be null");
        Objects.requireNonNull(takServer, "takServer cannot be null");
        Objects.requireNonNull(takReconnectInterval, "takReconnectInterval cannot be null");
        Objects.requireNonNull(takSendTimeout, "takSendTimeout cannot be null");
        Objects.requireNonNull(deviceType, "deviceType cannot be null");
        Objects.requireNonNull(staleTime, "staleTime cannot be null");
        Objects.requireNonNull(healthCheckInterval, "healthCheckInterval cannot be null");
        Objects.requireNonNull(deviceCleanupInterval, "deviceCleanupInterval cannot be null");
        if (udpListenPort < 0 || udpListenPort > 65535) {
            throw new IllegalArgumentException("udpListenPort out of range: " + udpListenPort);
        }
        if (tls != null && !takServer.isTls()) {
            throw new IllegalArgumentException("TLS settings given but TAK URL doesn't use tls://");
        }
        if (takServer.isTls() && tls == null) {
            tls = TlsSettings.insecure();
        }
    }

    /**
     * Build the configuration from environment variables, applying defaults for unset ones.
     *
     * @throws RelayConfigException naming the first variable that is malformed or out of range
     */
    public static RelayConfig fromEnvironment(Map<String, String> env) {
        String host = text(env, UDP_LISTEN_HOST, "0.0.0.0");
        int port = integer(env, UDP_LISTEN_PORT, 5005, 1, 65535);
        int bufferSize = integer(env, UDP_BUFFER_SIZE, 65536, 256, 1_048_576);

        ServerEndpoint server;
        String url = text(env, TAK_SERVER_URL, "tcp://localhost:8087");
        try {
            server = ServerEndpoint.parse(url);
        } catch (IllegalArgumentException e) {
            throw new RelayConfigException(TAK_SERVER_URL, e.getMessage(), e);
        }

        Duration reconnect = Duration.ofSeconds(integer(env, TAK_RECONNECT_INTERVAL, 5, 1, 300));
        Duration sendTimeout = seconds(env, TAK_SEND_TIMEOUT, 5.0, 0.1, 60.0);

        Path cert = path(env, TAK_CERT_FILE);
        Path key = path(env, TAK_KEY_FILE);
        Path ca = path(env, TAK_CA_FILE);
        TlsSettings tls = null;
        if (cert != null || key != null || ca != null) {
            if (!server.isTls()) {
                String offending = cert != null ? TAK_CERT_FILE : key != null ? TAK_KEY_FILE : TAK_CA_FILE;
                throw new RelayConfigException(offending,
                        "TLS certificates specified but TAK URL doesn't use tls://");
            }
            if ((cert == null) != (key == null)) {
                throw new RelayConfigException(cert == null ? TAK_CERT_FILE : TAK_KEY_FILE,
                        TAK_CERT_FILE + " and " + TAK_KEY_FILE + " must be given together");
            }
            tls = new TlsSettings(cert, key, ca);
        }

        String deviceType = text(env, DEVICE_TYPE, "a-f-G-U-C");
        Duration stale = Duration.ofSeconds(integer(env, STALE_TIME_SECONDS, 300, 10, 3600));
        int queueSize = integer(env, MESSAGE_QUEUE_SIZE, 1000, 10, 10_000);
        Duration health = Duration.ofSeconds(integer(env, HEALTH_CHECK_INTERVAL, 30, 5, 300));
        int maxConcurrent = integer(env, MAX_CONCURRENT_MESSAGES, 100, 1, 1000);
        Duration cleanup = Duration.ofSeconds(integer(env, DEVICE_CLEANUP_INTERVAL, 3600, 60, 86_400));

        return new RelayConfig(host, port, bufferSize, server, reconnect, sendTimeout, tls,
                deviceType, stale, queueSize, health, maxConcurrent, cleanup);
    }

    public static RelayConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public InetSocketAddress udpListenAddress() {
        return new InetSocketAddress(udpListenHost, udpListenPort);
    }

    public LinkSettings toLinkSettings() {
        return new LinkSettings(
                takServer.host(),
                takServer.port(),
                takServer.isTls() ? tls : null,
                messageQueueSize,
                takSendTimeout,
                takReconnectInterval,
                healthCheckInterval,
                LinkSettings.DEFAULT_CONNECT_TIMEOUT);
    }

    /**
     * One-line description for the startup log.
     */
    public String summary() {
        return String.format("udp_listener=%s:%d, tak_server=%s, tls_enabled=%s, device_type=%s, "
                        + "stale_time=%ds, queue_size=%d, max_concurrent=%d",
                udpListenHost, udpListenPort, takServer, takServer.isTls(), deviceType,
                staleTime.toSeconds(), messageQueueSize, maxConcurrentMessages);
    }

    private static String raw(Map<String, String> env, String name) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.strip();
    }

    private static String text(Map<String, String> env, String name, String defaultValue) {
        String value = raw(env, name);
        return value != null ? value : defaultValue;
    }

    private static int integer(Map<String, String> env, String name, int defaultValue, int min, int max) {
        String value = raw(env, name);
        if (value == null) {
            return defaultValue;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new RelayConfigException(name, "not an integer: " + value, e);
        }
        if (parsed < min || parsed > max) {
            throw new RelayConfigException(name,
                    "must be between " + min + " and " + max + ", got " + parsed);
        }
        return parsed;
    }

    private static Duration seconds(Map<String, String> env, String name, double defaultValue,
                                    double min, double max) {
        String value = raw(env, name);
        double parsed = defaultValue;
        if (value != null) {
            try {
                parsed = Double.parseDouble(value);
            } catch (NumberFormatException e) {
                throw new RelayConfigException(name, "not a number: " + value, e);
            }
            if (Double.isNaN(parsed) || parsed < min || parsed > max) {
                throw new RelayConfigException(name,
                        "must be between " + min + " and " + max + ", got " + value);
            }
        }
        return Duration.ofNanos(Math.round(parsed * 1_000_000_000d));
    }

    private static Path path(Map<String, String> env, String name) {
        String value = raw(env, name);
        if (value == null) {
            return null;
        }
        try {
            return Path.of(value);
        } catch (InvalidPathException e) {
            throw new RelayConfigException(name, "invalid path: " + value, e);
        }
    }
}
