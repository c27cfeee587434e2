package cotrelay.output;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection parameters for {@link TakServerOutput}.
 *
 * @param tls                 TLS files, or {@code null} for plain TCP
 * @param queueCapacity       bound of the outbound event queue
 * @param sendTimeout         longest a producer waits for queue space
 * @param reconnectInterval   fixed wait after a failed connect
 * @param healthCheckInterval period of the liveness check while connected
 * @param connectTimeout      socket connect and TLS handshake timeout
 */
public record LinkSettings(
        String host,
        int port,
        TlsSettings tls,
        int queueCapacity,
        Duration sendTimeout,
        Duration reconnectInterval,
        Duration healthCheckInterval,
        Duration connectTimeout
) {
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    public LinkSettings {
        Objects.requireNonNull(host, "host cannot be null");
        Objects.requireNonNull(sendTimeout, "sendTimeout cannot be null");
        Objects.requireNonNull(reconnectInterval, "reconnectInterval cannot be null");
        Objects.requireNonNull(healthCheckInterval, "healthCheckInterval cannot be null");
        Objects.requireNonNull(connectTimeout, "connectTimeout cannot be null");
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be positive");
        }
    }

    public boolean isTls() {
        return tls != null;
    }
}
