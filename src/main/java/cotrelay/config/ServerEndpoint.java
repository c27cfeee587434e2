package cotrelay.config;

import java.util.Locale;
import java.util.Objects;

/**
 * Parsed TAK server URL of the form {@code tcp://host[:port]} or {@code tls://host[:port]}.
 */
public record ServerEndpoint(Scheme scheme, String host, int port) {

    public enum Scheme {
        TCP(8087),
        TLS(8089);

        private final int defaultPort;

        Scheme(int defaultPort) {
            this.defaultPort = defaultPort;
        }

        public int defaultPort() {
            return defaultPort;
        }
    }

    public ServerEndpoint {
        Objects.requireNonNull(scheme, "scheme cannot be null");
        Objects.requireNonNull(host, "host cannot be null");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host cannot be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
    }

    /**
     * @throws IllegalArgumentException for an unknown or unsupported scheme, a missing host
     *                                  or a bad port
     */
    public static ServerEndpoint parse(String url) {
        Objects.requireNonNull(url, "url cannot be null");
        String trimmed = url.strip();
        int sep = trimmed.indexOf("://");
        if (sep < 0) {
            throw new IllegalArgumentException("TAK server URL must start with tcp:// or tls://, got " + url);
        }
        String prefix = trimmed.substring(0, sep).toLowerCase(Locale.ROOT);
        Scheme scheme = switch (prefix) {
            case "tcp" -> Scheme.TCP;
            case "tls" -> Scheme.TLS;
            case "udp" -> throw new IllegalArgumentException(
                    "udp:// is not supported: the TAK link has no UDP transport, use tcp:// or tls://");
            default -> throw new IllegalArgumentException(
                    "TAK server URL must start with tcp:// or tls://, got " + url);
        };

        String authority = trimmed.substring(sep + 3);
        int slash = authority.indexOf('/');
        if (slash >= 0) {
            authority = authority.substring(0, slash);
        }
        int colon = authority.lastIndexOf(':');
        String host = colon >= 0 ? authority.substring(0, colon) : authority;
        int port = scheme.defaultPort();
        if (colon >= 0) {
            String portText = authority.substring(colon + 1);
            try {
                port = Integer.parseInt(portText);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port in TAK server URL: " + portText, e);
            }
        }
        if (host.isEmpty()) {
            throw new IllegalArgumentException("TAK server URL has no host: " + url);
        }
        return new ServerEndpoint(scheme, host, port);
    }

    public boolean isTls() {
        return scheme == Scheme.TLS;
    }

    @Override
    public String toString() {
        return scheme.name().toLowerCase(Locale.ROOT) + "://" + host + ":" + port;
    }
}
