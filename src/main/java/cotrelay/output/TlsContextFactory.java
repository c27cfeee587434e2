package cotrelay.output;

import io.netty.handler.ssl.JdkSslContext;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslProvider;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLException;
import java.util.Objects;

/**
 * Builds the client {@link SSLContext} for the TAK link from PEM files.
 *
 * <p>Netty's builder does the PEM decoding (X.509 chains and PKCS#8 keys); the JDK provider
 * is forced so the result can back a plain blocking {@code SSLSocket}.</p>
 */
public final class TlsContextFactory {
    private static final Logger logger = LoggerFactory.getLogger(TlsContextFactory.class);

    private TlsContextFactory() {}

    /**
     * @throws TlsConfigurationException if a configured certificate, key or CA file cannot be loaded
     */
    public static SSLContext create(TlsSettings tls) {
        Objects.requireNonNull(tls, "tls cannot be null");
        SslContextBuilder builder = SslContextBuilder.forClient().sslProvider(SslProvider.JDK);

        if (tls.hasClientCertificate()) {
            try {
                builder.keyManager(tls.certFile().toFile(), tls.keyFile().toFile());
                logger.info("Loaded client certificates for TLS");
            } catch (IllegalArgumentException e) {
                logger.error("Failed to load client certificates cert={} key={}", tls.certFile(), tls.keyFile());
                throw new TlsConfigurationException(
                        "Failed to load client certificate " + tls.certFile() + " / key " + tls.keyFile(), e);
            }
        }

        if (tls.verifiesServer()) {
            try {
                builder.trustManager(tls.caFile().toFile());
                logger.info("Loaded CA certificate for TLS");
            } catch (IllegalArgumentException e) {
                logger.error("Failed to load CA certificate {}", tls.caFile());
                throw new TlsConfigurationException("Failed to load CA certificate " + tls.caFile(), e);
            }
        } else {
            builder.trustManager(InsecureTrustManagerFactory.INSTANCE);
            logger.warn("TLS certificate verification disabled - no CA certificate provided");
        }

        try {
            SslContext context = builder.build();
            return ((JdkSslContext) context).context();
        } catch (SSLException e) {
            throw new TlsConfigurationException("Failed to build TLS context", e);
        }
    }
}
