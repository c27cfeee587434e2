package cotrelay.output;

import java.nio.file.Path;

/**
 * PEM files for the TLS link. Any of them may be {@code null}; the client certificate is
 * only used when both {@code certFile} and {@code keyFile} are set.
 */
public record TlsSettings(Path certFile, Path keyFile, Path caFile) {

    public static TlsSettings insecure() {
        return new TlsSettings(null, null, null);
    }

    public boolean hasClientCertificate() {
        return certFile != null && keyFile != null;
    }

    /**
     * Without a CA the server certificate is not checked at all.
     */
    public boolean verifiesServer() {
        return caFile != null;
    }
}
