package cotrelay.input;

import java.net.InetSocketAddress;

/**
 * The UDP listener could not bind its socket. Fatal at startup.
 */
public class UdpBindException extends RuntimeException {

    public enum Reason {
        ADDRESS_IN_USE,
        PERMISSION_DENIED,
        OTHER
    }

    private final Reason reason;
    private final InetSocketAddress address;

    public UdpBindException(Reason reason, InetSocketAddress address, Throwable cause) {
        super(describe(reason, address), cause);
        this.reason = reason;
        this.address = address;
    }

    public Reason getReason() {
        return reason;
    }

    public InetSocketAddress getAddress() {
        return address;
    }

    private static String describe(Reason reason, InetSocketAddress address) {
        return switch (reason) {
            case ADDRESS_IN_USE -> "UDP port already in use: " + address;
            case PERMISSION_DENIED -> "Permission denied to bind UDP port " + address
                    + " (try a port > 1024 or run with the required privileges)";
            case OTHER -> "Failed to start UDP listener on " + address;
        };
    }
}
