package cotrelay.processor;

import cotrelay.observability.NullRelayObserver;
import cotrelay.observability.RelayObserver;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Maps device ids to stable CoT uids.
 *
 * <p>The uid is a name-based (version 5) UUID over a fixed namespace and the device id,
 * so a device keeps its uid across restarts without anything being persisted. The
 * table only caches derivations; entries live until {@link #clear()}.</p>
 */
public class DeviceUidRegistry {

    /** RFC 4122 URL namespace. */
    public static final UUID NAMESPACE = UUID.fromString("6ba7b810-9dad-11d1-80b4-00c04fd430c8");
    public static final String NAME_PREFIX = "gpgga-device-";
    public static final String UID_PREFIX = "GPGGA-";

    private final ConcurrentMap<String, String> uids = new ConcurrentHashMap<>();
    private final RelayObserver observer;

    public DeviceUidRegistry() {
        this(NullRelayObserver.INSTANCE);
    }

    public DeviceUidRegistry(RelayObserver observer) {
        this.observer = Objects.requireNonNull(observer, "observer cannot be null");
    }

    /**
     * Get the uid for a device, deriving and caching it on first sighting.
     * Concurrent first lookups for the same id derive it exactly once.
     */
    public String uidFor(String deviceId) {
        Objects.requireNonNull(deviceId, "deviceId cannot be null");
        String cached = uids.get(deviceId);
        if (cached != null) {
            return cached;
        }

        AtomicBoolean created = new AtomicBoolean(false);
        String uid = uids.computeIfAbsent(deviceId, id -> {
            created.set(true);
            return deriveUid(id);
        });
        if (created.get()) {
            observer.onNewDevice(deviceId, uid);
        }
        return uid;
    }

    public int size() {
        return uids.size();
    }

    public void clear() {
        uids.clear();
    }

    /**
     * Deterministic uid for a device id: {@code GPGGA-} followed by
     * uuid5(URL namespace, "gpgga-device-" + deviceId).
     */
    public static String deriveUid(String deviceId) {
        return UID_PREFIX + nameUuidV5(NAMESPACE, NAME_PREFIX + deviceId);
    }

    static UUID nameUuidV5(UUID namespace, String name) {
        MessageDigest sha1;
        try {
            sha1 = MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-1
            throw new IllegalStateException("SHA-1 not available", e);
        }
        ByteBuffer ns = ByteBuffer.allocate(16);
        ns.putLong(namespace.getMostSignificantBits());
        ns.putLong(namespace.getLeastSignificantBits());
        sha1.update(ns.array());
        sha1.update(name.getBytes(StandardCharsets.UTF_8));
        byte[] hash = sha1.digest();

        hash[6] = (byte) ((hash[6] & 0x0f) | 0x50);  // version 5
        hash[8] = (byte) ((hash[8] & 0x3f) | 0x80);  // IETF variant

        ByteBuffer bits = ByteBuffer.wrap(hash, 0, 16);
        return new UUID(bits.getLong(), bits.getLong());
    }
}
