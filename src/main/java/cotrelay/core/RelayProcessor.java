package cotrelay.core;

import cotrelay.domain.PositionRecord;
import cotrelay.input.PositionInput;
import cotrelay.observability.NullRelayObserver;
import cotrelay.observability.RelayObserver;
import cotrelay.output.CotOutput;
import cotrelay.output.SendResult;
import cotrelay.processor.CotConversionException;
import cotrelay.processor.CotEventEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Wires the UDP input through the CoT encoder into the TAK output.
 * Each parsed position is handled independently: a failure at any stage is counted and
 * logged, and the next position is processed as usual.
 */
public class RelayProcessor {
    private static final Logger logger = LoggerFactory.getLogger(RelayProcessor.class);

    private final PositionInput input;
    private final CotEventEncoder encoder;
    private final CotOutput output;
    private final RelayObserver observer;
    private final Duration statisticsInterval;
    private final Duration deviceCleanupInterval;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Set<String> activeDevices = ConcurrentHashMap.newKeySet();
    private final ProcessorStatistics statistics = new ProcessorStatistics();
    private ScheduledExecutorService housekeeping;

    public RelayProcessor(PositionInput input, CotEventEncoder encoder, CotOutput output) {
        this(input, encoder, output, NullRelayObserver.INSTANCE,
                Duration.ofSeconds(30), Duration.ofHours(1), Clock.systemUTC());
    }

    /**
     * @param statisticsInterval    period of the statistics log
     * @param deviceCleanupInterval period at which the active-device set is cleared
     * @param clock                 source of event timestamps
     */
    public RelayProcessor(PositionInput input,
                          CotEventEncoder encoder,
                          CotOutput output,
                          RelayObserver observer,
                          Duration statisticsInterval,
                          Duration deviceCleanupInterval,
                          Clock clock) {
        this.input = Objects.requireNonNull(input, "input cannot be null");
        this.encoder = Objects.requireNonNull(encoder, "encoder cannot be null");
        this.output = Objects.requireNonNull(output, "output cannot be null");
        this.observer = Objects.requireNonNull(observer, "observer cannot be null");
        this.statisticsInterval = Objects.requireNonNull(statisticsInterval, "statisticsInterval cannot be null");
        this.deviceCleanupInterval = Objects.requireNonNull(deviceCleanupInterval,
                "deviceCleanupInterval cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");

        this.input.setPositionHandler(this::handlePosition);
    }

    /**
     * Initialize the output, then start listening. Starting the output first lets the
     * link begin connecting before the first position arrives.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            try {
                output.initialize();
                input.start();

                housekeeping = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "relay-housekeeping");
                    t.setDaemon(true);
                    return t;
                });
                long statsMs = statisticsInterval.toMillis();
                long cleanupMs = deviceCleanupInterval.toMillis();
                housekeeping.scheduleAtFixedRate(this::logStatistics, statsMs, statsMs, TimeUnit.MILLISECONDS);
                housekeeping.scheduleAtFixedRate(this::clearActiveDevices, cleanupMs, cleanupMs,
                        TimeUnit.MILLISECONDS);

                statistics.recordStart();
                logger.info("RelayProcessor started");
            } catch (Exception e) {
                running.set(false);
                closeResources();
                throw new RuntimeException("Failed to start RelayProcessor", e);
            }
        }
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            try {
                input.stop();
                closeResources();
                statistics.recordStop();
                logger.info("RelayProcessor stopped. Statistics: {}", statistics);
            } catch (Exception e) {
                logger.error("Error during RelayProcessor shutdown", e);
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public ProcessorStatistics getStatistics() {
        return statistics;
    }

    /**
     * @return number of distinct device ids seen since the last clear
     */
    public int getActiveDeviceCount() {
        return activeDevices.size();
    }

    /**
     * Forget the devices seen so far. Derived uids are kept.
     */
    public void clearActiveDevices() {
        int cleared = activeDevices.size();
        activeDevices.clear();
        logger.info("Cleared device cache ({} active devices)", cleared);
    }

    private void handlePosition(PositionRecord record, InetSocketAddress sender) {
        if (!running.get()) {
            return;
        }
        long startNanos = System.nanoTime();
        statistics.recordPositionReceived();
        activeDevices.add(record.deviceId());
        try {
            byte[] wire;
            try {
                wire = encoder.encodeToWire(record, clock.instant());
            } catch (CotConversionException e) {
                statistics.recordConversionError();
                observer.onConversionError(record.deviceId(), e);
                return;
            }

            SendResult result = output.send(wire);
            if (result.isAccepted()) {
                statistics.recordEventQueued();
                observer.onEventQueued(record.deviceId());
            } else {
                statistics.recordEventDropped();
                observer.onEventDropped(record.deviceId(), result);
            }
        } finally {
            observer.onMessageProcessed(Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    private void logStatistics() {
        try {
            logger.info("Relay statistics: input={} link={} processor={} activeDevices={} knownDevices={}",
                    input.getStatistics(), output.getStatistics(), statistics,
                    activeDevices.size(), encoder.uidRegistry().size());
        } catch (RuntimeException e) {
            logger.error("Error in health monitor", e);
        }
    }

    private void closeResources() {
        if (housekeeping != null) {
            housekeeping.shutdownNow();
            housekeeping = null;
        }
        try {
            output.close();
        } catch (Exception e) {
            logger.warn("Error closing output: {}", output.getClass().getSimpleName(), e);
        }
    }

    /**
     * Statistics tracking for the processor.
     */
    public static class ProcessorStatistics {
        private volatile long startTime;
        private volatile long stopTime;
        private volatile long startNano;
        private final AtomicLong positionsReceived = new AtomicLong();
        private final AtomicLong eventsQueued = new AtomicLong();
        private final AtomicLong eventsDropped = new AtomicLong();
        private final AtomicLong conversionErrors = new AtomicLong();

        void recordStart() {
            startTime = System.currentTimeMillis();
            startNano = System.nanoTime();
        }

        void recordStop() {
            stopTime = System.currentTimeMillis();
        }

        void recordPositionReceived() {
            positionsReceived.incrementAndGet();
        }

        void recordEventQueued() {
            eventsQueued.incrementAndGet();
        }

        void recordEventDropped() {
            eventsDropped.incrementAndGet();
        }

        void recordConversionError() {
            conversionErrors.incrementAndGet();
        }

        public long getUptime() {
            if (startTime == 0) return 0;
            if (stopTime > 0) {
                return stopTime - startTime;
            }
            long elapsedMs = (System.nanoTime() - startNano) / 1_000_000L;
            return elapsedMs > 0 ? elapsedMs : 1L;
        }

        public long getPositionsReceived() {
            return positionsReceived.get();
        }

        public long getEventsQueued() {
            return eventsQueued.get();
        }

        public long getEventsDropped() {
            return eventsDropped.get();
        }

        public long getConversionErrors() {
            return conversionErrors.get();
        }

        @Override
        public String toString() {
            return String.format("ProcessorStatistics{uptime=%dms, positionsReceived=%d, "
                            + "eventsQueued=%d, eventsDropped=%d, conversionErrors=%d}",
                    getUptime(), positionsReceived.get(), eventsQueued.get(),
                    eventsDropped.get(), conversionErrors.get());
        }
    }
}
