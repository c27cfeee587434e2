package cotrelay;

import cotrelay.config.RelayConfig;
import cotrelay.config.RelayConfigException;
import cotrelay.core.RelayProcessor;
import cotrelay.input.UdpBindException;
import cotrelay.input.UdpSentenceInput;
import cotrelay.observability.RelayObserver;
import cotrelay.observability.Slf4jRelayObserver;
import cotrelay.output.TakServerOutput;
import cotrelay.output.TlsConfigurationException;
import cotrelay.parser.GpggaSentenceParser;
import cotrelay.processor.CotEventEncoder;
import cotrelay.processor.DeviceUidRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CountDownLatch;

/**
 * Main application class for the GPGGA to CoT relay.
 * Builds the pipeline from the environment and runs it until the process is stopped.
 */
public class CotRelayApplication {
    private static final Logger logger = LoggerFactory.getLogger(CotRelayApplication.class);

    private final RelayConfig config;
    private final RelayProcessor processor;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    /**
     * Create the application from the process environment.
     *
     * @throws RelayConfigException if a variable is invalid
     */
    public CotRelayApplication() {
        this(RelayConfig.fromEnvironment());
    }

    public CotRelayApplication(RelayConfig config) {
        this.config = config;

        RelayObserver observer = new Slf4jRelayObserver();
        CotEventEncoder encoder = new CotEventEncoder(
                config.deviceType(), config.staleTime(), new DeviceUidRegistry(observer));
        TakServerOutput output = new TakServerOutput(config.toLinkSettings(), observer);
        UdpSentenceInput input = new UdpSentenceInput(
                config.udpListenAddress(),
                config.udpBufferSize(),
                config.maxConcurrentMessages(),
                new GpggaSentenceParser(),
                observer);

        this.processor = new RelayProcessor(input, encoder, output, observer,
                config.healthCheckInterval(), config.deviceCleanupInterval(), Clock.systemUTC());

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "relay-shutdown"));
    }

    protected void exitApplication(int status) {
        System.exit(status);
    }

    /**
     * Start the relay and block until {@link #shutdown()} is called.
     */
    public void start() {
        try {
            logger.info("Starting GPGGA to CoT Relay: {}", config.summary());

            processor.start();

            logger.info("GPGGA to CoT Relay started successfully");

            try {
                shutdownLatch.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.info("Application interrupted");
            }

        } catch (Exception e) {
            logStartupFailure(e);
            exitApplication(1);
        }
    }

    /**
     * Shutdown the application gracefully.
     */
    public void shutdown() {
        if (shutdownLatch.getCount() == 0) {
            return;
        }
        logger.info("Stopping GPGGA to CoT Relay...");

        try {
            processor.stop();

            RelayProcessor.ProcessorStatistics stats = processor.getStatistics();
            logger.info("Final statistics: positions={} queued={} dropped={} conversionErrors={} uptime={}s",
                    stats.getPositionsReceived(), stats.getEventsQueued(), stats.getEventsDropped(),
                    stats.getConversionErrors(), stats.getUptime() / 1000);

            logger.info("GPGGA to CoT Relay stopped");
        } catch (Exception e) {
            logger.error("Error during shutdown", e);
        } finally {
            shutdownLatch.countDown();
        }
    }

    static void logStartupFailure(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof UdpBindException bind) {
                logger.error("Failed to start UDP listener ({}): {}", bind.getReason(), bind.getMessage());
                return;
            }
            if (t instanceof TlsConfigurationException tls) {
                logger.error("Failed to configure TLS for the TAK connection: {}", tls.getMessage(), tls.getCause());
                return;
            }
        }
        logger.error("Failed to start application", failure);
    }

    public static void main(String[] args) {
        CotRelayApplication app;
        try {
            app = new CotRelayApplication();
        } catch (RelayConfigException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }
        app.start();
    }
}
