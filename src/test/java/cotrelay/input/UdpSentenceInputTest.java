package cotrelay.input;

import cotrelay.domain.ParseError;
import cotrelay.domain.PositionRecord;
import cotrelay.parser.GpggaSentenceParser;
import cotrelay.testsupport.GpggaTestSentences;
import cotrelay.testsupport.RecordingRelayObserver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.net.BindException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.*;

class UdpSentenceInputTest {

    private static final InetSocketAddress LOOPBACK = new InetSocketAddress("127.0.0.1", 0);

    private RecordingRelayObserver observer;
    private UdpSentenceInput input;
    private DatagramSocket sender;

    @BeforeEach
    void setUp() throws IOException {
        observer = new RecordingRelayObserver();
        input = new UdpSentenceInput(LOOPBACK, 65536, 4, new GpggaSentenceParser(), observer);
        sender = new DatagramSocket();
    }

    @AfterEach
    void tearDown() {
        input.stop();
        sender.close();
    }

    private void send(byte[] payload) throws IOException {
        sender.send(new DatagramPacket(payload, payload.length, input.localAddress()));
    }

    private void send(String text) throws IOException {
        send(text.getBytes(StandardCharsets.UTF_8));
    }

    private static void waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(3);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within 3 seconds");
            }
            Thread.sleep(10);
        }
    }

    @Test
    @DisplayName("Should deliver parsed positions with the sender address")
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testReceivePosition() throws Exception {
        CountDownLatch received = new CountDownLatch(1);
        List<PositionRecord> records = new CopyOnWriteArrayList<>();
        List<InetSocketAddress> senders = new CopyOnWriteArrayList<>();
        input.setPositionHandler((record, from) -> {
            records.add(record);
            senders.add(from);
            received.countDown();
        });
        input.start();
        assertThat(input.isRunning()).isTrue();

        send(GpggaTestSentences.EXAMPLE + "\r\n");

        assertThat(received.await(3, TimeUnit.SECONDS)).isTrue();
        assertThat(records.get(0).deviceId()).isEqualTo("DEV1");
        assertThat(senders.get(0).getPort()).isEqualTo(sender.getLocalPort());
        assertThat(input.getStatistics().messagesReceived()).isEqualTo(1);
        assertThat(observer.positions).hasSize(1);
    }

    @Test
    @DisplayName("Should receive a datagram larger than Netty's default receive buffer whole")
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testLongDatagram() throws Exception {
        CountDownLatch received = new CountDownLatch(1);
        List<PositionRecord> records = new CopyOnWriteArrayList<>();
        input.setPositionHandler((record, from) -> {
            records.add(record);
            received.countDown();
        });
        input.start();

        String deviceId = "D".repeat(2500);
        byte[] datagram = GpggaTestSentences.sentence(deviceId, 10.0, 20.0).getBytes(StandardCharsets.UTF_8);
        assertThat(datagram.length).isGreaterThan(2048);
        send(datagram);

        assertThat(received.await(3, TimeUnit.SECONDS)).isTrue();
        assertThat(records.get(0).deviceId()).isEqualTo(deviceId);
        assertThat(input.getStatistics().parseErrors()).isZero();
        assertThat(observer.datagramSizes).containsExactly(datagram.length);
    }

    @Test
    @DisplayName("Should count and skip sentences with a bad checksum")
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testParseError() throws Exception {
        List<PositionRecord> records = new CopyOnWriteArrayList<>();
        input.setPositionHandler((record, from) -> records.add(record));
        input.start();

        send("$" + GpggaTestSentences.EXAMPLE_PAYLOAD + "*00");

        waitFor(() -> input.getStatistics().parseErrors() == 1);
        assertThat(observer.parseErrors).containsExactly(ParseError.CHECKSUM_MISMATCH);
        assertThat(records).isEmpty();
    }

    @Test
    @DisplayName("Should count and skip datagrams that are not UTF-8")
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testDecodeError() throws Exception {
        input.setPositionHandler((record, from) -> fail("handler must not be called"));
        input.start();

        send(new byte[]{(byte) 0xC3, (byte) 0x28, '*', '0', '0'});

        waitFor(() -> input.getStatistics().decodeErrors() == 1);
        assertThat(observer.decodeErrors.get()).isEqualTo(1);
        assertThat(input.getStatistics().errorRate()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should keep listening after the handler throws")
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testHandlerFailureIsContained() throws Exception {
        CountDownLatch second = new CountDownLatch(1);
        input.setPositionHandler((record, from) -> {
            if ("BOOM".equals(record.deviceId())) {
                throw new IllegalStateException("handler failure");
            }
            second.countDown();
        });
        input.start();

        send(GpggaTestSentences.sentence("BOOM", 10.0, 20.0));
        send(GpggaTestSentences.sentence("OK", 10.0, 20.0));

        assertThat(second.await(3, TimeUnit.SECONDS)).isTrue();
        assertThat(input.isRunning()).isTrue();
    }

    @Test
    @DisplayName("Should report a port already in use")
    void testAddressInUse() throws Exception {
        try (DatagramSocket blocker = new DatagramSocket(new InetSocketAddress("127.0.0.1", 0))) {
            InetSocketAddress taken = new InetSocketAddress("127.0.0.1", blocker.getLocalPort());
            UdpSentenceInput clash = new UdpSentenceInput(taken, 65536, 1);
            clash.setPositionHandler((record, from) -> { });

            assertThatThrownBy(clash::start)
                    .isInstanceOf(UdpBindException.class)
                    .satisfies(e -> {
                        UdpBindException bind = (UdpBindException) e;
                        assertThat(bind.getReason()).isEqualTo(UdpBindException.Reason.ADDRESS_IN_USE);
                        assertThat(bind.getAddress()).isEqualTo(taken);
                    });
            assertThat(clash.isRunning()).isFalse();
        }
    }

    @Test
    @DisplayName("Should classify bind failures by cause")
    void testClassifyBindFailure() {
        assertThat(UdpSentenceInput.classifyBindFailure(LOOPBACK,
                new BindException("Address already in use")).getReason())
                .isEqualTo(UdpBindException.Reason.ADDRESS_IN_USE);
        assertThat(UdpSentenceInput.classifyBindFailure(LOOPBACK,
                new BindException("Permission denied")).getReason())
                .isEqualTo(UdpBindException.Reason.PERMISSION_DENIED);
        assertThat(UdpSentenceInput.classifyBindFailure(LOOPBACK,
                new IOException("Cannot assign requested address")).getReason())
                .isEqualTo(UdpBindException.Reason.OTHER);
    }

    @Test
    @DisplayName("Should require a handler before start")
    void testStartWithoutHandler() {
        assertThatThrownBy(input::start).isInstanceOf(IllegalStateException.class);
        assertThat(input.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should release the socket on stop")
    void testStop() {
        input.setPositionHandler((record, from) -> { });
        input.start();
        input.stop();

        assertThat(input.isRunning()).isFalse();
        assertThat(input.localAddress()).isNull();
    }
}
