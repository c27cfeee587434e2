package cotrelay.core;

import cotrelay.domain.PositionRecord;
import cotrelay.input.InputStatistics;
import cotrelay.input.PositionInput;
import cotrelay.output.ConnectionState;
import cotrelay.output.CotOutput;
import cotrelay.output.LinkStatistics;
import cotrelay.output.SendResult;
import cotrelay.processor.CotConversionException;
import cotrelay.processor.CotEventEncoder;
import cotrelay.processor.DeviceUidRegistry;
import cotrelay.testsupport.RecordingRelayObserver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class RelayProcessorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");
    private static final InetSocketAddress SENDER = new InetSocketAddress("127.0.0.1", 40000);

    @Mock
    private PositionInput mockInput;

    @Mock
    private CotOutput mockOutput;

    private AutoCloseable mocks;
    private RecordingRelayObserver observer;
    private CotEventEncoder encoder;
    private RelayProcessor processor;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        observer = new RecordingRelayObserver();
        encoder = new CotEventEncoder("a-f-G-U-C", Duration.ofMinutes(5), new DeviceUidRegistry(observer));
        when(mockInput.getStatistics()).thenReturn(new InputStatistics(0, 0, 0));
        when(mockOutput.getStatistics()).thenReturn(
                new LinkStatistics(ConnectionState.DISCONNECTED, 0, 0, 0, 10));
    }

    @AfterEach
    void tearDown() throws Exception {
        if (processor != null) {
            processor.stop();
        }
        mocks.close();
    }

    private RelayProcessor newProcessor(CotEventEncoder enc) {
        return new RelayProcessor(mockInput, enc, mockOutput, observer,
                Duration.ofSeconds(30), Duration.ofHours(1), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private PositionInput.PositionHandler capturedHandler() {
        ArgumentCaptor<PositionInput.PositionHandler> captor =
                ArgumentCaptor.forClass(PositionInput.PositionHandler.class);
        verify(mockInput).setPositionHandler(captor.capture());
        return captor.getValue();
    }

    private static PositionRecord record(String device) {
        return new PositionRecord(null, 48.1, 11.5, 1, 8, 0.9, 545.4, null, null, null, device);
    }

    @Test
    @DisplayName("Should register itself as the input handler")
    void testConstructor() {
        processor = newProcessor(encoder);
        verify(mockInput).setPositionHandler(any());
    }

    @Test
    @DisplayName("Should throw exception for null input")
    void testConstructorWithNullInput() {
        assertThatThrownBy(() -> new RelayProcessor(null, encoder, mockOutput))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("input cannot be null");
    }

    @Test
    @DisplayName("Should initialize the output before starting the input")
    void testStartOrder() {
        processor = newProcessor(encoder);
        processor.start();

        var order = inOrder(mockOutput, mockInput);
        order.verify(mockOutput).initialize();
        order.verify(mockInput).start();
        assertThat(processor.isRunning()).isTrue();
    }

    @Test
    @DisplayName("Should stop input and close output")
    void testStop() {
        processor = newProcessor(encoder);
        processor.start();
        processor.stop();

        verify(mockInput).stop();
        verify(mockOutput).close();
        assertThat(processor.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should close the output and rethrow when the input fails to start")
    void testStartFailure() {
        doThrow(new IllegalStateException("bind failed")).when(mockInput).start();
        processor = newProcessor(encoder);

        assertThatThrownBy(processor::start)
                .isInstanceOf(RuntimeException.class)
                .hasMessage("Failed to start RelayProcessor")
                .hasRootCauseMessage("bind failed");
        verify(mockOutput).close();
        assertThat(processor.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should encode positions and send them to the output")
    void testRelayPosition() {
        when(mockOutput.send(any())).thenReturn(SendResult.ACCEPTED);
        processor = newProcessor(encoder);
        processor.start();

        capturedHandler().onPosition(record("DEV1"), SENDER);

        ArgumentCaptor<byte[]> payload = ArgumentCaptor.forClass(byte[].class);
        verify(mockOutput).send(payload.capture());
        String xml = new String(payload.getValue(), StandardCharsets.UTF_8);
        assertThat(xml).startsWith("<event ").endsWith("\n");
        assertThat(xml).contains("time=\"2024-05-01T10:15:30.000000Z\"");

        assertThat(processor.getStatistics().getPositionsReceived()).isEqualTo(1);
        assertThat(processor.getStatistics().getEventsQueued()).isEqualTo(1);
        assertThat(observer.queued).containsExactly("DEV1");
        assertThat(observer.newDevices).containsExactly("DEV1");
        assertThat(observer.processed.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should count events refused by the output")
    void testDroppedEvent() {
        when(mockOutput.send(any())).thenReturn(SendResult.TIMEOUT);
        processor = newProcessor(encoder);
        processor.start();

        capturedHandler().onPosition(record("DEV1"), SENDER);

        assertThat(processor.getStatistics().getEventsDropped()).isEqualTo(1);
        assertThat(observer.dropped).containsExactly(SendResult.TIMEOUT);
    }

    @Test
    @DisplayName("Should contain conversion failures and keep relaying")
    void testConversionFailure() {
        CotEventEncoder failing = mock(CotEventEncoder.class);
        when(failing.encodeToWire(any(), any()))
                .thenThrow(new CotConversionException("boom", new IllegalStateException()))
                .thenReturn("<event/>\n".getBytes(StandardCharsets.UTF_8));
        when(failing.uidRegistry()).thenReturn(new DeviceUidRegistry());
        when(mockOutput.send(any())).thenReturn(SendResult.ACCEPTED);
        processor = newProcessor(failing);
        processor.start();

        PositionInput.PositionHandler handler = capturedHandler();
        handler.onPosition(record("BAD"), SENDER);
        handler.onPosition(record("GOOD"), SENDER);

        assertThat(processor.getStatistics().getConversionErrors()).isEqualTo(1);
        assertThat(processor.getStatistics().getEventsQueued()).isEqualTo(1);
        assertThat(observer.conversionErrors).containsExactly("BAD");
        verify(mockOutput, times(1)).send(any());
    }

    @Test
    @DisplayName("Should track and clear active devices")
    void testActiveDevices() {
        when(mockOutput.send(any())).thenReturn(SendResult.ACCEPTED);
        processor = newProcessor(encoder);
        processor.start();

        PositionInput.PositionHandler handler = capturedHandler();
        handler.onPosition(record("DEV1"), SENDER);
        handler.onPosition(record("DEV1"), SENDER);
        handler.onPosition(record("DEV2"), SENDER);
        assertThat(processor.getActiveDeviceCount()).isEqualTo(2);

        processor.clearActiveDevices();

        assertThat(processor.getActiveDeviceCount()).isZero();
        assertThat(encoder.uidRegistry().size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should ignore positions while stopped")
    void testIgnoredWhenStopped() {
        processor = newProcessor(encoder);

        capturedHandler().onPosition(record("DEV1"), SENDER);

        verify(mockOutput, never()).send(any());
        assertThat(processor.getStatistics().getPositionsReceived()).isZero();
    }

    @Test
    @DisplayName("Statistics should report uptime only after start")
    void testStatistics() {
        RelayProcessor.ProcessorStatistics stats = new RelayProcessor.ProcessorStatistics();
        assertThat(stats.getUptime()).isZero();

        stats.recordStart();
        assertThat(stats.getUptime()).isPositive();
        assertThat(stats.toString()).contains("positionsReceived=0");
    }
}
