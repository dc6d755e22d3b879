package pulsestream;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.MockedConstruction;
import org.slf4j.LoggerFactory;
import pulsestream.core.PulseStreamServer;

import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class PulseStreamApplicationTest {

    @TempDir
    Path tempDir;

    private PulseStreamApplication application;

    @AfterEach
    void tearDown() {
        if (application != null) {
            application.shutdown();
        }
    }

    private PulseStreamConfig testConfig(Path recordFile) {
        return new PulseStreamConfig("127.0.0.1", 0, 0, tempDir, false, recordFile, 10, true);
    }

    @Test
    @DisplayName("Should create application with default configuration")
    void testDefaultConstructor() {
        application = new PulseStreamApplication();

        assertThat(application.getServer()).isNotNull();
        assertThat(application.getServer().getTransports()).hasSize(2);
        assertThat(application.getServer().isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should start and shutdown application gracefully")
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void testStartAndShutdown() throws Exception {
        application = new PulseStreamApplication(testConfig(null));

        Thread appThread = new Thread(() -> application.start());
        appThread.start();

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!application.getServer().isRunning() && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
        assertThat(application.getServer().isRunning()).isTrue();

        application.shutdown();
        appThread.join(2000);

        assertThat(appThread.isAlive()).isFalse();
        assertThat(application.getServer().isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should record the live stream when a record file is configured")
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void testRecordingShutdown() throws Exception {
        Path recordFile = tempDir.resolve("buffer.json");
        application = new PulseStreamApplication(testConfig(recordFile));

        Thread appThread = new Thread(() -> application.start());
        appThread.start();
        while (!application.getServer().isRunning()) {
            Thread.sleep(20);
        }

        application.shutdown();
        appThread.join(2000);

        assertThat(appThread.isAlive()).isFalse();
    }

    @Test
    @DisplayName("Should handle exception during startup and call exit")
    void testStartException() {
        try (MockedConstruction<PulseStreamServer> mockedServer = mockConstruction(PulseStreamServer.class,
                (mock, context) -> doThrow(new RuntimeException("Startup failed")).when(mock).start())) {

            PulseStreamApplication appSpy = spy(new PulseStreamApplication(testConfig(null)));
            doNothing().when(appSpy).exitApplication(anyInt());

            appSpy.start();

            verify(appSpy, timeout(1000)).exitApplication(1);
            assertThat(mockedServer.constructed()).hasSize(1);
        }
    }

    @Test
    @DisplayName("Should handle exception during shutdown gracefully")
    void testShutdownException() {
        try (MockedConstruction<PulseStreamServer> mockedServer = mockConstruction(PulseStreamServer.class,
                (mock, context) -> doThrow(new RuntimeException("Shutdown failed")).when(mock).stop())) {

            application = new PulseStreamApplication(testConfig(null));

            assertThatCode(() -> application.shutdown()).doesNotThrowAnyException();
            assertThatCode(() -> application.shutdown()).doesNotThrowAnyException();
            verify(mockedServer.constructed().get(0), times(1)).stop();
        }
    }

    @Test
    @DisplayName("Should raise the root logger to DEBUG in verbose mode")
    void testVerboseLogging() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        ch.qos.logback.classic.Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        Level previous = root.getLevel();
        try {
            assertThat(LoggingConfigurator.enableVerboseLogging()).isTrue();
            assertThat(root.getLevel()).isEqualTo(Level.DEBUG);
        } finally {
            root.setLevel(previous);
        }
    }
}
