package fr.lapetina.lex.core;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class LexCoreApplicationTest {

    private LexCoreApplication app;

    @AfterEach
    void tearDown() {
        if (app != null) {
            app.close();
        }
    }

    @Test
    @DisplayName("should build without starting any worker")
    void shouldNotStartOnConstruction() {
        app = new LexCoreApplication("test-config.yaml");

        assertThat(app.getFactory().getScheduler().isRunning()).isFalse();
        assertThat(app.getFactory().getConnectionPool().isRunning()).isFalse();
    }

    @Test
    @DisplayName("should start the core and stop it exactly once")
    void shouldStartAndStopOnce() throws Exception {
        app = new LexCoreApplication("test-config.yaml");
        app.start();

        assertThat(app.getFactory().getScheduler().isRunning()).isTrue();
        assertThat(app.getFactory().getConnectionPool().isRunning()).isTrue();

        app.close();
        app.close();

        assertThat(app.isClosed()).isTrue();
        assertThat(app.getFactory().getScheduler().isRunning()).isFalse();
        assertThat(app.getFactory().getConnectionPool().isRunning()).isFalse();
    }

    @Test
    @DisplayName("should release a waiting main thread on close")
    void shouldReleaseAwaitOnClose() throws Exception {
        app = new LexCoreApplication("test-config.yaml");
        app.start();
        CountDownLatch released = new CountDownLatch(1);
        Thread waiter = new Thread(() -> {
            try {
                app.awaitShutdown();
                released.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        waiter.start();

        app.close();

        assertThat(released.await(2, TimeUnit.SECONDS)).isTrue();
    }
}
