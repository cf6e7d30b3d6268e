package io.github.minikv.store;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ExpirationSweeperTest {
    private MutableClock      clock;
    private Store             store;
    private ExpirationSweeper sweeper;

    @BeforeEach
    void beforeEach() {
        clock = new MutableClock(System.currentTimeMillis());
        store = new Store(clock);
        sweeper = ExpirationSweeper.builder().store(store).intervalMs(10).build();
    }

    @AfterEach
    void afterEach() {
        sweeper.shutdown();
    }

    @Test
    void removesExpiredEntries() throws InterruptedException {
        long now = clock.millis();
        store.set("a", "1".getBytes(StandardCharsets.UTF_8), now + 5);
        store.set("b", "2".getBytes(StandardCharsets.UTF_8), now + 5);
        store.set("c", "3".getBytes(StandardCharsets.UTF_8), ExpiringValue.NEVER);
        clock.advance(5);

        sweeper.start();
        long until = System.currentTimeMillis() + 5000;
        while (store.size() > 1 && System.currentTimeMillis() < until) {
            Thread.sleep(10);
        }

        assertEquals(1, store.size());
        assertTrue(store.get("c").isPresent());
    }

    @Test
    void startTwice() {
        sweeper.start();
        assertTrue(sweeper.isStarted());
        assertThrows(IllegalStateException.class, () -> sweeper.start());
    }

    @Test
    void shutdownWithoutStart() {
        sweeper.shutdown();
        assertFalse(sweeper.isStarted());
    }

    @Test
    void restart() {
        sweeper.start();
        sweeper.shutdown();
        sweeper.start();
        assertTrue(sweeper.isStarted());
    }

    @Test
    void invalidInterval() {
        assertThrows(IllegalArgumentException.class,
                () -> ExpirationSweeper.builder().store(store).intervalMs(0).build());
    }

    @Test
    void keepsRunningAfterFailure() throws InterruptedException {
        Store failing = mock(Store.class);
        when(failing.removeExpired()).thenThrow(new IllegalStateException("boom")).thenReturn(0);

        ExpirationSweeper s = ExpirationSweeper.builder().store(failing).intervalMs(5).build();
        s.start();
        try {
            verify(failing, timeout(5000).atLeast(3)).removeExpired();
        } finally {
            s.shutdown();
        }
    }
}
