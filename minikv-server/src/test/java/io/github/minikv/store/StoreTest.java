package io.github.minikv.store;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.IntStream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StoreTest {
    private static final long START = 1_000_000L;

    private MutableClock clock;
    private Store        store;

    @BeforeEach
    void beforeEach() {
        clock = new MutableClock(START);
        store = new Store(clock);
    }

    @Test
    void setThenGet() {
        store.set("k", bytes("v"), ExpiringValue.NEVER);
        assertArrayEquals(bytes("v"), store.get("k").get());
    }

    @Test
    void getAbsent() {
        assertFalse(store.get("never set").isPresent());
    }

    @Test
    void binaryValue() {
        byte[] v = {0, (byte) 0xff, '\r', '\n', (byte) 0xc3};
        store.set("bin", v, ExpiringValue.NEVER);
        assertArrayEquals(v, store.get("bin").get());
    }

    @Test
    void overwrite() {
        store.set("k", bytes("v1-longer"), ExpiringValue.NEVER);
        store.set("k", bytes("v2"), ExpiringValue.NEVER);
        assertArrayEquals(bytes("v2"), store.get("k").get());
        assertEquals(1, store.size());
    }

    @Test
    void overwriteClearsDeadline() {
        store.set("k", bytes("v1"), START + 10);
        store.set("k", bytes("v2"), ExpiringValue.NEVER);
        clock.advance(100);
        assertArrayEquals(bytes("v2"), store.get("k").get());
    }

    @Test
    void valueIsCopied() {
        byte[] v = bytes("abc");
        store.set("k", v, ExpiringValue.NEVER);
        v[0] = 'x';
        assertArrayEquals(bytes("abc"), store.get("k").get());

        store.get("k").get()[1] = 'y';
        assertArrayEquals(bytes("abc"), store.get("k").get());
    }

    @Test
    void lazyExpiration() {
        store.set("k", bytes("v"), START + 50);
        clock.advance(49);
        assertTrue(store.get("k").isPresent());

        clock.advance(1);
        assertFalse(store.get("k").isPresent());
        // 还没有被清理
        assertEquals(1, store.size());
    }

    @Test
    void neverExpires() {
        store.set("k", bytes("v"), ExpiringValue.NEVER);
        clock.advance(Long.MAX_VALUE / 2);
        assertTrue(store.get("k").isPresent());
    }

    @Test
    void negativeDeadline() {
        assertThrows(IllegalArgumentException.class, () -> store.set("k", bytes("v"), -1));
    }

    @Test
    void delete() {
        store.set("k", bytes("v"), ExpiringValue.NEVER);
        assertTrue(store.delete("k"));
        assertFalse(store.delete("k"));
        assertFalse(store.get("k").isPresent());
    }

    @Test
    void removeExpired() {
        store.set("expired", bytes("v"), START + 10);
        store.set("later", bytes("v"), START + 1000);
        store.set("forever", bytes("v"), ExpiringValue.NEVER);
        clock.advance(10);

        assertEquals(1, store.removeExpired());
        assertEquals(2, store.size());
        assertTrue(store.get("later").isPresent());
        assertTrue(store.get("forever").isPresent());
        assertEquals(0, store.removeExpired());
    }

    @Test
    void removeExpiredKeepsFreshOverwrite() {
        store.set("k", bytes("old"), START + 10);
        clock.advance(20);
        store.set("k", bytes("new"), ExpiringValue.NEVER);

        assertEquals(0, store.removeExpired());
        assertArrayEquals(bytes("new"), store.get("k").get());
    }

    @RepeatedTest(5)
    void concurrentDisjointKeys() throws Exception {
        ExecutorService executorService = Executors.newFixedThreadPool(16);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 16; t++) {
                final int id = t;
                futures.add(executorService.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        String key = id + ":" + i;
                        byte[] value = bytes(key + "-value");
                        store.set(key, value, ExpiringValue.NEVER);
                        assertArrayEquals(value, store.get(key).get());
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            executorService.shutdown();
        }
        assertEquals(16 * 500, store.size());
    }

    @RepeatedTest(3)
    void concurrentOverwriteNeverTorn() {
        byte[] a = new byte[4096];
        byte[] b = new byte[4096];
        Arrays.fill(a, (byte) 'a');
        Arrays.fill(b, (byte) 'b');

        IntStream.range(0, 2000).parallel().forEach(i -> {
            store.set("shared", i % 2 == 0 ? a : b, ExpiringValue.NEVER);
            byte[] got = store.get("shared").get();
            byte first = got[0];
            for (byte x : got) {
                assertEquals(first, x);
            }
        });
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
