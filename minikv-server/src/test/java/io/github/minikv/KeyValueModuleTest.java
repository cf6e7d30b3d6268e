package io.github.minikv;

import java.nio.charset.StandardCharsets;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.github.minikv.command.CommandDispatcher;
import io.github.minikv.server.KeyValueServer;
import io.github.minikv.store.ExpirationSweeper;
import io.github.minikv.store.ExpiringValue;
import io.github.minikv.store.Store;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KeyValueModuleTest {

    @Test
    void singleSharedStore() {
        ServerConf conf = ServerConf.builder().host("127.0.0.1").port(0).sweepIntervalMs(250).build();
        Injector injector = Guice.createInjector(new KeyValueModule(conf));

        Store store = injector.getInstance(Store.class);
        assertSame(store, injector.getInstance(Store.class));
        assertSame(injector.getInstance(CommandDispatcher.class), injector.getInstance(CommandDispatcher.class));
        assertSame(injector.getInstance(KeyValueServer.class), injector.getInstance(KeyValueServer.class));

        ExpirationSweeper sweeper = injector.getInstance(ExpirationSweeper.class);
        assertEquals(250, sweeper.getIntervalMs());

        store.set("k", "v".getBytes(StandardCharsets.UTF_8), ExpiringValue.NEVER);
        assertTrue(injector.getInstance(Store.class).get("k").isPresent());
    }
}
