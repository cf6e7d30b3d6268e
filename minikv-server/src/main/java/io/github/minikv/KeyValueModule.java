package io.github.minikv;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.github.minikv.command.CommandDispatcher;
import io.github.minikv.server.KeyValueServer;
import io.github.minikv.store.ExpirationSweeper;
import io.github.minikv.store.Store;
import lombok.NonNull;

/**
 * 组装服务的各个部分，整个进程只有一个{@link Store}，由dispatcher和sweeper共享。
 */
public class KeyValueModule extends AbstractModule {
    private final ServerConf conf;

    public KeyValueModule(@NonNull ServerConf conf) {
        this.conf = conf;
    }

    @Override
    protected void configure() {
        bind(ServerConf.class).toInstance(conf);
        bind(Store.class).toInstance(new Store());
        bind(CommandDispatcher.class).in(Singleton.class);
    }

    @Provides
    @Singleton
    ExpirationSweeper expirationSweeper(Store store) {
        return ExpirationSweeper.builder()
                .store(store)
                .intervalMs(conf.getSweepIntervalMs())
                .build();
    }

    @Provides
    @Singleton
    KeyValueServer keyValueServer(CommandDispatcher dispatcher) {
        return KeyValueServer.builder()
                .socketAddress(conf.socketAddress())
                .dispatcher(dispatcher)
                .maxClients(conf.getMaxClients())
                .build();
    }
}
