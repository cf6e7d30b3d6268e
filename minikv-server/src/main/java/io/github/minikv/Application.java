package io.github.minikv;

import java.io.IOException;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.github.minikv.server.KeyValueServer;
import io.github.minikv.store.ExpirationSweeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Application {
    private static final Logger logger = LoggerFactory.getLogger(Application.class);

    public static void main(String[] args) throws Exception {
        ServerConf conf = ServerConf.fromProperties(System.getProperties());
        logger.info("starting minikv with {}", conf);

        Injector injector = Guice.createInjector(new KeyValueModule(conf));
        ExpirationSweeper sweeper = injector.getInstance(ExpirationSweeper.class);
        KeyValueServer server = injector.getInstance(KeyValueServer.class);

        sweeper.start();
        try {
            server.start();
        } catch (IOException e) {
            logger.error("fail to bind {}.", conf.socketAddress(), e);
            sweeper.shutdown();
            System.exit(1);
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("服务进程退出.");
            try {
                server.shutdown();
            } catch (IOException e) {
                logger.warn("fail to shutdown kv server.", e);
            }
            sweeper.shutdown();
        }));
    }
}
