package io.github.minikv.store;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 后台定期清理{@link Store}中已过期的条目，固定间隔执行，避免空转。
 */
public class ExpirationSweeper implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(ExpirationSweeper.class);

    private final    Store                    store;
    @Getter
    private final    long                     intervalMs;
    private volatile ScheduledExecutorService scheduler;
    private volatile boolean                  started = false;

    @Builder
    public ExpirationSweeper(@NonNull Store store, long intervalMs) {
        Preconditions.checkArgument(intervalMs > 0, "sweep interval must be positive: %s", intervalMs);
        this.store = store;
        this.intervalMs = intervalMs;
    }

    public void start() {
        synchronized (this) {
            Preconditions.checkState(!started, "already started");
            scheduler = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                    .setNameFormat("expiration-sweeper-%d")
                    .setDaemon(true)
                    .build());
            scheduler.scheduleWithFixedDelay(this, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
            started = true;
            logger.info("expiration sweeper started, interval {}ms.", intervalMs);
        }
    }

    public void shutdown() {
        synchronized (this) {
            if (!started) {
                return;
            }
            scheduler.shutdownNow();
            scheduler = null;
            started = false;
            logger.info("expiration sweeper stopped.");
        }
    }

    public boolean isStarted() {
        return started;
    }

    @Override
    public void run() {
        // 抛出异常会取消后续的周期执行，这里只记录
        try {
            int removed = store.removeExpired();
            if (removed > 0) {
                logger.debug("removed {} expired keys.", removed);
            }
        } catch (RuntimeException e) {
            logger.error("expiration sweep failed.", e);
        }
    }
}
