package io.github.minikv.store;

import java.time.Clock;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.google.common.base.Preconditions;
import lombok.NonNull;

/**
 * 内存kv存储，所有操作都可以并发调用。
 * <p>
 * 过期策略：读取时惰性过期加后台定期清理。{@link #get(String)}把deadline已到的值当作不存在，
 * 不依赖{@link ExpirationSweeper}是否已经删除它；清理只负责回收内存。
 * </p>
 * 单个key上的set、get和清理删除都是线性一致的，不同key之间没有顺序保证。
 */
public class Store {
    private final Map<String, ExpiringValue> data = new ConcurrentHashMap<>();
    private final Clock                      clock;

    public Store() {
        this(Clock.systemUTC());
    }

    public Store(@NonNull Clock clock) {
        this.clock = clock;
    }

    /**
     * 写入或覆盖一个值。
     *
     * @param key      key
     * @param value    值，会被复制
     * @param deadline 过期时间（epoch毫秒），0表示永不过期
     */
    public void set(@NonNull String key, @NonNull byte[] value, long deadline) {
        Preconditions.checkArgument(deadline >= 0, "deadline must not be negative: %s", deadline);
        data.put(key, new ExpiringValue(Arrays.copyOf(value, value.length), deadline));
    }

    /**
     * 读取一个值，已过期的值视为不存在。
     *
     * @param key key
     * @return 值的副本；不存在或者已过期时返回empty
     */
    public Optional<byte[]> get(@NonNull String key) {
        ExpiringValue v = data.get(key);
        if (v == null || v.isExpired(clock.millis())) {
            return Optional.empty();
        }
        byte[] bytes = v.getData();
        return Optional.of(Arrays.copyOf(bytes, bytes.length));
    }

    /**
     * 删除一个key。
     *
     * @param key key
     * @return key原来是否存在
     */
    public boolean delete(@NonNull String key) {
        return data.remove(key) != null;
    }

    /**
     * 扫描一遍所有条目，删除已过期的。
     * 只有条目仍然是扫描时看到的那个值才会被删除，并发写入的新值不会丢失。
     *
     * @return 删除的条目数
     */
    public int removeExpired() {
        long now = clock.millis();
        int removed = 0;
        for (Map.Entry<String, ExpiringValue> e : data.entrySet()) {
            ExpiringValue v = e.getValue();
            if (v.isExpired(now) && data.remove(e.getKey(), v)) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * @return 实际持有的条目数，包括已过期但尚未清理的
     */
    public int size() {
        return data.size();
    }

    public long now() {
        return clock.millis();
    }
}
