package io.github.minikv.store;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * 存储的值和它的过期时间。deadline是绝对时间（epoch毫秒），0表示永不过期。
 * 创建后不可变，可以在线程间安全地共享。
 */
@EqualsAndHashCode
@ToString
public final class ExpiringValue {
    public static final long NEVER = 0L;

    @Getter
    private final byte[] data;
    @Getter
    private final long   deadline;

    ExpiringValue(@NonNull byte[] data, long deadline) {
        this.data = data;
        this.deadline = deadline;
    }

    boolean isExpired(long now) {
        return deadline != NEVER && deadline <= now;
    }
}
