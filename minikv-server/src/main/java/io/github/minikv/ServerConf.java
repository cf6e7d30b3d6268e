package io.github.minikv;

import java.net.InetSocketAddress;
import java.util.Properties;

import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * 服务配置，可以从system properties读取：
 * <ul>
 * <li>{@code minikv.host}：监听地址，默认0.0.0.0</li>
 * <li>{@code minikv.port}：监听端口，默认6379</li>
 * <li>{@code minikv.sweep.interval.ms}：过期清理间隔，默认100毫秒</li>
 * <li>{@code minikv.max.clients}：最大连接数，默认1000</li>
 * </ul>
 */
@Builder
@ToString
public class ServerConf {
    public static final String HOST_KEY              = "minikv.host";
    public static final String PORT_KEY              = "minikv.port";
    public static final String SWEEP_INTERVAL_MS_KEY = "minikv.sweep.interval.ms";
    public static final String MAX_CLIENTS_KEY       = "minikv.max.clients";

    @Builder.Default
    @Getter
    private String host = "0.0.0.0";

    @Builder.Default
    @Getter
    private int port = 6379;

    @Builder.Default
    @Getter
    private long sweepIntervalMs = 100;

    @Builder.Default
    @Getter
    private int maxClients = 1000;

    public InetSocketAddress socketAddress() {
        return new InetSocketAddress(host, port);
    }

    /**
     * 从properties读取配置，没有设置的项使用默认值。
     *
     * @param props properties
     * @return 配置
     * @throws IllegalArgumentException 数值格式不正确
     */
    public static ServerConf fromProperties(@NonNull Properties props) {
        ServerConfBuilder builder = ServerConf.builder();
        String host = props.getProperty(HOST_KEY);
        if (host != null) {
            builder.host(host.trim());
        }
        String port = props.getProperty(PORT_KEY);
        if (port != null) {
            builder.port(parseInt(PORT_KEY, port));
        }
        String interval = props.getProperty(SWEEP_INTERVAL_MS_KEY);
        if (interval != null) {
            builder.sweepIntervalMs(parseLong(SWEEP_INTERVAL_MS_KEY, interval));
        }
        String maxClients = props.getProperty(MAX_CLIENTS_KEY);
        if (maxClients != null) {
            builder.maxClients(parseInt(MAX_CLIENTS_KEY, maxClients));
        }
        return builder.build();
    }

    private static int parseInt(String key, String value) {
        Integer i = Ints.tryParse(value.trim());
        if (i == null) {
            throw new IllegalArgumentException(key + " is not a valid integer: " + value);
        }
        return i;
    }

    private static long parseLong(String key, String value) {
        Long l = Longs.tryParse(value.trim());
        if (l == null) {
            throw new IllegalArgumentException(key + " is not a valid integer: " + value);
        }
        return l;
    }
}
