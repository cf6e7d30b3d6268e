package io.github.minikv.command;

import java.util.Locale;
import java.util.Optional;

/**
 * 支持的命令。
 */
public enum Command {
    PING,
    ECHO,
    SET,
    GET;

    /**
     * 按名字查找命令，不区分大小写。
     *
     * @param name 命令名
     * @return 命令；不支持时返回empty
     */
    public static Optional<Command> of(String name) {
        String upper = name.toUpperCase(Locale.ROOT);
        for (Command c : values()) {
            if (c.name().equals(upper)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }
}
