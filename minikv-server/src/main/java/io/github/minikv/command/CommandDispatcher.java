package io.github.minikv.command;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;

import com.google.common.primitives.Longs;
import com.google.inject.Inject;
import io.github.minikv.resp.RespBulkString;
import io.github.minikv.resp.RespData;
import io.github.minikv.resp.RespError;
import io.github.minikv.resp.RespSimpleString;
import io.github.minikv.store.ExpiringValue;
import io.github.minikv.store.Store;
import lombok.NonNull;

/**
 * 把{@link Request}映射为{@link Store}操作和响应，本身无状态。
 * <ul>
 * <li>PING：返回PONG</li>
 * <li>ECHO message：以bulk string原样返回message</li>
 * <li>SET key value [XP ttl-ms]：写入，带XP时ttl-ms毫秒后过期</li>
 * <li>GET key：返回值，不存在或已过期时返回null bulk string</li>
 * </ul>
 * 参数错误以{@code -ERR}响应返回，不会修改存储。
 */
public class CommandDispatcher {
    private static final String XP_OPTION = "XP";

    private final Store store;

    @Inject
    public CommandDispatcher(@NonNull Store store) {
        this.store = store;
    }

    public RespData dispatch(@NonNull Request request) {
        try {
            return execute(request);
        } catch (CommandException e) {
            return RespError.err(e.getMessage());
        }
    }

    RespData execute(Request request) throws CommandException {
        switch (request.getCmd()) {
            case PING:
                return ping(request);
            case ECHO:
                return echo(request);
            case SET:
                return set(request);
            case GET:
                return get(request);
            default:
                throw new IllegalStateException("unhandled command " + request.getCmd());
        }
    }

    private RespData ping(Request request) throws ArityException {
        checkArity(request, 0);
        return RespSimpleString.PONG;
    }

    private RespData echo(Request request) throws ArityException {
        checkArity(request, 1);
        return RespBulkString.with(request.arg(1));
    }

    private RespData set(Request request) throws CommandException {
        if (request.argc() < 2) {
            throw new ArityException(request.getCmd());
        }

        long deadline = ExpiringValue.NEVER;
        if (request.argc() > 2) {
            String option = request.argAsUTF8(3);
            if (!XP_OPTION.equals(option.toUpperCase(Locale.ROOT))) {
                throw new InvalidArgumentException("syntax error, unknown option '" + option + "'");
            }
            if (request.argc() < 4) {
                throw new InvalidArgumentException("syntax error, " + XP_OPTION + " requires a ttl");
            }
            if (request.argc() > 4) {
                throw new InvalidArgumentException("syntax error, unexpected argument '" + request.argAsUTF8(5) + "'");
            }
            deadline = deadline(parseTtl(request.argAsUTF8(4)));
        }

        store.set(key(request), request.arg(2), deadline);
        return RespSimpleString.OK;
    }

    private RespData get(Request request) throws ArityException {
        checkArity(request, 1);
        Optional<byte[]> value = store.get(key(request));
        return value.map(RespBulkString::with).orElse(RespBulkString.nullBulkString());
    }

    private long deadline(long ttl) throws InvalidArgumentException {
        try {
            return Math.addExact(store.now(), ttl);
        } catch (ArithmeticException e) {
            throw new InvalidArgumentException("invalid expire time in 'set' command");
        }
    }

    private static long parseTtl(String s) throws InvalidArgumentException {
        Long ttl = Longs.tryParse(s);
        if (ttl == null) {
            throw new InvalidArgumentException("value is not an integer or out of range");
        }
        if (ttl <= 0) {
            throw new InvalidArgumentException("invalid expire time in 'set' command");
        }
        return ttl;
    }

    // ISO-8859-1把每个字节映射为一个字符，不同的二进制key不会冲突
    private static String key(Request request) {
        return new String(request.arg(1), StandardCharsets.ISO_8859_1);
    }

    private static void checkArity(Request request, int expected) throws ArityException {
        if (request.argc() != expected) {
            throw new ArityException(request.getCmd());
        }
    }
}
