package io.github.minikv.command;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import io.github.minikv.resp.RespArray;
import io.github.minikv.resp.RespBulkString;
import io.github.minikv.resp.RespData;
import io.github.minikv.resp.RespDecodeException;
import io.github.minikv.resp.reader.RespStreamReader;
import lombok.Getter;
import lombok.NonNull;

/**
 * 从连接的字节流中解码{@link Request}。
 */
public class RequestDecoder {
    @Getter
    private final RespStreamReader reader;

    public RequestDecoder(@NonNull RespStreamReader reader) {
        this.reader = reader;
    }

    /**
     * @return 下一个请求；客户端正常关闭时返回empty
     * @throws RespDecodeException 帧格式错误或者命令不支持
     * @throws IOException         读取失败
     */
    public Optional<Request> decode() throws IOException, RespDecodeException {
        Optional<RespArray> array = reader.readArray();
        if (!array.isPresent()) {
            return Optional.empty();
        }
        return Optional.of(toRequest(array.get()));
    }

    static Request toRequest(RespArray array) throws UnknownCommandException {
        // 读取器只会产生bulk string
        List<RespBulkString> args = new ArrayList<>(array.size());
        for (RespData data : array.getDatas()) {
            args.add((RespBulkString) data);
        }
        String name = args.get(0).contentAsUTF8();
        Command cmd = Command.of(name).orElseThrow(() -> new UnknownCommandException("unknown command '" + name + "'"));
        return new Request(cmd, args);
    }
}
