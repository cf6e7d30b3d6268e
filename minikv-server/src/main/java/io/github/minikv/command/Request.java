package io.github.minikv.command;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.minikv.resp.RespBulkString;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * 解码后的客户端请求。args包含全部参数，第一个是命令名本身。
 */
@EqualsAndHashCode
@ToString
public class Request {
    @Getter
    private final Command              cmd;
    @Getter
    private final List<RespBulkString> args;

    public Request(@NonNull Command cmd, @NonNull List<RespBulkString> args) {
        Preconditions.checkArgument(!args.isEmpty(), "request must contain the command name");
        this.cmd = cmd;
        this.args = ImmutableList.copyOf(args);
    }

    /**
     * @return 命令名之后的参数个数
     */
    public int argc() {
        return args.size() - 1;
    }

    /**
     * @param i 从1开始，0是命令名
     * @return 第i个参数的原始字节
     */
    public byte[] arg(int i) {
        return args.get(i).getContent();
    }

    public String argAsUTF8(int i) {
        return args.get(i).contentAsUTF8();
    }
}
