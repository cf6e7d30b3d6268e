package io.github.minikv.resp;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import lombok.EqualsAndHashCode;
import lombok.ToString;

@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class RespError extends RespString {
    public static final char   firstChar = '-';
    private static final String ERR_PREFIX = "ERR ";

    public static RespError withUTF8(String msg) {
        return new RespError(msg, StandardCharsets.UTF_8);
    }

    /**
     * 生成通用错误，编码后为 {@code -ERR <msg>\r\n}。
     * @param msg 错误信息
     * @return 错误响应
     */
    public static RespError err(String msg) {
        return withUTF8(ERR_PREFIX + msg);
    }

    public RespError(String content, Charset charset) {
        super(content, charset);
    }

    @Override
    char getFirstChar() {
        return firstChar;
    }
}
