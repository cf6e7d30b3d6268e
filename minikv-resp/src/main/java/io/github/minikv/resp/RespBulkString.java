package io.github.minikv.resp;

import java.nio.charset.StandardCharsets;

import com.google.common.primitives.Bytes;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 二进制安全的字符串，长度前缀编码：{@code $<len>\r\n<bytes>\r\n}。
 * content为null时表示null bulk string，编码为{@code $-1\r\n}。
 */
@EqualsAndHashCode
public class RespBulkString implements RespData {
    public static final char firstChar = '$';

    private static final RespBulkString NULL = new RespBulkString(null);
    private static final byte[]         CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    @Getter
    private final int    length;
    @Getter
    private final byte[] content;

    public static RespBulkString with(byte[] content) {
        return new RespBulkString(content);
    }

    public static RespBulkString withUTF8(String content) {
        return new RespBulkString(content.getBytes(StandardCharsets.UTF_8));
    }

    public static RespBulkString nullBulkString() {
        return NULL;
    }

    private RespBulkString(byte[] content) {
        this.content = content;
        this.length = content == null ? -1 : content.length;
    }

    public boolean isNull() {
        return content == null;
    }

    public String contentAsUTF8() {
        return content == null ? null : new String(content, StandardCharsets.UTF_8);
    }

    @Override
    public byte[] toBytes() {
        byte[] header = (firstChar + String.valueOf(length) + "\r\n").getBytes(StandardCharsets.US_ASCII);
        if (content == null) {
            return header;
        }
        return Bytes.concat(header, content, CRLF);
    }

    @Override
    public String toString() {
        final int maxLen = 20;
        if (content == null) {
            return "RespBulkString [null]";
        }
        String shown = new String(content, 0, Math.min(content.length, maxLen), StandardCharsets.UTF_8);
        return "RespBulkString [length=" + length + ", content=" + shown + (length > maxLen ? "..." : "") + "]";
    }
}
