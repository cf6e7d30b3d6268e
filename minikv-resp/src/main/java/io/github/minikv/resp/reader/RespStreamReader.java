package io.github.minikv.resp.reader;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PushbackInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.primitives.Ints;
import io.github.minikv.resp.LengthMismatchException;
import io.github.minikv.resp.MalformedHeaderException;
import io.github.minikv.resp.RespArray;
import io.github.minikv.resp.RespBulkString;
import io.github.minikv.resp.RespData;
import io.github.minikv.resp.RespDecodeException;
import io.github.minikv.resp.TruncatedException;
import lombok.NonNull;

/**
 * 从阻塞的字节流中读取客户端请求：一个array头部，后面跟着N个bulk string。
 * <p>
 * 头部行读到CRLF为止；bulk string的内容严格按声明的长度读取，不在内容中查找分隔符，
 * 所以内容里可以包含任意字节，包括CRLF本身。
 * </p>
 * 内容后面不是CRLF时，读到的那个字节会被退回流中，{@link #resync()}从它开始寻找下一个请求。
 * 非线程安全，每个连接持有一个实例。
 */
public class RespStreamReader {
    // 头部行（不含CRLF）的最大长度
    static final int MAX_HEADER_LENGTH = 64;
    // 与redis一致，bulk string最大512MB
    static final int MAX_BULK_LENGTH   = 512 * 1024 * 1024;

    private final PushbackInputStream in;

    public static RespStreamReader with(@NonNull InputStream in) {
        return new RespStreamReader(in);
    }

    private RespStreamReader(InputStream in) {
        this.in = new PushbackInputStream(in, 1);
    }

    /**
     * 读取一个完整请求。
     *
     * @return 请求数组；流在请求开始之前正常结束时返回empty
     * @throws MalformedHeaderException 类型字符不对或者长度非法
     * @throws LengthMismatchException  内容长度和声明不一致
     * @throws TruncatedException       流在请求中途结束
     * @throws IOException              底层读取失败
     */
    public Optional<RespArray> readArray() throws IOException, RespDecodeException {
        int first = in.read();
        if (first == -1) {
            return Optional.empty();
        }
        if (first != RespArray.firstChar) {
            throw new MalformedHeaderException("expected '" + RespArray.firstChar + "' but got " + describe(first));
        }

        int len = readLength();
        if (len < 1) {
            throw new MalformedHeaderException("array length must be positive, got " + len);
        }

        List<RespData> datas = new ArrayList<>(Math.min(len, 16));
        for (int i = 0; i < len; i++) {
            datas.add(readBulkString());
        }
        return Optional.of(RespArray.with(datas));
    }

    /**
     * 读取一个非null的bulk string。
     *
     * @return bulk string
     * @throws RespDecodeException 格式错误或者流提前结束
     * @throws IOException         底层读取失败
     */
    public RespBulkString readBulkString() throws IOException, RespDecodeException {
        int first = in.read();
        if (first == -1) {
            throw new TruncatedException("stream ended before bulk string header");
        }
        if (first != RespBulkString.firstChar) {
            throw new MalformedHeaderException("expected '" + RespBulkString.firstChar + "' but got " + describe(first));
        }

        int len = readLength();
        if (len < 0 || len > MAX_BULK_LENGTH) {
            throw new MalformedHeaderException("invalid bulk string length " + len);
        }

        byte[] payload = in.readNBytes(len);
        if (payload.length < len) {
            throw new TruncatedException("expected " + len + " payload bytes but stream ended after " + payload.length);
        }

        // 内容以CRLF结尾且后面没有更多数据：声明的长度比实际内容长，不再阻塞等待终止符
        if (endsWithCRLF(payload) && in.available() == 0) {
            throw new LengthMismatchException("payload is shorter than declared length " + len);
        }
        checkTerminator('\r', len);
        checkTerminator('\n', len);
        return RespBulkString.with(payload);
    }

    /**
     * 解码失败后和客户端重新对齐：丢弃已经到达的数据，直到行首出现下一个{@code '*'}为止。
     * 不会为了等待数据而阻塞。
     *
     * @return 丢弃的字节数
     * @throws IOException 底层读取失败
     */
    public long resync() throws IOException {
        long discarded = 0;
        boolean lineStart = true;
        while (in.available() > 0) {
            int b = in.read();
            if (b == -1) {
                break;
            }
            if (b == RespArray.firstChar && lineStart) {
                in.unread(b);
                break;
            }
            lineStart = b == '\n';
            discarded++;
        }
        return discarded;
    }

    private void checkTerminator(char expected, int len) throws IOException, RespDecodeException {
        int b = in.read();
        if (b == -1) {
            throw new TruncatedException("stream ended before bulk string terminator");
        }
        if (b != expected) {
            in.unread(b);
            throw new LengthMismatchException("payload does not match declared length " + len);
        }
    }

    private static boolean endsWithCRLF(byte[] payload) {
        int n = payload.length;
        return n >= 2 && payload[n - 2] == '\r' && payload[n - 1] == '\n';
    }

    private int readLength() throws IOException, RespDecodeException {
        String line = readLine();
        Integer len = Ints.tryParse(line);
        if (len == null) {
            throw new MalformedHeaderException("not a valid integer: '" + line + "'");
        }
        return len;
    }

    private String readLine() throws IOException, RespDecodeException {
        ByteArrayOutputStream os = new ByteArrayOutputStream(16);
        for (; ; ) {
            int b = in.read();
            if (b == -1) {
                throw new TruncatedException("stream ended inside header line");
            }
            if (b == '\r') {
                break;
            }
            if (os.size() == MAX_HEADER_LENGTH) {
                throw new MalformedHeaderException("header line longer than " + MAX_HEADER_LENGTH + " bytes");
            }
            os.write(b);
        }

        int lf = in.read();
        if (lf == -1) {
            throw new TruncatedException("stream ended inside header line");
        }
        if (lf != '\n') {
            throw new MalformedHeaderException("header line not terminated by CRLF");
        }
        return new String(os.toByteArray(), StandardCharsets.US_ASCII);
    }

    private static String describe(int b) {
        if (b >= 0x20 && b < 0x7f) {
            return "'" + (char) b + "'";
        }
        return String.format("0x%02x", b);
    }
}
