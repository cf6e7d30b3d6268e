package io.github.minikv.resp;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.ToString;

@EqualsAndHashCode
@ToString
public class RespArray implements RespData {
    public static final char firstChar = '*';

    private final List<RespData> datas;

    public static RespArray empty() {
        return new RespArray(Collections.emptyList());
    }

    public static RespArray with(List<? extends RespData> datas) {
        return new RespArray(new ArrayList<>(datas));
    }

    public static RespArray with(RespData... datas) {
        return new RespArray(Arrays.asList(datas));
    }

    /**
     * 用字符串参数构造一个请求数组，每个元素都是UTF-8编码的bulk string。
     * @param args 命令和参数
     * @return resp数组
     */
    public static RespArray ofBulkStrings(String... args) {
        List<RespData> datas = new ArrayList<>(args.length);
        for (String arg : args) {
            datas.add(RespBulkString.withUTF8(arg));
        }
        return new RespArray(datas);
    }

    private RespArray(List<RespData> datas) {
        this.datas = Collections.unmodifiableList(datas);
    }

    public int size() {
        return datas.size();
    }

    public <T extends RespData> T get(int i) {
        return (T) datas.get(i);
    }

    public List<RespData> getDatas() {
        return datas;
    }

    @Override
    public byte[] toBytes() {
        ByteArrayOutputStream os = new ByteArrayOutputStream();
        os.writeBytes((firstChar + String.valueOf(datas.size()) + "\r\n").getBytes(StandardCharsets.US_ASCII));
        for (RespData data : datas) {
            os.writeBytes(data.toBytes());
        }
        return os.toByteArray();
    }
}
