package io.github.minikv.resp;

import java.nio.ByteBuffer;

/**
 * 一个resp值：请求是bulk string组成的数组，响应是simple string、error或者bulk string。
 * 编码没有副作用，同一个值可以重复写给多个连接。
 */
public interface RespData {

    /**
     * @return 完整的线上格式，包括类型字符和结尾的CRLF
     */
    byte[] toBytes();

    /**
     * @return 包装{@link #toBytes()}的buffer，供{@link java.nio.channels.SocketChannel}写出
     */
    default ByteBuffer toByteBuffer() {
        return ByteBuffer.wrap(toBytes());
    }
}
