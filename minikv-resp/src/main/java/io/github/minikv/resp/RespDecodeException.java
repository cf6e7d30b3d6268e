package io.github.minikv.resp;

/**
 * 请求解码失败。连接层可以恢复：回复错误后继续读取下一个请求。
 */
public class RespDecodeException extends Exception {
    private static final long serialVersionUID = -4181226092836529961L;

    public RespDecodeException(String message) {
        super(message);
    }

    public RespDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
