package io.github.minikv.resp;

/**
 * 头部行的类型字符不对，或者长度不是合法整数。
 */
public class MalformedHeaderException extends RespDecodeException {
    private static final long serialVersionUID = 2270931164658473508L;

    public MalformedHeaderException(String message) {
        super(message);
    }

    public MalformedHeaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
