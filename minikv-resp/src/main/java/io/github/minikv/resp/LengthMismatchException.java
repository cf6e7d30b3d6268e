package io.github.minikv.resp;

/**
 * bulk string的实际内容长度与声明的长度不一致。
 */
public class LengthMismatchException extends RespDecodeException {
    private static final long serialVersionUID = -1745402839016436714L;

    public LengthMismatchException(String message) {
        super(message);
    }
}
