package io.github.minikv.resp;

public class TruncatedException extends RespDecodeException {
    private static final long serialVersionUID = 5319873304125077436L;

    public TruncatedException(String message) {
        super(message);
    }
}
