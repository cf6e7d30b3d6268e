package io.github.minikv.command;

import io.github.minikv.resp.RespDecodeException;

public class UnknownCommandException extends RespDecodeException {
    private static final long serialVersionUID = 8263541086650384791L;

    public UnknownCommandException(String message) {
        super(message);
    }
}
