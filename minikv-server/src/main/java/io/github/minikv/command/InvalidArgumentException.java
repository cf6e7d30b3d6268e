package io.github.minikv.command;

public class InvalidArgumentException extends CommandException {
    private static final long serialVersionUID = -6718457033964532290L;

    public InvalidArgumentException(String message) {
        super(message);
    }
}
