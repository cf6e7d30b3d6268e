package io.github.minikv.command;

import java.util.Locale;

public class ArityException extends CommandException {
    private static final long serialVersionUID = 3370829651620373284L;

    public ArityException(Command cmd) {
        super("wrong number of arguments for '" + cmd.name().toLowerCase(Locale.ROOT) + "' command");
    }
}
