package io.github.minikv.command;

/**
 * 命令参数错误，以错误响应返回给客户端，不影响存储和连接。
 */
public class CommandException extends Exception {
    private static final long serialVersionUID = -2390612985737460416L;

    public CommandException(String message) {
        super(message);
    }
}
