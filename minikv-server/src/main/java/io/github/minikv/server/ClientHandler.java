package io.github.minikv.server;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.SocketChannel;
import java.util.Optional;

import io.github.minikv.command.CommandDispatcher;
import io.github.minikv.command.Request;
import io.github.minikv.command.RequestDecoder;
import io.github.minikv.resp.RespData;
import io.github.minikv.resp.RespDecodeException;
import io.github.minikv.resp.RespError;
import io.github.minikv.resp.reader.RespStreamReader;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 处理一个客户端连接：循环读取请求，交给{@link CommandDispatcher}处理，再写回响应。
 * <ul>
 * <li>请求格式错误：返回{@code -ERR invalid request}，连接保持打开。</li>
 * <li>客户端关闭：正常退出。</li>
 * <li>读写失败：只关闭本连接，不影响其他连接和监听。</li>
 * </ul>
 */
class ClientHandler implements Runnable {
    private static final Logger    logger          = LoggerFactory.getLogger(ClientHandler.class);
    private static final int       BUFFER_SIZE     = 8 * 1024;
    static final         RespError INVALID_REQUEST = RespError.err("invalid request");

    @Getter
    private final SocketChannel     clientChannel;
    private final CommandDispatcher dispatcher;

    ClientHandler(@NonNull SocketChannel clientChannel, @NonNull CommandDispatcher dispatcher) {
        this.clientChannel = clientChannel;
        this.dispatcher = dispatcher;
    }

    @Override
    public void run() {
        SocketAddress remote = remoteAddress();
        logger.debug("client {} connected.", remote);
        try {
            InputStream in = new BufferedInputStream(Channels.newInputStream(clientChannel), BUFFER_SIZE);
            RequestDecoder decoder = new RequestDecoder(RespStreamReader.with(in));
            while (clientChannel.isOpen()) {
                RespData resp;
                try {
                    Optional<Request> request = decoder.decode();
                    if (!request.isPresent()) {
                        logger.debug("client {} closed the connection.", remote);
                        return;
                    }
                    resp = dispatcher.dispatch(request.get());
                } catch (RespDecodeException e) {
                    logger.debug("invalid request from {}: {}", remote, e.getMessage());
                    decoder.getReader().resync();
                    resp = INVALID_REQUEST;
                }
                write(resp);
            }
        } catch (ClosedChannelException e) {
            logger.debug("connection to {} was closed.", remote);
        } catch (IOException e) {
            logger.warn("connection to {} failed, closing it.", remote, e);
        } catch (RuntimeException e) {
            logger.error("unexpected error on connection to {}, closing it.", remote, e);
        } finally {
            close();
        }
    }

    private void write(RespData resp) throws IOException {
        ByteBuffer src = resp.toByteBuffer();
        while (src.hasRemaining()) {
            clientChannel.write(src);
        }
    }

    private SocketAddress remoteAddress() {
        return clientChannel.socket().getRemoteSocketAddress();
    }

    private void close() {
        if (!clientChannel.isOpen()) {
            return;
        }
        try {
            clientChannel.close();
        } catch (IOException e) {
            logger.warn("fail to close client channel.", e);
        }
    }
}
