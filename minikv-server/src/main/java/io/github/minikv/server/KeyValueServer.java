package io.github.minikv.server;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.StandardSocketOptions;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.minikv.command.CommandDispatcher;
import io.github.minikv.resp.RespError;
import lombok.Builder;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 监听指定端口，每个连接使用一个独立的工作线程（{@link ClientHandler}）处理。
 * 单个连接的读写错误只关闭该连接，监听线程和其他连接继续运行。
 */
public class KeyValueServer implements Runnable {
    private static final Logger    logger              = LoggerFactory.getLogger(KeyValueServer.class);
    static final         RespError MAX_CLIENTS_REACHED = RespError.err("max number of clients reached");

    private final    InetSocketAddress  socketAddress;
    private final    CommandDispatcher  dispatcher;
    private final    int                maxClients;
    private final    Set<SocketChannel> clients = ConcurrentHashMap.newKeySet();
    private final    Semaphore          permits;
    private volatile ServerSocketChannel ssc;
    private volatile ExecutorService     executorService;
    private volatile Thread              acceptorThread;
    private volatile boolean             started = false;

    @Builder
    public KeyValueServer(@NonNull InetSocketAddress socketAddress, @NonNull CommandDispatcher dispatcher,
                          int maxClients) {
        Preconditions.checkArgument(maxClients > 0, "max clients must be positive: %s", maxClients);
        this.socketAddress = socketAddress;
        this.dispatcher = dispatcher;
        this.maxClients = maxClients;
        this.permits = new Semaphore(maxClients);
    }

    public void start() throws IOException {
        synchronized (this) {
            Preconditions.checkState(!started, "already started");
            ssc = ServerSocketChannel.open();
            ssc.setOption(StandardSocketOptions.SO_REUSEADDR, true);
            ssc.bind(socketAddress);
            ssc.configureBlocking(true);

            // 每个连接一个线程，连接数由permits限制
            executorService = Executors.newCachedThreadPool(
                    new ThreadFactoryBuilder().setNameFormat("minikv-client-%d").build());

            started = true;
            acceptorThread = new Thread(this, "minikv-acceptor");
            acceptorThread.start();
            logger.info("kv server started at {}.", getLocalAddress());
        }
    }

    public void shutdown() throws IOException {
        synchronized (this) {
            if (!started) {
                return;
            }
            started = false;
            ssc.close();
            executorService.shutdownNow();
            for (SocketChannel c : clients) {
                c.close();
            }
            clients.clear();
            logger.info("kv server stopped.");
        }
    }

    public boolean isStarted() {
        return started;
    }

    /**
     * @return 实际绑定的地址，监听端口为0时可以用来获取分配的端口
     */
    public InetSocketAddress getLocalAddress() throws IOException {
        Preconditions.checkState(ssc != null, "not started");
        return (InetSocketAddress) ssc.getLocalAddress();
    }

    int connectedClients() {
        return clients.size();
    }

    @Override
    public void run() {
        while (started) {
            try {
                SocketChannel cc = ssc.accept();
                serve(cc);
            } catch (ClosedChannelException e) {
                if (started) {
                    logger.error("server socket closed unexpectedly.", e);
                }
                return;
            } catch (IOException e) {
                logger.error("fail to accept connection.", e);
            }
        }
    }

    private void serve(SocketChannel cc) {
        // 连接处理结束时立即归还permit，不依赖工作线程何时回到线程池
        if (!permits.tryAcquire()) {
            logger.warn("reject client {}, max number of clients {} reached.",
                    cc.socket().getRemoteSocketAddress(), maxClients);
            reject(cc);
            return;
        }
        clients.add(cc);
        ClientHandler handler = new ClientHandler(cc, dispatcher);
        try {
            executorService.execute(() -> {
                try {
                    handler.run();
                } finally {
                    permits.release();
                    clients.remove(cc);
                }
            });
        } catch (RejectedExecutionException e) {
            // 只在shutdown过程中发生
            logger.debug("executor stopped, closing client {}.", cc.socket().getRemoteSocketAddress());
            clients.remove(cc);
            permits.release();
            reject(cc);
        }
    }

    private void reject(SocketChannel cc) {
        try (SocketChannel c = cc) {
            ByteBuffer src = MAX_CLIENTS_REACHED.toByteBuffer();
            while (src.hasRemaining()) {
                c.write(src);
            }
        } catch (IOException e) {
            logger.warn("fail to reject client.", e);
        }
    }
}
