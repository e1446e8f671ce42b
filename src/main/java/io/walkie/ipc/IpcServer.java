package io.walkie.ipc;

import io.walkie.observability.DaemonLog;
import io.walkie.runtime.WalkieDaemon;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/** Accepts local control connections on a Unix-domain socket. */
public final class IpcServer implements AutoCloseable {
    private final Path socketPath;
    private final WalkieDaemon daemon;
    private final IpcDispatcher dispatcher;
    private final DaemonLog log;
    private final Set<IpcSession> sessions;
    private final ExecutorService workers;
    private final AtomicBoolean closed;
    private ServerSocketChannel server;

    public IpcServer(Path socketPath, WalkieDaemon daemon, Runnable stopAction) {
        this.socketPath = socketPath;
        this.daemon = daemon;
        this.dispatcher = new IpcDispatcher(daemon, stopAction);
        this.log = daemon.log();
        this.sessions = ConcurrentHashMap.newKeySet();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "walkie-ipc");
            thread.setDaemon(true);
            return thread;
        });
        this.closed = new AtomicBoolean(false);
    }

    /** Binds the socket path, which must not exist, and starts accepting. */
    public void start() throws IOException {
        server = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
        server.bind(UnixDomainSocketAddress.of(socketPath));
        workers.execute(this::acceptLoop);
        log.log("ipc.listening", Map.of("socket", socketPath.toString()));
    }

    public Path socketPath() {
        return socketPath;
    }

    private void acceptLoop() {
        while (!closed.get()) {
            SocketChannel socket;
            try {
                socket = server.accept();
            } catch (IOException e) {
                if (!closed.get()) {
                    log.log("ipc.accept_failed", Map.of("error", String.valueOf(e.getMessage())));
                }
                return;
            }
            IpcSession[] holder = new IpcSession[1];
            IpcSession session = new IpcSession(
                    socket,
                    daemon.loop(),
                    daemon.channels(),
                    dispatcher,
                    daemon.settings().maxIpcBufferBytes(),
                    () -> sessions.remove(holder[0])
            );
            holder[0] = session;
            sessions.add(session);
            workers.execute(session::writeLoop);
            workers.execute(session::readLoop);
        }
    }

    /** Stops accepting, drops open sessions and removes the socket path. */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (server != null) {
            try {
                server.close();
            } catch (IOException e) {
                log.log("ipc.close_failed", Map.of("error", String.valueOf(e.getMessage())));
            }
        }
        for (IpcSession session : new ArrayList<>(sessions)) {
            session.close();
        }
        try {
            Files.deleteIfExists(socketPath);
        } catch (IOException e) {
            log.log("ipc.unlink_failed", Map.of("socket", socketPath.toString(), "error", String.valueOf(e.getMessage())));
        }
        workers.shutdown();
    }
}
