package io.walkie.lifecycle;

import io.walkie.config.WalkieConfig;
import io.walkie.observability.DaemonLog;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-host bookkeeping around one daemon: the private directory, lock file, pid file
 * and control socket path.
 *
 * <p>{@link #acquire()} runs before any socket is bound and fails if another live
 * daemon owns the directory. {@link #shutdown()} removes the socket path and pid file,
 * releases the lock, then closes the registered resources in order. It runs at most
 * once and may be called from a shutdown hook or from a request thread.
 */
public final class DaemonLifecycle {
    private final WalkieConfig config;
    private final DaemonLog log;
    private final long pid;
    private final List<AutoCloseable> resources;
    private final AtomicBoolean shutdown;
    private final CountDownLatch stopped;
    private FileChannel lockChannel;
    private FileLock lock;

    public DaemonLifecycle(WalkieConfig config, DaemonLog log) {
        this(config, log, ProcessHandle.current().pid());
    }

    DaemonLifecycle(WalkieConfig config, DaemonLog log, long pid) {
        this.config = config;
        this.log = log;
        this.pid = pid;
        this.resources = new ArrayList<>();
        this.shutdown = new AtomicBoolean(false);
        this.stopped = new CountDownLatch(1);
    }

    /** Creates the private directory. Safe to call before the log file can be written. */
    public static void ensurePrivateDirectory(Path dir) throws IOException {
        Files.createDirectories(dir);
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(dir, PosixFilePermissions.fromString("rwx------"));
        }
    }

    public void acquire() throws IOException {
        ensurePrivateDirectory(config.homeDir());
        takeLock();
        Optional<Long> recorded = readRecordedPid();
        if (recorded.isPresent() && recorded.get() != pid && isAlive(recorded.get())) {
            releaseLock();
            log.log("daemon.already_running", Map.of("pid", recorded.get()));
            throw new IllegalStateException("Another daemon already running pid=" + recorded.get());
        }
        if (recorded.isPresent() && recorded.get() != pid) {
            log.log("daemon.stale_pid", Map.of("pid", recorded.get()));
        }
        Files.writeString(config.pidFile(), Long.toString(pid), StandardCharsets.UTF_8);
        if (Files.deleteIfExists(config.socketPath())) {
            log.log("daemon.stale_socket_removed", Map.of("socket", config.socketPath().toString()));
        }
        log.log("daemon.acquired", Map.of("pid", pid, "home", config.homeDir().toString()));
    }

    /** Restricts the freshly bound control socket to the owning user. */
    public void secureSocket() throws IOException {
        Path socket = config.socketPath();
        if (Files.exists(socket) && FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(socket, PosixFilePermissions.fromString("rw-------"));
        }
    }

    /** Registers a resource closed at shutdown, after earlier registrations. */
    public synchronized void onShutdown(AutoCloseable resource) {
        resources.add(resource);
    }

    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        deleteQuietly(config.socketPath());
        deleteQuietly(config.pidFile());
        releaseLock();
        deleteQuietly(config.lockFile());
        List<AutoCloseable> toClose;
        synchronized (this) {
            toClose = new ArrayList<>(resources);
        }
        for (AutoCloseable resource : toClose) {
            try {
                resource.close();
            } catch (Exception e) {
                log.log("daemon.shutdown_step_failed", Map.of(
                        "resource", resource.getClass().getSimpleName(),
                        "error", String.valueOf(e.getMessage())
                ));
            }
        }
        log.log("daemon.stopped", Map.of("pid", pid));
        stopped.countDown();
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    public void awaitShutdown() throws InterruptedException {
        stopped.await();
    }

    Optional<Long> readRecordedPid() {
        Path file = config.pidFile();
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            String raw = Files.readString(file, StandardCharsets.UTF_8).trim();
            return raw.isEmpty() ? Optional.empty() : Optional.of(Long.parseLong(raw));
        } catch (IOException | NumberFormatException e) {
            return Optional.empty();
        }
    }

    static boolean isAlive(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    private void takeLock() throws IOException {
        lockChannel = FileChannel.open(config.lockFile(), StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        try {
            lock = lockChannel.tryLock();
        } catch (OverlappingFileLockException e) {
            lock = null;
        }
        if (lock == null) {
            lockChannel.close();
            lockChannel = null;
            log.log("daemon.lock_busy", Map.of("lock", config.lockFile().toString()));
            throw new IllegalStateException("Another daemon already running (lock held: " + config.lockFile() + ")");
        }
    }

    private synchronized void releaseLock() {
        try {
            if (lock != null && lock.isValid()) {
                lock.release();
            }
            if (lockChannel != null) {
                lockChannel.close();
            }
        } catch (IOException e) {
            log.log("daemon.lock_release_failed", Map.of("error", String.valueOf(e.getMessage())));
        } finally {
            lock = null;
            lockChannel = null;
        }
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.log("daemon.unlink_failed", Map.of("path", path.toString(), "error", String.valueOf(e.getMessage())));
        }
    }
}
