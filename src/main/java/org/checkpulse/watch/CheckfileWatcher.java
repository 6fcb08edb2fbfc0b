package org.checkpulse.watch;

import org.checkpulse.checkfile.CheckFile;
import org.checkpulse.config.utils.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystemLoopException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.EnumSet;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Watches the checkfiles directory tree and calls {@code onChange} once per burst of events.
 * <p>
 * Any watch failure is reported once; the watcher then stops and no further reloads happen
 * until restart.
 */
public class CheckfileWatcher implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(CheckfileWatcher.class);

    private final Path root;
    private final long debounceMillis;
    private final Runnable onChange;

    private final Map<WatchKey, Path> keys = new ConcurrentHashMap<>();
    private final AtomicBoolean active = new AtomicBoolean(false);
    private final ScheduledExecutorService debouncer = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "checkfile-reload");
        t.setDaemon(true);
        return t;
    });

    private WatchService watchService;
    private Thread thread;
    private ScheduledFuture<?> pendingReload;

    public CheckfileWatcher(Path root, long debounceMillis, Runnable onChange) {
        this.root = root;
        this.debounceMillis = Math.max(0, debounceMillis);
        this.onChange = onChange;
    }

    /**
     * Registers the directory tree and starts the watch thread.
     *
     * @return false if watching could not start; the process keeps running without reloads
     */
    public synchronized boolean start() {
        if (active.get()) return true;
        try {
            watchService = root.getFileSystem().newWatchService();
            registerTree();
        } catch (IOException e) {
            logger.error("Cannot watch checkfiles directory {}: {}. Reloads disabled until restart.", root, e.getMessage());
            closeQuietly();
            return false;
        }

        active.set(true);
        thread = new Thread(this::watchLoop, "checkfile-watcher");
        thread.setDaemon(true);
        thread.start();
        logger.info("Watching {} ({} directories)", root, keys.size());
        return true;
    }

    public boolean isActive() {
        return active.get();
    }

    @Override
    public synchronized void close() {
        if (active.getAndSet(false)) {
            logger.info("Stopping checkfile watcher");
        }
        debouncer.shutdownNow();
        closeQuietly();
        if (thread != null) {
            thread.interrupt();
        }
    }

    private void watchLoop() {
        LogContext.start("CheckfileWatcher");
        try {
            while (active.get()) {
                WatchKey key = watchService.take();
                Path dir = keys.get(key);
                for (WatchEvent<?> event : key.pollEvents()) {
                    if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                        logger.debug("Watch event overflow in {}", dir);
                    } else {
                        logger.debug("{} {}", event.kind().name(), dir == null ? event.context() : dir.resolve((Path) event.context()));
                    }
                }
                if (!key.reset()) {
                    keys.remove(key);
                    if (root.equals(dir)) {
                        fail("checkfiles directory " + root + " is no longer accessible");
                        return;
                    }
                }
                scheduleReload();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ClosedWatchServiceException e) {
            if (active.get()) {
                fail("watch service closed unexpectedly");
            }
        } catch (RuntimeException e) {
            fail(e.getMessage());
        } finally {
            LogContext.clear();
        }
    }

    private synchronized void scheduleReload() {
        if (pendingReload != null) {
            pendingReload.cancel(false);
        }
        pendingReload = debouncer.schedule(this::reload, debounceMillis, TimeUnit.MILLISECONDS);
    }

    private void reload() {
        LogContext.start("CheckfileWatcher");
        try {
            registerTree();
            onChange.run();
        } catch (IOException e) {
            logger.warn("Failed to register new directories below {}: {}", root, e.getMessage());
            onChange.run();
        } catch (RuntimeException e) {
            logger.error("Checkfile reload failed: {}", e.getMessage(), e);
        } finally {
            LogContext.clear();
        }
    }

    private void registerTree() throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("not a directory: " + root);
        }
        Files.walkFileTree(root, EnumSet.of(FileVisitOption.FOLLOW_LINKS), Integer.MAX_VALUE, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (!dir.equals(root) && CheckFile.isHiddenName(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                if (!keys.containsValue(dir)) {
                    WatchKey key = dir.register(watchService,
                            StandardWatchEventKinds.ENTRY_CREATE,
                            StandardWatchEventKinds.ENTRY_DELETE,
                            StandardWatchEventKinds.ENTRY_MODIFY);
                    keys.put(key, dir);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                if (!(e instanceof FileSystemLoopException)) {
                    logger.debug("Cannot watch {}: {}", file, e.getMessage());
                }
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void fail(String reason) {
        if (active.getAndSet(false)) {
            logger.error("Checkfile watcher stopped: {}. Reloads disabled until restart.", reason);
        }
        debouncer.shutdownNow();
        closeQuietly();
    }

    private void closeQuietly() {
        if (watchService == null) return;
        try {
            watchService.close();
        } catch (IOException e) {
            logger.debug("Error closing watch service: {}", e.getMessage());
        }
    }
}
