package com.issuequeue;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Exclusive lock on a data directory, held for the length of one manager operation.
 *
 * Two layers: a per-path {@link ReentrantLock} serializes threads of this JVM
 * (OS file locks are held per process, not per thread), and an advisory
 * {@link FileLock} on the lock file serializes processes. The OS drops the file
 * lock when a process dies, so a crashed holder cannot wedge the directory.
 *
 * Use with try-with-resources; the lock is not reentrant.
 */
public final class IssueLock implements AutoCloseable {

    private static final long POLL_INTERVAL_MS = 25;
    private static final Map<Path, ReentrantLock> LOCAL_LOCKS = new ConcurrentHashMap<>();

    private final Path lockFile;
    private final ReentrantLock localLock;
    private final FileChannel channel;
    private final FileLock fileLock;
    private boolean released;

    private IssueLock(Path lockFile, ReentrantLock localLock, FileChannel channel, FileLock fileLock) {
        this.lockFile = lockFile;
        this.localLock = localLock;
        this.channel = channel;
        this.fileLock = fileLock;
    }

    public static IssueLock acquire(Path lockFile, Duration timeout) {
        Path key = lockFile.toAbsolutePath().normalize();
        long deadline = System.nanoTime() + timeout.toNanos();
        ReentrantLock localLock = LOCAL_LOCKS.computeIfAbsent(key, path -> new ReentrantLock());
        if (localLock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Issue lock is not reentrant: " + key);
        }

        try {
            if (!localLock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw timedOut(key, timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IssueLockException("Interrupted while waiting for lock " + key, e);
        }

        FileChannel channel = null;
        try {
            Path parent = key.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            channel = FileChannel.open(key, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            while (true) {
                FileLock fileLock = channel.tryLock();
                if (fileLock != null) {
                    return new IssueLock(key, localLock, channel, fileLock);
                }
                if (System.nanoTime() >= deadline) {
                    throw timedOut(key, timeout);
                }
                Thread.sleep(POLL_INTERVAL_MS);
            }
        } catch (IOException | OverlappingFileLockException e) {
            closeQuietly(channel);
            localLock.unlock();
            throw new IssueLockException("Failed to lock " + key + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            closeQuietly(channel);
            localLock.unlock();
            Thread.currentThread().interrupt();
            throw new IssueLockException("Interrupted while waiting for lock " + key, e);
        } catch (RuntimeException e) {
            closeQuietly(channel);
            localLock.unlock();
            throw e;
        }
    }

    public Path getLockFile() {
        return lockFile;
    }

    @Override
    public void close() {
        if (released) {
            return;
        }
        released = true;
        try {
            fileLock.release();
        } catch (IOException e) {
            warn("Failed to release file lock " + lockFile + ": " + e.getMessage());
        } finally {
            closeQuietly(channel);
            localLock.unlock();
        }
    }

    private static IssueLockException timedOut(Path key, Duration timeout) {
        return new IssueLockException("Timed out after " + timeout.toMillis() + "ms waiting for lock " + key);
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            warn("Failed to close lock channel: " + e.getMessage());
        }
    }

    private static void warn(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[IssueLock] " + message);
        }
    }
}
