package com.issuequeue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class IssueLockTest {

    @TempDir
    Path dataDir;

    @Test
    void createsLockFileAndReleasesOnClose() {
        Path lockFile = dataDir.resolve("nested").resolve(IssueManager.LOCK_FILE);
        try (IssueLock lock = IssueLock.acquire(lockFile, Duration.ofSeconds(1))) {
            assertTrue(Files.exists(lockFile));
            assertEquals(lockFile.toAbsolutePath().normalize(), lock.getLockFile());
        }
        try (IssueLock again = IssueLock.acquire(lockFile, Duration.ofSeconds(1))) {
            assertNotNull(again);
        }
    }

    @Test
    void isNotReentrant() {
        Path lockFile = dataDir.resolve(IssueManager.LOCK_FILE);
        try (IssueLock lock = IssueLock.acquire(lockFile, Duration.ofSeconds(1))) {
            assertThrows(IllegalStateException.class, () -> IssueLock.acquire(lockFile, Duration.ofMillis(50)));
        }
    }

    @Test
    void otherThreadTimesOutWhileHeld() throws Exception {
        Path lockFile = dataDir.resolve(IssueManager.LOCK_FILE);
        IssueLock lock = IssueLock.acquire(lockFile, Duration.ofSeconds(1));
        try {
            CompletableFuture<Throwable> attempt = CompletableFuture.supplyAsync(() -> {
                try (IssueLock ignored = IssueLock.acquire(lockFile, Duration.ofMillis(100))) {
                    return null;
                } catch (IssueLockException e) {
                    return e;
                }
            });
            assertInstanceOf(IssueLockException.class, attempt.get(5, TimeUnit.SECONDS));
        } finally {
            lock.close();
        }
    }
}
