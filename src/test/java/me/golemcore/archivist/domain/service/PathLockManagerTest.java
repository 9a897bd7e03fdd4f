package me.golemcore.archivist.domain.service;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PathLockManagerTest {

    private final PathLockManager lockManager = new PathLockManager();

    @Test
    void lockIsReleasedOnClose() {
        try (PathLockManager.PathLock ignored = lockManager.lock("a.md")) {
            assertTrue(lockManager.isLocked("a.md"));
        }
        assertFalse(lockManager.isLocked("a.md"));
    }

    @Test
    void lockAllHoldsEveryPath() {
        try (PathLockManager.PathLock ignored = lockManager.lockAll(List.of("b.md", "a.md", "c.md"))) {
            assertTrue(lockManager.isLocked("a.md"));
            assertTrue(lockManager.isLocked("b.md"));
            assertTrue(lockManager.isLocked("c.md"));
        }
        assertFalse(lockManager.isLocked("b.md"));
    }

    @Test
    void releasedPathsAreForgotten() {
        try (PathLockManager.PathLock outer = lockManager.lockAll(List.of("a.md", "b.md"))) {
            try (PathLockManager.PathLock nested = lockManager.lock("a.md")) {
                assertEquals(2, lockManager.trackedPaths());
            }
            assertTrue(lockManager.isLocked("a.md"));
            assertEquals(2, lockManager.trackedPaths());
        }
        assertEquals(0, lockManager.trackedPaths());
    }

    @Test
    void overlappingSetsInOppositeOrderDoNotDeadlock() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<?> first = executor.submit(() -> repeat(start, List.of("x.md", "y.md")));
            Future<?> second = executor.submit(() -> repeat(start, List.of("y.md", "x.md")));
            start.countDown();

            first.get(10, TimeUnit.SECONDS);
            second.get(10, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
        assertFalse(lockManager.isLocked("x.md"));
        assertEquals(0, lockManager.trackedPaths());
    }

    private void repeat(CountDownLatch start, List<String> paths) {
        try {
            start.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        for (int i = 0; i < 500; i++) {
            try (PathLockManager.PathLock ignored = lockManager.lockAll(paths)) {
                assertTrue(lockManager.isLocked(paths.get(0)));
            }
        }
    }
}
