package com.tcpchat;

import com.tcpchat.session.ConnectionRegistry;
import com.tcpchat.session.RegistrationResult;

import io.netty.channel.Channel;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the Connection Registry:
 * - Username uniqueness
 * - Snapshots
 * - Thread safety
 */
@DisplayName("Connection Registry Tests")
class RegistryTest {

    private ConnectionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry();
    }

    // ==========================================
    // Test: Registration
    // ==========================================

    @Test
    @DisplayName("Should register and unregister a connection")
    void testRegisterUnregister() {
        Channel alice = new EmbeddedChannel();

        assertEquals(RegistrationResult.OK, registry.register(alice, "alice"));
        assertTrue(registry.isRegistered(alice));
        assertEquals(Optional.of("alice"), registry.getUsername(alice));

        assertEquals(Optional.of("alice"), registry.unregister(alice));
        assertFalse(registry.isRegistered(alice));
        assertEquals(Optional.empty(), registry.unregister(alice), "Second unregister finds nothing");
        assertEquals(0, registry.size());
    }

    @Test
    @DisplayName("Should reject a username held by another connection")
    void testDuplicateUsername() {
        Channel first = new EmbeddedChannel();
        Channel second = new EmbeddedChannel();

        assertEquals(RegistrationResult.OK, registry.register(first, "alice"));
        assertEquals(RegistrationResult.USERNAME_TAKEN, registry.register(second, "alice"));
        assertFalse(registry.isRegistered(second));

        registry.unregister(first);
        assertEquals(RegistrationResult.OK, registry.register(second, "alice"), "Name is free again after leave");
    }

    @Test
    @DisplayName("Usernames are case-sensitive")
    void testCaseSensitive() {
        assertEquals(RegistrationResult.OK, registry.register(new EmbeddedChannel(), "alice"));
        assertEquals(RegistrationResult.OK, registry.register(new EmbeddedChannel(), "Alice"));
        assertEquals(2, registry.size());
    }

    @Test
    @DisplayName("A connection cannot register twice")
    void testConnectionRegisteredOnce() {
        Channel alice = new EmbeddedChannel();
        registry.register(alice, "alice");

        assertThrows(IllegalStateException.class, () -> registry.register(alice, "alice2"));
        assertEquals(List.of("alice"), registry.listUsernames());
    }

    // ==========================================
    // Test: Snapshots
    // ==========================================

    @Test
    @DisplayName("Snapshot excludes the given connection and keeps join order")
    void testSnapshotTargets() {
        Channel alice = new EmbeddedChannel();
        Channel bob = new EmbeddedChannel();
        Channel carol = new EmbeddedChannel();
        registry.register(alice, "alice");
        registry.register(bob, "bob");
        registry.register(carol, "carol");

        assertEquals(List.of(alice, carol), registry.snapshotTargets(bob));
        assertEquals(List.of(alice, bob, carol), registry.snapshotTargets(null));
        assertEquals(List.of("alice", "bob", "carol"), registry.listUsernames());
    }

    @Test
    @DisplayName("Snapshot is not affected by later changes")
    void testSnapshotIsolation() {
        Channel alice = new EmbeddedChannel();
        Channel bob = new EmbeddedChannel();
        registry.register(alice, "alice");
        registry.register(bob, "bob");

        List<Channel> snapshot = registry.snapshotTargets(null);
        registry.unregister(bob);
        registry.register(new EmbeddedChannel(), "carol");

        assertEquals(List.of(alice, bob), snapshot);
    }

    // ==========================================
    // Test: Thread Safety
    // ==========================================

    @Test
    @DisplayName("Concurrent registrations of one name yield exactly one winner")
    void testConcurrentSameUsername() throws Exception {
        for (int round = 0; round < 50; round++) {
            ConnectionRegistry fresh = new ConnectionRegistry();
            int threadCount = 8;
            ExecutorService executor = Executors.newFixedThreadPool(threadCount);
            CountDownLatch startLatch = new CountDownLatch(1);
            List<Future<RegistrationResult>> results = new ArrayList<>();

            for (int t = 0; t < threadCount; t++) {
                Channel channel = new EmbeddedChannel();
                results.add(executor.submit(() -> {
                    startLatch.await();
                    return fresh.register(channel, "alice");
                }));
            }
            startLatch.countDown();

            int ok = 0;
            int taken = 0;
            for (Future<RegistrationResult> result : results) {
                if (result.get(5, TimeUnit.SECONDS) == RegistrationResult.OK) {
                    ok++;
                } else {
                    taken++;
                }
            }
            executor.shutdown();

            assertEquals(1, ok, "Exactly one registration wins");
            assertEquals(threadCount - 1, taken);
            assertEquals(List.of("alice"), fresh.listUsernames());
        }
    }

    @Test
    @DisplayName("Registry never shows duplicate names under concurrent churn")
    void testNoDuplicatesUnderChurn() throws Exception {
        int threadCount = 8;
        int operationsPerThread = 2000;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount + 1);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch endLatch = new CountDownLatch(threadCount);
        AtomicInteger duplicatesSeen = new AtomicInteger(0);

        for (int t = 0; t < threadCount; t++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    Channel channel = new EmbeddedChannel();
                    for (int i = 0; i < operationsPerThread; i++) {
                        // Few names, many contenders
                        if (registry.register(channel, "user-" + (i % 3)) == RegistrationResult.OK) {
                            registry.unregister(channel);
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    endLatch.countDown();
                }
            });
        }

        // Observer thread checks the invariant while the others churn
        Future<?> observer = executor.submit(() -> {
            while (endLatch.getCount() > 0) {
                List<String> names = registry.listUsernames();
                if (new HashSet<>(names).size() != names.size()) {
                    duplicatesSeen.incrementAndGet();
                }
            }
        });

        startLatch.countDown();
        assertTrue(endLatch.await(30, TimeUnit.SECONDS), "Churn should finish");
        observer.get(5, TimeUnit.SECONDS);
        executor.shutdown();

        assertEquals(0, duplicatesSeen.get(), "No snapshot may contain a duplicate username");
        assertEquals(0, registry.size(), "Every registration was undone");
    }
}
