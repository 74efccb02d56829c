package com.agilab.image_archiving.planning;

import com.agilab.image_archiving.planning.SequenceRegistry.BucketKey;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class SequenceRegistryTest {

    private final SequenceRegistry registry = new SequenceRegistry();
    private final BucketKey key = new BucketKey(Path.of("/archive/20230601_trip/canon_eos5d_cr2"),
            "20230601-1405", "trip");

    @Test
    void reserve_shouldStartAtOneAndIncrement() {
        assertThat(registry.reserve(key, candidate -> true)).isEqualTo(1);
        assertThat(registry.reserve(key, candidate -> true)).isEqualTo(2);
        assertThat(registry.lastIssued(key)).isEqualTo(2);
    }

    @Test
    void reserve_shouldSkipOccupiedNumbers() {
        // Given - 1 and 2 already exist on disk
        Set<Integer> occupied = Set.of(1, 2, 4);

        // When/Then
        assertThat(registry.reserve(key, candidate -> !occupied.contains(candidate))).isEqualTo(3);
        assertThat(registry.reserve(key, candidate -> !occupied.contains(candidate))).isEqualTo(5);
    }

    @Test
    void reserve_shouldKeepBucketsIndependent() {
        var otherMinute = new BucketKey(key.directory(), "20230601-1406", "trip");

        registry.reserve(key, candidate -> true);
        registry.reserve(key, candidate -> true);

        assertThat(registry.reserve(otherMinute, candidate -> true)).isEqualTo(1);
        assertThat(registry.lastIssued(new BucketKey(key.directory(), "20230601-1407", "trip"))).isZero();
    }

    @Test
    void reserve_shouldNeverIssueTheSameNumberTwiceUnderContention() throws InterruptedException {
        // Given
        var threads = 8;
        var perThread = 250;
        var issued = ConcurrentHashMap.<Integer>newKeySet();
        var start = new CountDownLatch(1);
        var executor = Executors.newFixedThreadPool(threads);

        // When
        for (var t = 0; t < threads; t++) {
            executor.execute(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (var i = 0; i < perThread; i++) {
                    issued.add(registry.reserve(key, candidate -> true));
                }
            });
        }
        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        // Then
        assertThat(issued).hasSize(threads * perThread);
        assertThat(registry.lastIssued(key)).isEqualTo(threads * perThread);
    }
}
