package com.agilab.image_archiving.planning;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntPredicate;

/**
 * Last sequence number handed out per bucket. Safe for concurrent callers.
 */
public class SequenceRegistry {

    private final Map<BucketKey, Integer> lastIssued = new ConcurrentHashMap<>();

    /**
     * Reserves the next sequence of a bucket, skipping numbers {@code isFree} rejects.
     * The check and the increment happen in one atomic step per bucket, so a number is never issued twice.
     */
    public int reserve(BucketKey key, IntPredicate isFree) {
        return lastIssued.compute(key, (k, last) -> {
            var candidate = last == null ? 1 : last + 1;
            while (!isFree.test(candidate)) {
                candidate++;
            }
            return candidate;
        });
    }

    public int lastIssued(BucketKey key) {
        return lastIssued.getOrDefault(key, 0);
    }

    /**
     * Filenames are unique per target directory, capture minute and project.
     */
    public record BucketKey(Path directory, String dateMinute, String project) {
    }
}
