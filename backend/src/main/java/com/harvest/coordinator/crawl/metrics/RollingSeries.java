package com.harvest.coordinator.crawl.metrics;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fixed ring of time buckets covering one {@link SeriesWindow}. A slot is reused once the window has
 * moved past it; samples older than the bucket currently held in their slot are dropped.
 */
public class RollingSeries {
    private final SeriesWindow window;
    private final long bucketSeconds;
    private final long[] bucketStarts;
    private final double[] sums;
    private final long[] counts;

    public RollingSeries(SeriesWindow window) {
        this.window = window;
        this.bucketSeconds = window.bucket().getSeconds();
        int size = window.bucketCount();
        this.bucketStarts = new long[size];
        this.sums = new double[size];
        this.counts = new long[size];
        Arrays.fill(bucketStarts, Long.MIN_VALUE);
    }

    public SeriesWindow window() {
        return window;
    }

    public void add(Instant at, double value) {
        long start = bucketStart(at);
        int slot = slotOf(start);
        if (bucketStarts[slot] == start) {
            sums[slot] += value;
            counts[slot]++;
            return;
        }
        if (bucketStarts[slot] > start) {
            return;
        }
        bucketStarts[slot] = start;
        sums[slot] = value;
        counts[slot] = 1;
    }

    /** One point per bucket of the window ending at {@code now}, oldest first. */
    public List<SeriesPoint> points(Instant now, Aggregation aggregation) {
        long current = bucketStart(now);
        int size = bucketStarts.length;
        List<SeriesPoint> points = new ArrayList<>(size);
        for (int i = size - 1; i >= 0; i--) {
            long start = current - i * bucketSeconds;
            int slot = slotOf(start);
            if (bucketStarts[slot] == start && counts[slot] > 0) {
                double value = aggregation == Aggregation.SUM ? sums[slot] : sums[slot] / counts[slot];
                points.add(new SeriesPoint(Instant.ofEpochSecond(start), value, counts[slot]));
            } else {
                points.add(new SeriesPoint(Instant.ofEpochSecond(start), 0.0, 0));
            }
        }
        return points;
    }

    /** Sum of all samples inside the window ending at {@code now}. */
    public double total(Instant now) {
        long current = bucketStart(now);
        long oldest = current - (bucketStarts.length - 1) * bucketSeconds;
        double total = 0.0;
        for (int slot = 0; slot < bucketStarts.length; slot++) {
            if (bucketStarts[slot] >= oldest && bucketStarts[slot] <= current) {
                total += sums[slot];
            }
        }
        return total;
    }

    private long bucketStart(Instant at) {
        return Math.floorDiv(at.getEpochSecond(), bucketSeconds) * bucketSeconds;
    }

    private int slotOf(long bucketStart) {
        return (int) Math.floorMod(bucketStart / bucketSeconds, (long) bucketStarts.length);
    }
}
