package com.pulse.metric;

import java.util.Arrays;
import java.util.concurrent.atomic.LongAdder;

/**
 * Sağlayıcı çağrıları gibi işlemlerin sürelerini toplayan zamanlayıcıdır.
 * Son ölçümleri sabit boyutlu bir örneklem dizisinde tutarak p50/p95
 * değerlerini kestirir; toplam sayı ile en küçük ve en büyük süreyi saklar.
 */
public final class Timer
{
    private final String name;
    private final LongAdder count = new LongAdder();
    private final LongAdder totalNs = new LongAdder();
    private final long[] reservoir;
    private long minNs = Long.MAX_VALUE;
    private long maxNs = Long.MIN_VALUE;
    private int idx = -1;
    private int filled;

    public Timer(String name) { this(name, 256); }
    public Timer(String name, int reservoirSize) {
        this.name = name;
        this.reservoir = new long[Math.max(16, reservoirSize)];
    }

    public void record(long durationNs)
    {
        count.increment();
        totalNs.add(durationNs);
        synchronized (this) {
            if (durationNs < minNs) minNs = durationNs;
            if (durationNs > maxNs) maxNs = durationNs;
            idx = (idx + 1) % reservoir.length;
            reservoir[idx] = durationNs;
            if (filled < reservoir.length) filled++;
        }
    }

    public Sample snapshot() {
        long c = count.sum();
        long t = totalNs.sum();
        double avg = c == 0 ? 0.0 : (double) t / c;
        long min;
        long max;
        long[] copy;
        synchronized (this) {
            min = (minNs == Long.MAX_VALUE) ? 0 : minNs;
            max = (maxNs == Long.MIN_VALUE) ? 0 : maxNs;
            copy = Arrays.copyOf(reservoir, filled);
        }
        long p50 = 0;
        long p95 = 0;
        if (copy.length > 0) {
            Arrays.sort(copy);
            p50 = copy[(int) (0.50 * (copy.length - 1))];
            p95 = copy[(int) (0.95 * (copy.length - 1))];
        }
        return new Sample(name, c, t, avg, min, max, p50, p95);
    }

    /**
     * Anlık metrik değerlerini temsil eden immutable taşıyıcıdır.
     */
    public record Sample(String name, long count, long totalNs, double avgNs,
                         long minNs, long maxNs, long p50Ns, long p95Ns) {}
}
