package com.pulse.metric;

import java.util.concurrent.atomic.LongAdder;

/**
 * Yayın, teslim, tahliye ve bastırılan tekrar gibi hub olaylarını sayar.
 * Teslim sayacı her yayında birçok thread'den artırıldığı için değer
 * {@link LongAdder} üzerinde tutulur.
 */
public final class Counter
{
    private final String name;
    private final LongAdder value = new LongAdder();

    Counter(String name) {
        this.name = name;
    }

    public void inc() {
        value.increment();
    }

    public void add(long delta) {
        value.add(delta);
    }

    public long get() {
        return value.sum();
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return name + "=" + get();
    }
}
