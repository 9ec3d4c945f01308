package com.pulse.metric;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sayaç ve zamanlayıcıları isimleriyle tutan kayıt. Metrikler ilk istendikleri
 * anda oluşturulur. Konu bazlı metrikler {@code grup.anahtar.metrik} biçiminde
 * adlandırılır (ör. {@code poll.system.suppressed}).
 */
public final class MetricsRegistry
{
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();

    public Counter counter(String name) {
        return counters.computeIfAbsent(name, Counter::new);
    }

    public Counter counter(String group, Object key, String metric) {
        return counter(scoped(group, key, metric));
    }

    public Timer timer(String name) {
        return timers.computeIfAbsent(name, Timer::new);
    }

    public Timer timer(String group, Object key, String metric) {
        return timer(scoped(group, key, metric));
    }

    /** İsme göre sıralı, anlık sayaç görünümü. */
    public SortedMap<String, Counter> sortedCounters() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(counters));
    }

    public SortedMap<String, Timer> sortedTimers() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(timers));
    }

    static String scoped(String group, Object key, String metric) {
        return group + '.' + key + '.' + metric;
    }
}
