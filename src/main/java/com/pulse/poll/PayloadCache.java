package com.pulse.poll;

import com.pulse.hub.Topic;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Konu başına son serileştirilmiş veriyi hatırlar. Aynı içerik tekrar
 * geldiğinde değişiklik yok sayılır ve yayın yapılmaz. Kayıtlar kendiliğinden
 * silinmez.
 */
public final class PayloadCache
{
    private final Map<Topic, CachedPayload> entries = new EnumMap<>(Topic.class);

    /**
     * İçerik öncekinden farklıysa saklar ve {@code true} döner; aynıysa
     * hiçbir şeyi değiştirmeden {@code false} döner.
     */
    public synchronized boolean updateIfChanged(Topic topic, String json, long timestamp) {
        CachedPayload previous = entries.get(topic);
        if (previous != null && previous.json().equals(json)) {
            return false;
        }
        entries.put(topic, new CachedPayload(json, timestamp));
        return true;
    }

    public synchronized Optional<CachedPayload> get(Topic topic) {
        return Optional.ofNullable(entries.get(topic));
    }

    public synchronized void clear() {
        entries.clear();
    }
}
