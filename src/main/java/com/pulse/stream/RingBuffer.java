package com.pulse.stream;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Akıştan gelen son kayıtları sabit kapasiteli bir tamponda tutar. Kapasite
 * aşıldığında en eski kayıt atılır. Okumalar kayıtları tüketmez; akış
 * durmuş olsa bile son görülen geçmiş okunabilir.
 */
public final class RingBuffer<T>
{
    private final Deque<T> entries = new ArrayDeque<>();
    private final int capacity;

    public RingBuffer(int capacity) { this.capacity = Math.max(1, capacity); }

    public synchronized void append(T record) {
        if (entries.size() >= capacity) entries.removeFirst();
        entries.addLast(record);
    }

    /**
     * En yeni {@code count} kaydı eskiden yeniye sıralı döndürür.
     */
    public synchronized List<T> last(int count) {
        int n = Math.max(0, Math.min(count, entries.size()));
        var out = new ArrayList<T>(n);
        Iterator<T> it = entries.descendingIterator();
        for (int i = 0; i < n; i++) out.add(it.next());
        Collections.reverse(out);
        return out;
    }

    public synchronized List<T> all() { return new ArrayList<>(entries); }

    public synchronized int size() { return entries.size(); }

    public int capacity() { return capacity; }

    public synchronized void clear() { entries.clear(); }
}
