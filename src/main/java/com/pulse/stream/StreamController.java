package com.pulse.stream;

import org.jboss.logging.Logger;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Sürekli akan tek bir harici kaynağı (örneğin log takipçisi süreci) talep
 * olduğu sürece açık tutan sayaçlı denetleyicidir. İlk {@link #start()} kaynağı
 * açar, son eşleşen {@link #stop()} kapatır. Kaynak açıkken gelen her kayıt
 * önce {@link RingBuffer} içine yazılır, ardından kayıtlı dinleyicilere aynı
 * okuma thread'i üzerinde sırayla iletilir.
 *
 * <p>Dinleyici kaydı başlat/durdur döngüsünden bağımsızdır ve yeniden
 * başlatmalar arasında korunur. Kaynak beklenmedik şekilde biterse yeniden
 * açılmaz ve sayaç gerçek süreç durumuyla uzlaştırılmaz.</p>
 */
public class StreamController<T> implements SharedResource, AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(StreamController.class);

    private final String name;
    private final StreamSource<T> source;
    private final RingBuffer<T> buffer;
    private final Executor readerExecutor;
    private final List<Consumer<T>> listeners = new CopyOnWriteArrayList<>();

    private int refCount;
    private RecordStream<T> handle;

    public StreamController(String name, StreamSource<T> source, RingBuffer<T> buffer, Executor readerExecutor) {
        this.name = Objects.requireNonNull(name, "name");
        this.source = Objects.requireNonNull(source, "source");
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.readerExecutor = Objects.requireNonNull(readerExecutor, "readerExecutor");
    }

    @Override
    public synchronized void start() {
        refCount++;
        if (refCount == 1) {
            open();
        }
    }

    @Override
    public synchronized void stop() {
        if (refCount == 0) {
            LOG.debugf("Ignoring unmatched stop for stream %s", name);
            return;
        }
        refCount--;
        if (refCount == 0) {
            teardown();
        }
    }

    /**
     * Sayacı sıfırlar ve kaynağı koşulsuz kapatır. Yalnızca kapanış yolunda
     * kullanılır.
     */
    public synchronized void forceStop() {
        if (refCount > 0) {
            LOG.infof("Force stopping stream %s (refCount=%d)", name, refCount);
        }
        refCount = 0;
        teardown();
    }

    public synchronized int refCount() {
        return refCount;
    }

    /**
     * Kaynağın şu anda açık bir tutamacı olup olmadığını söyler.
     */
    public synchronized boolean isRunning() {
        return handle != null;
    }

    public AutoCloseable addListener(Consumer<T> listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public List<T> recent(int count) {
        return buffer.last(count);
    }

    public RingBuffer<T> buffer() {
        return buffer;
    }

    public String name() {
        return name;
    }

    @Override
    public void close() {
        forceStop();
    }

    private void open() {
        RecordStream<T> stream;
        try {
            stream = source.open();
        } catch (IOException | RuntimeException e) {
            LOG.errorf(e, "Failed to open stream %s", name);
            return;
        }
        handle = stream;
        LOG.infof("Stream %s started", name);
        try {
            readerExecutor.execute(() -> readLoop(stream));
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to schedule reader for stream %s", name);
            handle = null;
            closeStream(stream);
        }
    }

    private void teardown() {
        RecordStream<T> current = handle;
        if (current == null) {
            return;
        }
        handle = null;
        closeStream(current);
        LOG.infof("Stream %s stopped", name);
    }

    private void closeStream(RecordStream<T> stream) {
        try {
            stream.close();
        } catch (IOException e) {
            LOG.warnf(e, "Failed to close stream %s cleanly", name);
        }
    }

    private synchronized boolean isCurrent(RecordStream<T> stream) {
        return handle == stream;
    }

    private void readLoop(RecordStream<T> stream) {
        try {
            T record;
            while ((record = stream.next()) != null) {
                if (!isCurrent(stream)) {
                    return;
                }
                dispatch(record);
            }
            if (isCurrent(stream)) {
                LOG.warnf("Stream %s ended unexpectedly; it will not be restarted", name);
            }
        } catch (IOException | RuntimeException e) {
            if (isCurrent(stream)) {
                LOG.errorf(e, "Stream %s failed; it will not be restarted", name);
            } else {
                LOG.debugf("Reader for stream %s finished after close: %s", name, e.getMessage());
            }
        }
    }

    private void dispatch(T record) {
        buffer.append(record);
        for (Consumer<T> listener : listeners) {
            try {
                listener.accept(record);
            } catch (RuntimeException e) {
                LOG.warnf(e, "Listener of stream %s failed", name);
            }
        }
    }
}
