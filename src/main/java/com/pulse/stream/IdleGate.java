package com.pulse.stream;

import io.vertx.core.Vertx;
import org.jboss.logging.Logger;

import java.util.Objects;

/**
 * Açıkça "izlemeyi bıraktım" diyemeyen istemciler (ör. REST ile yoklayanlar)
 * için zamana dayalı talep sinyalidir. Her {@link #touch()} süreyi uzatır ve
 * etkin değilse paylaşılan kaynağa bir {@code start} gönderir; süre dolunca
 * eşleşen tek {@code stop} çağrılır.
 */
public class IdleGate implements AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(IdleGate.class);

    private final SharedResource resource;
    private final Vertx vertx;
    private final long idleTimeoutMillis;

    private boolean active;
    private long timerId = -1L;

    public IdleGate(SharedResource resource, Vertx vertx, long idleTimeoutMillis) {
        this.resource = Objects.requireNonNull(resource, "resource");
        this.vertx = Objects.requireNonNull(vertx, "vertx");
        if (idleTimeoutMillis <= 0) {
            throw new IllegalArgumentException("idleTimeoutMillis must be positive");
        }
        this.idleTimeoutMillis = idleTimeoutMillis;
    }

    public synchronized void touch() {
        if (!active) {
            active = true;
            resource.start();
            LOG.debugf("Idle gate opened for %d ms", idleTimeoutMillis);
        }
        if (timerId >= 0L) {
            vertx.cancelTimer(timerId);
        }
        timerId = vertx.setTimer(idleTimeoutMillis, this::expire);
    }

    public synchronized boolean isActive() {
        return active;
    }

    public long idleTimeoutMillis() {
        return idleTimeoutMillis;
    }

    private synchronized void expire(long firedId) {
        if (firedId != timerId) {
            return;
        }
        timerId = -1L;
        if (active) {
            active = false;
            resource.stop();
            LOG.debug("Idle gate expired");
        }
    }

    @Override
    public synchronized void close() {
        if (timerId >= 0L) {
            vertx.cancelTimer(timerId);
            timerId = -1L;
        }
        if (active) {
            active = false;
            resource.stop();
        }
    }
}
