package com.pulse.config;

import com.pulse.metric.MetricsRegistry;
import io.quarkus.arc.DefaultBean;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.WorkerExecutor;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * CDI tarafından yönetilen bu yapılandırma sınıfı, hub bileşenlerinin ortak
 * kullandığı Vert.x örneğini, sağlayıcı çağrılarının çalıştığı worker havuzunu
 * ve metrik kayıt defterini üretir. Değerler {@link HubProperties} üzerinden
 * okunur.
 */
@ApplicationScoped
public class HubConfig {

    static final String PROVIDER_POOL = "hub-providers";

    private final HubProperties properties;
    private final AtomicBoolean ownsVertx = new AtomicBoolean(false);

    @Inject
    public HubConfig(HubProperties properties) {
        this.properties = properties;
    }

    @Produces
    @Singleton
    @DefaultBean
    public Vertx vertx()
    {
        ownsVertx.set(true);
        var network = properties.network();

        VertxOptions options = new VertxOptions();
        int eventLoopThreads = network.eventLoopThreads();
        if (eventLoopThreads <= 0) {
            eventLoopThreads = VertxOptions.DEFAULT_EVENT_LOOP_POOL_SIZE;
        }
        options.setEventLoopPoolSize(eventLoopThreads);
        options.setWorkerPoolSize(Math.max(1, network.workerThreads()));
        return Vertx.vertx(options);
    }

    void disposeVertx(@Disposes Vertx vertx)
    {
        if (ownsVertx.get()) {
            vertx.close().toCompletionStage().toCompletableFuture().join();
        }
    }

    @Produces
    @Singleton
    public WorkerExecutor providerExecutor(Vertx vertx)
    {
        return vertx.createSharedWorkerExecutor(PROVIDER_POOL, Math.max(1, properties.network().workerThreads()));
    }

    void disposeProviderExecutor(@Disposes WorkerExecutor executor)
    {
        executor.close();
    }

    @Produces
    @Singleton
    public MetricsRegistry metricsRegistry() {
        return new MetricsRegistry();
    }
}
