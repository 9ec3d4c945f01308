package com.pulse.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.List;

/**
 * Uygulama yapılandırmasını tip güvenli okumak için kullanılan arayüzdür.
 * {@code application.properties} içindeki "hub" önekli değerleri ağ, yoklama
 * aralıkları, log akışı, servis listesi ve metrik raporlama başlıkları altında
 * gruplayarak bileşenlere sağlar.
 */
@ConfigMapping(prefix = "hub")
public interface HubProperties
{
    Network network();
    Poll poll();
    Logs logs();
    Services services();
    Metrics metrics();

    interface Network {
        @WithDefault("0.0.0.0")
        String host();

        @WithDefault("7227")
        int port();

        @WithDefault("/ws")
        String path();

        @WithDefault("0")
        int eventLoopThreads();

        @WithDefault("8")
        int workerThreads();
    }

    interface Poll {
        @WithDefault("5000")
        long systemIntervalMillis();

        @WithDefault("10000")
        long servicesIntervalMillis();

        @WithDefault("5000")
        long processesIntervalMillis();

        @WithDefault("200")
        int processLimit();
    }

    interface Logs {
        @WithDefault("1000")
        int bufferCapacity();

        @WithDefault("60000")
        long idleTimeoutMillis();

        @WithDefault("log,stream,--style,compact,--level,info")
        List<String> command();

        @WithDefault("100")
        int recentDefaultCount();

        @WithDefault("log,show,--style,compact")
        List<String> queryCommand();

        @WithDefault("500")
        int queryLimit();

        @WithDefault("/var/log,~/Library/Logs")
        List<String> sourceDirectories();
    }

    interface Services {
        @WithDefault("launchctl,list")
        List<String> command();
    }

    interface Metrics {
        @WithDefault("60")
        long reportIntervalSeconds();
    }
}
