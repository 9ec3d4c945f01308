package com.pulse.hub;

/**
 * Kayıt defterinin gördüğü canlı izleyici bağlantısıdır. Taşıma katmanından
 * bağımsızdır; WebSocket uygulaması {@code com.pulse.net} paketindedir.
 */
public interface HubConnection
{
    String id();

    /**
     * Metni bağlantıya yazar. Bağlantı kapanmışsa ya da yazma başarısızsa
     * {@link RuntimeException} fırlatır.
     */
    void send(String text);

    void close();
}
