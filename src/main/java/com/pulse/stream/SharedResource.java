package com.pulse.stream;

/**
 * Birden fazla bağımsız talep kaynağının paylaştığı, sayaçlı başlat/durdur
 * sözleşmesi. Her {@link #start()} çağrısı tam olarak bir {@link #stop()}
 * ile eşlenmelidir.
 */
public interface SharedResource
{
    void start();

    void stop();
}
