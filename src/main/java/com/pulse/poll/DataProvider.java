package com.pulse.poll;

/**
 * Yoklama ile beslenen bir konunun verisini üreten takılabilir sağlayıcı.
 * Çağrı bloklayıcı olabilir; zamanlayıcı onu worker thread üzerinde çalıştırır.
 */
@FunctionalInterface
public interface DataProvider<T>
{
    T fetch() throws ProviderException;
}
