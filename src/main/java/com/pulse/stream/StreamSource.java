package com.pulse.stream;

import java.io.IOException;

/**
 * Sürekli kayıt üreten harici kaynağı açan fabrika. Her {@link #open()}
 * çağrısı yeni ve bağımsız bir {@link RecordStream} döndürür.
 */
@FunctionalInterface
public interface StreamSource<T>
{
    RecordStream<T> open() throws IOException;
}
