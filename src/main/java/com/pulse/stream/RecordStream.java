package com.pulse.stream;

import java.io.Closeable;
import java.io.IOException;

/**
 * Açık bir akış kaynağından kayıtları sırayla okur. {@link #next()} bir sonraki
 * kayıt gelene kadar bloklar, akış bittiğinde {@code null} döner.
 * {@link #close()} bekleyen okumayı da sonlandırmalıdır.
 */
public interface RecordStream<T> extends Closeable
{
    T next() throws IOException;

    @Override
    void close() throws IOException;
}
