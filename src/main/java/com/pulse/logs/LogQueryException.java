package com.pulse.logs;

/**
 * Geçmiş log sorgusu komutunun çalıştırılamadığını ya da hata koduyla
 * bittiğini bildirir.
 */
public class LogQueryException extends Exception
{
    public LogQueryException(String message) {
        super(message);
    }

    public LogQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
