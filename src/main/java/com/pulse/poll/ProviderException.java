package com.pulse.poll;

/**
 * Bir sağlayıcının veri üretemediğini bildirir. Zamanlayıcı bu hatayı loglar,
 * önbellekteki son değeri korur ve bir sonraki tikte yeniden dener.
 */
public class ProviderException extends Exception
{
    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
