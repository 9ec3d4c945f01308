package com.pulse.poll;

/**
 * Tek bir yoklama tikinin sonucu.
 */
public enum TickOutcome
{
    /** Konunun abonesi yok, sağlayıcı çağrılmadı. */
    IDLE,
    /** Aynı konunun önceki çağrısı hâlâ sürüyor. */
    BUSY,
    FAILED,
    UNCHANGED,
    BROADCAST
}
