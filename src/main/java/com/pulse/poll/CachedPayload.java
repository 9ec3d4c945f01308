package com.pulse.poll;

/**
 * Bir konu için en son yayınlanan serileştirilmiş veri ve kaydedildiği an.
 */
public record CachedPayload(String json, long timestamp) {}
